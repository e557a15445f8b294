package fr.lapetina.llmgateway.infrastructure.provider;

import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderRequest;
import fr.lapetina.llmgateway.domain.model.ProviderResponse;
import fr.lapetina.llmgateway.domain.model.TestResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Client for one configured model of a provider family.
 *
 * Implementations must never complete the returned futures exceptionally:
 * transport errors, HTTP errors and unparseable bodies are all reported as a
 * {@link ProviderResponse} failure.
 */
public interface ProviderAdapter {

    /**
     * Returns the model configuration this adapter was created for.
     */
    ModelConfig config();

    /**
     * Sends a chat completion call.
     *
     * @param request provider-neutral call parameters
     * @return the normalized response, success or classified failure
     */
    CompletableFuture<ProviderResponse> complete(ProviderRequest request);

    /**
     * Sends a chat completion call and hands every piece of generated text to
     * {@code onDelta} as it arrives.
     *
     * <p>The default implementation completes the call in one piece and
     * delivers the whole content as a single delta.
     *
     * @param request provider-neutral call parameters
     * @param onDelta receives text deltas in order, on a transport thread
     * @return the assembled response, success or classified failure
     */
    default CompletableFuture<ProviderResponse> stream(ProviderRequest request, Consumer<String> onDelta) {
        return complete(request).thenApply(response -> {
            if (response.isSuccess() && response.content() != null && !response.content().isEmpty()) {
                onDelta.accept(response.content());
            }
            return response;
        });
    }

    /**
     * Issues the smallest useful call and reports whether the model answered.
     */
    default CompletableFuture<TestResult> test() {
        String modelId = config().getId();
        long start = System.nanoTime();
        return complete(ProviderRequest.check())
                .handle((response, ex) -> {
                    long latencyMs = (System.nanoTime() - start) / 1_000_000;
                    if (ex != null) {
                        return TestResult.failed(modelId, latencyMs, String.valueOf(ex.getMessage()));
                    }
                    if (response.isError()) {
                        return TestResult.failed(modelId, latencyMs,
                                response.errorType() + ": " + response.errorMessage());
                    }
                    return TestResult.passed(modelId, latencyMs);
                });
    }
}

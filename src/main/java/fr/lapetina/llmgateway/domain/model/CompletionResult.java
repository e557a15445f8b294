package fr.lapetina.llmgateway.domain.model;

import fr.lapetina.llmgateway.domain.exception.ProviderException;

import java.util.List;
import java.util.Objects;

/**
 * Successful gateway completion.
 *
 * @param model              the model that produced the content
 * @param routing            strategy, ranking and reason behind the selection
 * @param latencyMs          latency of the successful attempt
 * @param cost               cost of the successful attempt in USD
 * @param content            completion text
 * @param usage              tokens consumed by the successful attempt
 * @param recoveredFailures  failures of higher-ranked candidates, in attempt order
 */
public record CompletionResult(
        ModelConfig model,
        RoutingDecision routing,
        long latencyMs,
        double cost,
        String content,
        TokenUsage usage,
        List<ProviderException> recoveredFailures
) {
    public CompletionResult {
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(routing, "Routing decision is required");
        usage = usage != null ? usage : TokenUsage.EMPTY;
        recoveredFailures = recoveredFailures != null ? List.copyOf(recoveredFailures) : List.of();
    }

    public String modelId() {
        return model.getId();
    }
}

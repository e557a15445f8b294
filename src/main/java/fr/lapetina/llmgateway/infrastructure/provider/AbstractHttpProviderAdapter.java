package fr.lapetina.llmgateway.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.ProviderRequest;
import fr.lapetina.llmgateway.domain.model.ProviderResponse;
import fr.lapetina.llmgateway.domain.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base class for adapters talking JSON over HTTPS.
 *
 * Subclasses supply the wire format: how a request body and its headers are
 * built, how a 2xx body is turned into content and token usage, and how the
 * events of a server-sent event stream are read. Status and transport error
 * classification is shared.
 */
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProviderAdapter.class);

    protected final ModelConfig config;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final Duration requestTimeout;

    protected AbstractHttpProviderAdapter(
            ModelConfig config,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            Duration requestTimeout
    ) {
        this.config = Objects.requireNonNull(config, "Model config is required");
        this.httpClient = Objects.requireNonNull(httpClient, "HTTP client is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout is required");
    }

    @Override
    public ModelConfig config() {
        return config;
    }

    @Override
    public CompletableFuture<ProviderResponse> complete(ProviderRequest request) {
        if (!config.getApiKey().isPresent()) {
            return CompletableFuture.completedFuture(missingKey());
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, false);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(buildFailure(e));
        }

        long start = System.nanoTime();
        log.debug("Sending request: modelId={}, provider={}, endpoint={}",
                config.getId(), config.getProvider().id(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(response, start))
                .exceptionally(this::handleException);
    }

    /**
     * Streams the completion as server-sent events, read line by line.
     *
     * <p>Deltas already handed to {@code onDelta} stay delivered when the
     * stream fails later on; the returned response then reports the failure.
     */
    @Override
    public CompletableFuture<ProviderResponse> stream(ProviderRequest request, Consumer<String> onDelta) {
        Objects.requireNonNull(onDelta, "Delta consumer is required");
        if (!config.getApiKey().isPresent()) {
            return CompletableFuture.completedFuture(missingKey());
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, true);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(buildFailure(e));
        }

        long start = System.nanoTime();
        log.debug("Opening stream: modelId={}, provider={}, endpoint={}",
                config.getId(), config.getProvider().id(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines())
                .thenApply(response -> handleStream(response, onDelta, start))
                .exceptionally(this::handleException);
    }

    private ProviderResponse missingKey() {
        log.warn("No API key configured: modelId={}, provider={}", config.getId(), config.getProvider().id());
        return ProviderResponse.failure(config.getId(), ProviderErrorType.AUTH_ERROR,
                "No API key configured for provider " + config.getProvider().id());
    }

    private ProviderResponse buildFailure(Exception e) {
        log.error("Failed to build request: modelId={}", config.getId(), e);
        return ProviderResponse.failure(config.getId(), ProviderErrorType.SERVER_ERROR,
                "Failed to build request: " + e.getMessage());
    }

    private HttpRequest buildHttpRequest(ProviderRequest request, boolean stream) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint(completionPath()))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(
                        objectMapper.writeValueAsString(buildBody(request, stream))));
        if (stream) {
            builder.header("Accept", "text/event-stream");
        }
        addAuthHeaders(builder, config.getApiKey().reveal());
        return builder.build();
    }

    /**
     * Resolves a path against the model's effective base URL.
     */
    protected URI endpoint(String path) {
        String base = config.getEffectiveBaseUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    /**
     * Returns the completion path appended to the base URL, starting with a slash.
     */
    protected abstract String completionPath();

    /**
     * Builds the JSON body of a completion call.
     *
     * @param stream whether the provider is asked for a server-sent event stream
     */
    protected abstract Object buildBody(ProviderRequest request, boolean stream);

    /**
     * Adds authentication and version headers. Implementations must not log the key.
     */
    protected abstract void addAuthHeaders(HttpRequest.Builder builder, String apiKey);

    /**
     * Extracts the completion from a successful response body.
     *
     * @throws MalformedResponseException if the body lacks the expected content
     */
    protected abstract ParsedCompletion parseCompletion(JsonNode body);

    /**
     * Applies one {@code data:} event of a stream to the stream state.
     *
     * @throws MalformedResponseException if the event cannot be understood
     * @throws StreamFailureException     if the provider reports an error inside the stream
     */
    protected abstract void onStreamEvent(JsonNode event, StreamState state);

    private ProviderResponse handleResponse(HttpResponse<String> response, long start) {
        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            try {
                ParsedCompletion completion = parseCompletion(objectMapper.readTree(response.body()));
                log.debug("Request successful: modelId={}, status={}, latencyMs={}, tokens={}",
                        config.getId(), statusCode, latencyMs, completion.usage().totalTokens());
                return ProviderResponse.success(config.getId(), completion.content(), completion.usage());
            } catch (IOException | MalformedResponseException e) {
                log.warn("Malformed response: modelId={}, status={}, error={}",
                        config.getId(), statusCode, e.getMessage());
                return ProviderResponse.failure(config.getId(), ProviderErrorType.MALFORMED_RESPONSE,
                        "Malformed response: " + e.getMessage());
            }
        }

        return httpFailure(statusCode, response.body(), latencyMs);
    }

    private ProviderResponse handleStream(HttpResponse<Stream<String>> response, Consumer<String> onDelta, long start) {
        int statusCode = response.statusCode();
        try (Stream<String> lines = response.body()) {
            if (statusCode < 200 || statusCode >= 300) {
                String body = lines.collect(Collectors.joining("\n"));
                return httpFailure(statusCode, body, (System.nanoTime() - start) / 1_000_000);
            }

            StreamState state = new StreamState(onDelta);
            Iterator<String> iterator = lines.iterator();
            while (iterator.hasNext() && !state.isDone()) {
                String line = iterator.next();
                if (!line.startsWith("data:")) {
                    continue;
                }
                String data = line.substring("data:".length()).trim();
                if (data.isEmpty()) {
                    continue;
                }
                if ("[DONE]".equals(data)) {
                    break;
                }
                state.eventReceived();
                onStreamEvent(objectMapper.readTree(data), state);
            }

            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            if (!state.hasEvents()) {
                log.warn("Stream ended without events: modelId={}, latencyMs={}", config.getId(), latencyMs);
                return ProviderResponse.failure(config.getId(), ProviderErrorType.MALFORMED_RESPONSE,
                        "Malformed response: stream ended without events");
            }
            TokenUsage usage = state.usage();
            log.debug("Stream completed: modelId={}, latencyMs={}, deltas={}, tokens={}",
                    config.getId(), latencyMs, state.deltaCount(), usage.totalTokens());
            return ProviderResponse.success(config.getId(), state.content(), usage);
        } catch (IOException | MalformedResponseException e) {
            log.warn("Malformed stream event: modelId={}, error={}", config.getId(), e.getMessage());
            return ProviderResponse.failure(config.getId(), ProviderErrorType.MALFORMED_RESPONSE,
                    "Malformed response: " + e.getMessage());
        } catch (StreamFailureException e) {
            log.warn("Provider error inside stream: modelId={}, errorType={}, error={}",
                    config.getId(), e.getErrorType(), e.getMessage());
            return ProviderResponse.failure(config.getId(), e.getErrorType(), e.getMessage());
        } catch (UncheckedIOException e) {
            return handleException(e.getCause());
        }
    }

    private ProviderResponse httpFailure(int statusCode, String body, long latencyMs) {
        ProviderErrorType errorType = classifyStatus(statusCode);
        String errorMessage = extractErrorMessage(statusCode, body);
        log.warn("Request failed with HTTP error: modelId={}, status={}, errorType={}, latencyMs={}",
                config.getId(), statusCode, errorType, latencyMs);
        return ProviderResponse.failure(config.getId(), errorType, errorMessage);
    }

    private ProviderResponse handleException(Throwable ex) {
        Throwable cause = unwrap(ex);
        ProviderErrorType errorType = classifyException(cause);
        String message = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");

        if (errorType == ProviderErrorType.TIMEOUT) {
            log.warn("Request timeout: modelId={}, error={}", config.getId(), message);
        } else {
            log.warn("Provider connection error: modelId={}, error={}", config.getId(), message);
        }
        return ProviderResponse.failure(config.getId(), errorType, message);
    }

    static ProviderErrorType classifyStatus(int statusCode) {
        return switch (statusCode) {
            case 401, 403 -> ProviderErrorType.AUTH_ERROR;
            case 429 -> ProviderErrorType.RATE_LIMITED;
            case 408 -> ProviderErrorType.TIMEOUT;
            default -> ProviderErrorType.SERVER_ERROR;
        };
    }

    static ProviderErrorType classifyException(Throwable cause) {
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ProviderErrorType.TIMEOUT;
        }
        return ProviderErrorType.SERVER_ERROR;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String extractErrorMessage(int statusCode, String body) {
        String errorMessage = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return errorMessage;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return errorMessage + ": " + error.asText();
            }
            if (error.path("message").isTextual()) {
                return errorMessage + ": " + error.path("message").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: modelId={}, status={}", config.getId(), statusCode);
        }
        return errorMessage;
    }

    /**
     * Reads a non-negative token count, zero when absent.
     */
    protected static int tokens(JsonNode usage, String field) {
        JsonNode value = usage.path(field);
        return value.canConvertToInt() ? Math.max(0, value.asInt()) : 0;
    }

    /**
     * Content and usage extracted from a successful response.
     */
    protected record ParsedCompletion(String content, TokenUsage usage) {
    }

    /**
     * Accumulates the content and token usage of a stream while forwarding deltas.
     */
    protected static final class StreamState {
        private final Consumer<String> onDelta;
        private final StringBuilder content = new StringBuilder();
        private int promptTokens;
        private int completionTokens;
        private int deltaCount;
        private boolean events;
        private boolean done;

        StreamState(Consumer<String> onDelta) {
            this.onDelta = onDelta;
        }

        public void delta(String text) {
            if (text == null || text.isEmpty()) {
                return;
            }
            content.append(text);
            deltaCount++;
            onDelta.accept(text);
        }

        public void promptTokens(int tokens) {
            this.promptTokens = tokens;
        }

        public void completionTokens(int tokens) {
            this.completionTokens = tokens;
        }

        /**
         * Ends the read loop before the transport closes the stream.
         */
        public void done() {
            this.done = true;
        }

        void eventReceived() {
            this.events = true;
        }

        boolean isDone() {
            return done;
        }

        boolean hasEvents() {
            return events;
        }

        int deltaCount() {
            return deltaCount;
        }

        String content() {
            return content.toString();
        }

        TokenUsage usage() {
            return new TokenUsage(promptTokens, completionTokens);
        }
    }

    /**
     * Raised by {@link #onStreamEvent(JsonNode, StreamState)} for an error event sent by the provider.
     */
    protected static final class StreamFailureException extends RuntimeException {
        private final ProviderErrorType errorType;

        public StreamFailureException(ProviderErrorType errorType, String message) {
            super(message);
            this.errorType = errorType;
        }

        public ProviderErrorType getErrorType() {
            return errorType;
        }
    }

    /**
     * Raised by {@link #parseCompletion(JsonNode)} when a 2xx body cannot be understood.
     */
    protected static final class MalformedResponseException extends RuntimeException {
        public MalformedResponseException(String message) {
            super(message);
        }
    }
}

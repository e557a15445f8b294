package fr.lapetina.llmgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llmgateway.domain.exception.ProviderException;
import fr.lapetina.llmgateway.domain.model.CompletionResult;

import java.util.List;

/**
 * Completion response body, including the routing explanation and the
 * failures recovered by failover.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiCompletionResponse {

    private String model;
    private String provider;
    private String content;
    private String strategy;
    private String reason;
    private List<String> ranked;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("cost_usd")
    private double costUsd;

    private Usage usage;
    private List<Failure> failover;

    // Getters and setters
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public List<String> getRanked() { return ranked; }
    public void setRanked(List<String> ranked) { this.ranked = ranked; }

    public long getLatencyMs() { return latencyMs; }
    public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }

    public double getCostUsd() { return costUsd; }
    public void setCostUsd(double costUsd) { this.costUsd = costUsd; }

    public Usage getUsage() { return usage; }
    public void setUsage(Usage usage) { this.usage = usage; }

    public List<Failure> getFailover() { return failover; }
    public void setFailover(List<Failure> failover) { this.failover = failover; }

    /**
     * Creates API response from domain result.
     */
    public static ApiCompletionResponse fromResult(CompletionResult result) {
        ApiCompletionResponse api = new ApiCompletionResponse();
        api.setModel(result.modelId());
        api.setProvider(result.model().getProvider().id());
        api.setContent(result.content());
        api.setStrategy(result.routing().strategy().id());
        api.setReason(result.routing().reason());
        api.setRanked(result.routing().rankedIds());
        api.setLatencyMs(result.latencyMs());
        api.setCostUsd(result.cost());

        Usage usage = new Usage();
        usage.setPromptTokens(result.usage().promptTokens());
        usage.setCompletionTokens(result.usage().completionTokens());
        usage.setTotalTokens(result.usage().totalTokens());
        api.setUsage(usage);

        api.setFailover(result.recoveredFailures().stream().map(Failure::from).toList());
        return api;
    }

    public static class Usage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;

        @JsonProperty("completion_tokens")
        private int completionTokens;

        @JsonProperty("total_tokens")
        private int totalTokens;

        public int getPromptTokens() { return promptTokens; }
        public void setPromptTokens(int promptTokens) { this.promptTokens = promptTokens; }

        public int getCompletionTokens() { return completionTokens; }
        public void setCompletionTokens(int completionTokens) { this.completionTokens = completionTokens; }

        public int getTotalTokens() { return totalTokens; }
        public void setTotalTokens(int totalTokens) { this.totalTokens = totalTokens; }
    }

    /**
     * One failed attempt, as reported in a response or an error body.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Failure {
        private String model;

        @JsonProperty("error_type")
        private String errorType;

        private String message;

        @JsonProperty("latency_ms")
        private long latencyMs;

        public static Failure from(ProviderException e) {
            Failure failure = new Failure();
            failure.setModel(e.getModelId());
            failure.setErrorType(e.getErrorType().name());
            failure.setMessage(e.getMessage());
            failure.setLatencyMs(e.getLatencyMs());
            return failure;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getErrorType() { return errorType; }
        public void setErrorType(String errorType) { this.errorType = errorType; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public long getLatencyMs() { return latencyMs; }
        public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }
    }
}

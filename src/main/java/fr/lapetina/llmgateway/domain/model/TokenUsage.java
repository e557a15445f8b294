package fr.lapetina.llmgateway.domain.model;

/**
 * Token counts reported by a provider for one completion.
 */
public record TokenUsage(int promptTokens, int completionTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0);

    public TokenUsage {
        promptTokens = Math.max(0, promptTokens);
        completionTokens = Math.max(0, completionTokens);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}

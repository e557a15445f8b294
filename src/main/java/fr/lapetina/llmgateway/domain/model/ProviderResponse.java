package fr.lapetina.llmgateway.domain.model;

import java.util.Objects;

/**
 * Normalized outcome of one provider call: either content with token usage,
 * or a classified failure. Adapters report every outcome through this type
 * instead of throwing.
 */
public record ProviderResponse(
        String modelId,
        String content,
        TokenUsage usage,
        ProviderErrorType errorType,
        String errorMessage
) {
    public ProviderResponse {
        Objects.requireNonNull(modelId, "Model ID is required");
        if (usage == null) {
            usage = TokenUsage.EMPTY;
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public static ProviderResponse success(String modelId, String content, TokenUsage usage) {
        return new ProviderResponse(modelId, content, usage, null, null);
    }

    public static ProviderResponse failure(String modelId, ProviderErrorType errorType, String errorMessage) {
        Objects.requireNonNull(errorType, "Error type is required");
        return new ProviderResponse(modelId, null, TokenUsage.EMPTY, errorType, errorMessage);
    }
}

package fr.lapetina.llmgateway.domain.model;

import java.util.List;

/**
 * Provider-neutral call parameters handed to an adapter.
 * Request overrides win over model defaults.
 */
public record ProviderRequest(List<ChatMessage> messages, Double temperature, Integer maxTokens) {

    private static final int CHECK_MAX_TOKENS = 8;

    public ProviderRequest {
        messages = List.copyOf(messages);
    }

    public static ProviderRequest from(CompletionRequest request, ModelConfig model) {
        return new ProviderRequest(
                request.effectiveMessages(),
                request.temperature() != null ? request.temperature() : model.getTemperature(),
                request.maxTokens() != null ? request.maxTokens() : model.getMaxTokens()
        );
    }

    /**
     * Smallest useful call, used for connectivity checks.
     */
    public static ProviderRequest check() {
        return new ProviderRequest(List.of(ChatMessage.user("Hi")), null, CHECK_MAX_TOKENS);
    }
}

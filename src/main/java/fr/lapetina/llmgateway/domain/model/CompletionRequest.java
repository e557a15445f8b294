package fr.lapetina.llmgateway.domain.model;

import fr.lapetina.llmgateway.domain.exception.ValidationException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A chat completion request submitted to the gateway.
 * Immutable and validated on construction.
 *
 * @param messages             ordered conversation, never empty
 * @param strategy             routing policy, defaults to {@link RoutingStrategy#SMART}
 * @param model                explicit model id that bypasses routing, or null
 * @param temperature          sampling temperature override, or null for the model default
 * @param maxTokens            completion length override, or null for the model default
 * @param systemPrompt         system prompt prepended to the conversation, or null
 * @param requiredCapabilities capabilities every candidate must carry
 */
public record CompletionRequest(
        List<ChatMessage> messages,
        RoutingStrategy strategy,
        String model,
        Double temperature,
        Integer maxTokens,
        String systemPrompt,
        Set<ModelCapability> requiredCapabilities
) {
    public CompletionRequest {
        if (messages == null || messages.isEmpty()) {
            throw new ValidationException("At least one message is required");
        }
        for (ChatMessage message : messages) {
            if (message == null) {
                throw new ValidationException("Messages must not contain null entries");
            }
            if (!message.hasKnownRole()) {
                throw new ValidationException("Unknown message role: " + message.role());
            }
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new ValidationException("maxTokens must be positive, got " + maxTokens);
        }
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new ValidationException("temperature must be within [0, 2], got " + temperature);
        }
        if (model != null && model.isBlank()) {
            model = null;
        }
        if (systemPrompt != null && systemPrompt.isBlank()) {
            systemPrompt = null;
        }
        messages = List.copyOf(messages);
        strategy = strategy != null ? strategy : RoutingStrategy.SMART;
        requiredCapabilities = requiredCapabilities == null || requiredCapabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(requiredCapabilities));
    }

    public Optional<String> explicitModel() {
        return Optional.ofNullable(model);
    }

    /**
     * Returns the messages as sent to a provider, with the system prompt first when one is set.
     */
    public List<ChatMessage> effectiveMessages() {
        if (systemPrompt == null) {
            return messages;
        }
        List<ChatMessage> result = new ArrayList<>(messages.size() + 1);
        result.add(ChatMessage.system(systemPrompt));
        result.addAll(messages);
        return List.copyOf(result);
    }

    public CompletionRequest withStrategy(RoutingStrategy newStrategy) {
        return new CompletionRequest(messages, newStrategy, model, temperature, maxTokens,
                systemPrompt, requiredCapabilities);
    }

    /**
     * Creates a routed request with a single user message.
     */
    public static CompletionRequest ofPrompt(RoutingStrategy strategy, String prompt) {
        return new CompletionRequest(List.of(ChatMessage.user(prompt)), strategy, null, null, null, null, null);
    }

    /**
     * Creates a routed request from a conversation.
     */
    public static CompletionRequest ofMessages(RoutingStrategy strategy, List<ChatMessage> messages) {
        return new CompletionRequest(messages, strategy, null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<ChatMessage> messages = new ArrayList<>();
        private RoutingStrategy strategy;
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private String systemPrompt;
        private final Set<ModelCapability> requiredCapabilities = EnumSet.noneOf(ModelCapability.class);

        public Builder addMessage(ChatMessage message) {
            this.messages.add(message);
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages.clear();
            if (messages != null) {
                this.messages.addAll(messages);
            }
            return this;
        }

        public Builder strategy(RoutingStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder requireCapability(ModelCapability capability) {
            this.requiredCapabilities.add(capability);
            return this;
        }

        public CompletionRequest build() {
            return new CompletionRequest(messages, strategy, model, temperature, maxTokens,
                    systemPrompt, requiredCapabilities);
        }
    }
}

package fr.lapetina.llmgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.llmgateway.domain.exception.ValidationException;
import fr.lapetina.llmgateway.domain.model.ChatMessage;
import fr.lapetina.llmgateway.domain.model.CompletionRequest;
import fr.lapetina.llmgateway.domain.model.ModelCapability;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Completion request body. Either {@code messages} or the {@code prompt}
 * shorthand (a single user message) must be present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiCompletionRequest {

    private List<Message> messages;
    private String prompt;
    private String strategy;
    private String model;
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("system_prompt")
    private String systemPrompt;

    private List<String> capabilities;
    private Boolean stream;

    // Getters and setters
    public List<Message> getMessages() { return messages; }
    public void setMessages(List<Message> messages) { this.messages = messages; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    public String getSystemPrompt() { return systemPrompt; }
    public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }

    public List<String> getCapabilities() { return capabilities; }
    public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }

    public Boolean getStream() { return stream; }
    public void setStream(Boolean stream) { this.stream = stream; }

    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }

    /**
     * Converts to the domain request.
     *
     * @param defaultStrategy strategy used when the body names none
     * @throws ValidationException on an unknown strategy or capability, or a malformed conversation
     */
    public CompletionRequest toCompletionRequest(RoutingStrategy defaultStrategy) {
        CompletionRequest.Builder builder = CompletionRequest.builder()
                .messages(toChatMessages())
                .strategy(parseStrategy(defaultStrategy))
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .systemPrompt(systemPrompt);
        if (capabilities != null) {
            for (String tag : capabilities) {
                builder.requireCapability(ModelCapability.fromTag(tag)
                        .orElseThrow(() -> new ValidationException("Unknown capability: " + tag)));
            }
        }
        return builder.build();
    }

    /**
     * Returns the conversation as domain messages.
     */
    public List<ChatMessage> toChatMessages() {
        List<ChatMessage> result = new ArrayList<>();
        if (messages != null) {
            for (Message message : messages) {
                if (message == null || message.getRole() == null || message.getContent() == null) {
                    throw new ValidationException("Every message needs a role and a content");
                }
                result.add(new ChatMessage(message.getRole(), message.getContent()));
            }
        }
        if (result.isEmpty() && prompt != null && !prompt.isBlank()) {
            result.add(ChatMessage.user(prompt));
        }
        if (result.isEmpty()) {
            throw new ValidationException("Either 'messages' or 'prompt' is required");
        }
        return result;
    }

    private RoutingStrategy parseStrategy(RoutingStrategy defaultStrategy) {
        if (strategy == null || strategy.isBlank()) {
            return defaultStrategy;
        }
        return RoutingStrategy.fromId(strategy)
                .orElseThrow(() -> new ValidationException("Unknown strategy: " + strategy
                        + ". Available: smart, cost, speed, priority"));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;

        public Message() {
        }

        public Message(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }
}

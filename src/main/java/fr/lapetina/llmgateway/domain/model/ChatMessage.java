package fr.lapetina.llmgateway.domain.model;

import java.util.Objects;
import java.util.Set;

/**
 * A single conversation turn.
 */
public record ChatMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    private static final Set<String> ROLES = Set.of(SYSTEM, USER, ASSISTANT, TOOL);

    public ChatMessage {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    public boolean hasKnownRole() {
        return ROLES.contains(role);
    }

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }

    public boolean isTool() {
        return TOOL.equals(role);
    }
}

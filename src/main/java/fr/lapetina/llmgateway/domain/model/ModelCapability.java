package fr.lapetina.llmgateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Capability tags a model can advertise.
 */
public enum ModelCapability {
    CHAT("chat"),
    REASONING("reasoning"),
    CODE("code"),
    VISION("vision"),
    FUNCTION_CALLING("function_calling");

    private final String tag;

    ModelCapability(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<ModelCapability> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ModelCapability capability : values()) {
            if (capability.tag.equals(normalized)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}

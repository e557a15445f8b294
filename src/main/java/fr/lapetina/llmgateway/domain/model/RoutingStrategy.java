package fr.lapetina.llmgateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Routing policies a caller can request.
 */
public enum RoutingStrategy {
    SMART,
    COST,
    SPEED,
    PRIORITY;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoutingStrategy> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(id.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

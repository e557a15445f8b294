package fr.lapetina.llmgateway.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a routing policy: candidates in dispatch order and why the first one leads.
 */
public record RoutingDecision(RoutingStrategy strategy, List<String> rankedIds, String reason) {

    public RoutingDecision {
        Objects.requireNonNull(strategy, "Strategy is required");
        Objects.requireNonNull(reason, "Reason is required");
        rankedIds = List.copyOf(rankedIds);
    }

    public String topCandidate() {
        return rankedIds.isEmpty() ? null : rankedIds.get(0);
    }
}

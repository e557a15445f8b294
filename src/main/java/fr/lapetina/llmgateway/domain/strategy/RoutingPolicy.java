package fr.lapetina.llmgateway.domain.strategy;

import fr.lapetina.llmgateway.domain.model.CompletionRequest;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.RoutingDecision;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.stats.StatsSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Ranks candidate models for a request.
 *
 * Implementations are pure functions of their inputs and hold no mutable
 * state, so one instance serves concurrent callers.
 */
public interface RoutingPolicy {

    /**
     * Returns the strategy this policy implements.
     */
    RoutingStrategy strategy();

    /**
     * Orders every candidate from most to least preferred.
     *
     * @param request    the request being routed
     * @param candidates enabled models in registry insertion order, never empty
     * @param stats      statistics keyed by model id; missing entries mean no history
     * @return ranking covering all candidates, with the reason the first one leads
     */
    RoutingDecision rank(CompletionRequest request, List<ModelConfig> candidates, Map<String, StatsSnapshot> stats);

    static StatsSnapshot statsOf(Map<String, StatsSnapshot> stats, ModelConfig model) {
        StatsSnapshot snapshot = stats.get(model.getId());
        return snapshot != null ? snapshot : StatsSnapshot.empty(model.getId());
    }

    static String describeCount(int candidates) {
        return candidates == 1 ? "1 enabled model" : candidates + " enabled models";
    }
}

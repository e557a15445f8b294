package fr.lapetina.llmgateway.domain.strategy;

import fr.lapetina.llmgateway.domain.model.CompletionRequest;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.RoutingDecision;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.stats.StatsSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ranks by configured priority, lower first. The sort is stable, so models
 * sharing a priority keep their registry insertion order.
 */
public final class PriorityRoutingPolicy implements RoutingPolicy {

    @Override
    public RoutingStrategy strategy() {
        return RoutingStrategy.PRIORITY;
    }

    @Override
    public RoutingDecision rank(CompletionRequest request, List<ModelConfig> candidates, Map<String, StatsSnapshot> stats) {
        List<ModelConfig> ranked = byPriority(candidates);
        ModelConfig top = ranked.get(0);
        String reason = String.format(Locale.ROOT, "highest configured priority (%d) among %s",
                top.getPriority(), RoutingPolicy.describeCount(candidates.size()));
        return new RoutingDecision(strategy(), ids(ranked), reason);
    }

    static List<ModelConfig> byPriority(List<ModelConfig> candidates) {
        List<ModelConfig> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingInt(ModelConfig::getPriority));
        return ranked;
    }

    static List<String> ids(List<ModelConfig> models) {
        return models.stream().map(ModelConfig::getId).toList();
    }
}

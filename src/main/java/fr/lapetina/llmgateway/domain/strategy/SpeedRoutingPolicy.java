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
 * Ranks by average latency over the stats window, fastest first.
 *
 * Models without samples rank after every sampled model. Without any
 * samples at all the ranking is the priority ranking.
 */
public final class SpeedRoutingPolicy implements RoutingPolicy {

    @Override
    public RoutingStrategy strategy() {
        return RoutingStrategy.SPEED;
    }

    @Override
    public RoutingDecision rank(CompletionRequest request, List<ModelConfig> candidates, Map<String, StatsSnapshot> stats) {
        // Priority order first; the latency sort below is stable and keeps it for ties.
        List<ModelConfig> ranked = new ArrayList<>(PriorityRoutingPolicy.byPriority(candidates));

        long sampled = ranked.stream()
                .filter(model -> RoutingPolicy.statsOf(stats, model).hasLatencySamples())
                .count();

        if (sampled == 0) {
            String reason = String.format(Locale.ROOT, "no latency samples yet, using configured priority among %s",
                    RoutingPolicy.describeCount(candidates.size()));
            return new RoutingDecision(strategy(), PriorityRoutingPolicy.ids(ranked), reason);
        }

        ranked.sort(Comparator.comparingDouble(model -> latencyOf(stats, model)));

        ModelConfig top = ranked.get(0);
        StringBuilder reason = new StringBuilder(String.format(Locale.ROOT, "lowest average latency (%.0f ms) among %s",
                latencyOf(stats, top), RoutingPolicy.describeCount(candidates.size())));
        long unsampled = candidates.size() - sampled;
        if (unsampled > 0) {
            reason.append(", ").append(unsampled).append(" without samples ranked last");
        }
        return new RoutingDecision(strategy(), PriorityRoutingPolicy.ids(ranked), reason.toString());
    }

    private static double latencyOf(Map<String, StatsSnapshot> stats, ModelConfig model) {
        return RoutingPolicy.statsOf(stats, model).averageLatencyMs().orElse(Double.POSITIVE_INFINITY);
    }
}

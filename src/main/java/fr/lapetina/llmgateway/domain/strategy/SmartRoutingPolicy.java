package fr.lapetina.llmgateway.domain.strategy;

import fr.lapetina.llmgateway.domain.model.CompletionRequest;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ModelPrice;
import fr.lapetina.llmgateway.domain.model.PriceTable;
import fr.lapetina.llmgateway.domain.model.RoutingDecision;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.stats.StatsSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Composite ranking over latency, reliability, price and priority.
 *
 * <p>Each metric is normalized to [0, 1] across the candidates, then combined:
 * <pre>
 * score = 0.35 * latency + 0.30 * errorRate + 0.20 * cost + 0.15 * priority
 * </pre>
 * Lowest score wins. A model without latency samples or without a price gets
 * the worst value (1.0) for that metric. When no candidate has any recorded
 * outcome the ranking is the priority ranking.
 */
public final class SmartRoutingPolicy implements RoutingPolicy {

    public static final double LATENCY_WEIGHT = 0.35;
    public static final double ERROR_RATE_WEIGHT = 0.30;
    public static final double COST_WEIGHT = 0.20;
    public static final double PRIORITY_WEIGHT = 0.15;

    private final PriceTable prices;

    public SmartRoutingPolicy(PriceTable prices) {
        this.prices = Objects.requireNonNull(prices, "Price table is required");
    }

    @Override
    public RoutingStrategy strategy() {
        return RoutingStrategy.SMART;
    }

    @Override
    public RoutingDecision rank(CompletionRequest request, List<ModelConfig> candidates, Map<String, StatsSnapshot> stats) {
        List<ModelConfig> ranked = new ArrayList<>(PriorityRoutingPolicy.byPriority(candidates));

        boolean anyHistory = candidates.stream()
                .anyMatch(model -> RoutingPolicy.statsOf(stats, model).totalAttempts() > 0);
        if (!anyHistory) {
            String reason = String.format(Locale.ROOT, "no recorded outcomes yet, using configured priority among %s",
                    RoutingPolicy.describeCount(candidates.size()));
            return new RoutingDecision(strategy(), PriorityRoutingPolicy.ids(ranked), reason);
        }

        Map<String, Score> scores = score(candidates, stats);
        ranked.sort(Comparator.comparingDouble(model -> scores.get(model.getId()).total()));

        Score top = scores.get(ranked.get(0).getId());
        StringBuilder reason = new StringBuilder(String.format(Locale.ROOT, "lowest composite score (%.3f) among %s",
                top.total(), RoutingPolicy.describeCount(candidates.size())));
        if (ranked.size() > 1) {
            Score runnerUp = scores.get(ranked.get(1).getId());
            reason.append(", decided by ").append(top.decisiveMetric(runnerUp));
        }
        return new RoutingDecision(strategy(), PriorityRoutingPolicy.ids(ranked), reason.toString());
    }

    private Map<String, Score> score(List<ModelConfig> candidates, Map<String, StatsSnapshot> stats) {
        double maxLatency = 0;
        double maxPrice = 0;
        int minPriority = Integer.MAX_VALUE;
        int maxPriority = Integer.MIN_VALUE;

        for (ModelConfig model : candidates) {
            OptionalDouble latency = RoutingPolicy.statsOf(stats, model).averageLatencyMs();
            if (latency.isPresent()) {
                maxLatency = Math.max(maxLatency, latency.getAsDouble());
            }
            double price = prices.priceOf(model).map(ModelPrice::combinedPerMillion).orElse(0d);
            maxPrice = Math.max(maxPrice, price);
            minPriority = Math.min(minPriority, model.getPriority());
            maxPriority = Math.max(maxPriority, model.getPriority());
        }

        Map<String, Score> scores = new HashMap<>();
        for (ModelConfig model : candidates) {
            StatsSnapshot snapshot = RoutingPolicy.statsOf(stats, model);

            OptionalDouble latency = snapshot.averageLatencyMs();
            double latencyScore = latency.isEmpty() ? 1.0
                    : maxLatency == 0 ? 0.0 : latency.getAsDouble() / maxLatency;

            OptionalDouble price = prices.priceOf(model)
                    .map(p -> OptionalDouble.of(p.combinedPerMillion()))
                    .orElse(OptionalDouble.empty());
            double costScore = price.isEmpty() ? 1.0
                    : maxPrice == 0 ? 0.0 : price.getAsDouble() / maxPrice;

            double priorityScore = maxPriority == minPriority ? 0.0
                    : (double) ((long) model.getPriority() - minPriority) / ((long) maxPriority - minPriority);

            scores.put(model.getId(), new Score(latencyScore, snapshot.errorRate(), costScore, priorityScore));
        }
        return scores;
    }

    /**
     * Normalized metrics of one candidate.
     */
    record Score(double latency, double errorRate, double cost, double priority) {

        double total() {
            return LATENCY_WEIGHT * latency
                    + ERROR_RATE_WEIGHT * errorRate
                    + COST_WEIGHT * cost
                    + PRIORITY_WEIGHT * priority;
        }

        /**
         * Names the weighted metric with the largest lead over the runner-up.
         */
        String decisiveMetric(Score other) {
            String metric = "configured priority";
            double best = PRIORITY_WEIGHT * (other.priority - priority);

            double latencyLead = LATENCY_WEIGHT * (other.latency - latency);
            if (latencyLead > best) {
                best = latencyLead;
                metric = "average latency";
            }
            double errorLead = ERROR_RATE_WEIGHT * (other.errorRate - errorRate);
            if (errorLead > best) {
                best = errorLead;
                metric = "error rate";
            }
            double costLead = COST_WEIGHT * (other.cost - cost);
            if (costLead > best) {
                metric = "price";
            }
            return metric;
        }
    }
}

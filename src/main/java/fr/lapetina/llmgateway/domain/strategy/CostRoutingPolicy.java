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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks by configured token price, cheapest first.
 *
 * Price is input plus output USD per million tokens. Unpriced models rank
 * last; ties fall back to priority, then insertion order.
 */
public final class CostRoutingPolicy implements RoutingPolicy {

    private final PriceTable prices;

    public CostRoutingPolicy(PriceTable prices) {
        this.prices = Objects.requireNonNull(prices, "Price table is required");
    }

    @Override
    public RoutingStrategy strategy() {
        return RoutingStrategy.COST;
    }

    @Override
    public RoutingDecision rank(CompletionRequest request, List<ModelConfig> candidates, Map<String, StatsSnapshot> stats) {
        List<ModelConfig> ranked = new ArrayList<>(PriorityRoutingPolicy.byPriority(candidates));
        ranked.sort(Comparator.comparingDouble(this::priceOf));

        ModelConfig top = ranked.get(0);
        double topPrice = priceOf(top);
        String reason;
        if (Double.isInfinite(topPrice)) {
            reason = String.format(Locale.ROOT, "no prices configured, using configured priority among %s",
                    RoutingPolicy.describeCount(candidates.size()));
        } else {
            reason = String.format(Locale.ROOT, "lowest price (%.2f USD per 1M tokens) among %s",
                    topPrice, RoutingPolicy.describeCount(candidates.size()));
        }
        return new RoutingDecision(strategy(), PriorityRoutingPolicy.ids(ranked), reason);
    }

    private double priceOf(ModelConfig model) {
        return prices.priceOf(model)
                .map(ModelPrice::combinedPerMillion)
                .orElse(Double.POSITIVE_INFINITY);
    }
}

package fr.lapetina.llmgateway.domain.strategy;

import fr.lapetina.llmgateway.domain.model.PriceTable;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * The routing policy for each {@link RoutingStrategy}.
 *
 * Built once per gateway from its price table. A custom policy can replace
 * a built-in one through {@link #register(RoutingPolicy)} before the gateway
 * starts serving.
 */
public final class RoutingPolicies {

    private final Map<RoutingStrategy, RoutingPolicy> policies = new EnumMap<>(RoutingStrategy.class);

    public RoutingPolicies(PriceTable prices) {
        register(new SmartRoutingPolicy(prices));
        register(new CostRoutingPolicy(prices));
        register(new SpeedRoutingPolicy());
        register(new PriorityRoutingPolicy());
    }

    public RoutingPolicies register(RoutingPolicy policy) {
        policies.put(policy.strategy(), policy);
        return this;
    }

    public RoutingPolicy get(RoutingStrategy strategy) {
        RoutingPolicy policy = policies.get(strategy);
        if (policy == null) {
            throw new IllegalStateException("No routing policy registered for " + strategy);
        }
        return policy;
    }

    public Set<RoutingStrategy> strategies() {
        return policies.keySet();
    }
}

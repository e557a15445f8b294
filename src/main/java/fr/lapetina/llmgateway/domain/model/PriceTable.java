package fr.lapetina.llmgateway.domain.model;

import java.util.Map;
import java.util.Optional;

/**
 * Configuration-supplied prices. A model-specific entry wins over the
 * entry of its provider family.
 */
public final class PriceTable {

    private static final PriceTable EMPTY = new PriceTable(Map.of(), Map.of());

    private final Map<String, ModelPrice> byModel;
    private final Map<ProviderType, ModelPrice> byProvider;

    public PriceTable(Map<String, ModelPrice> byModel, Map<ProviderType, ModelPrice> byProvider) {
        this.byModel = Map.copyOf(byModel);
        this.byProvider = Map.copyOf(byProvider);
    }

    public static PriceTable empty() {
        return EMPTY;
    }

    public Optional<ModelPrice> priceOf(ModelConfig model) {
        ModelPrice price = byModel.get(model.getId());
        if (price == null) {
            price = byProvider.get(model.getProvider());
        }
        return Optional.ofNullable(price);
    }

    /**
     * Cost of a completion in USD, zero when the model has no price.
     */
    public double costOf(ModelConfig model, TokenUsage usage) {
        return priceOf(model).map(price -> price.costOf(usage)).orElse(0d);
    }

    public int size() {
        return byModel.size() + byProvider.size();
    }
}

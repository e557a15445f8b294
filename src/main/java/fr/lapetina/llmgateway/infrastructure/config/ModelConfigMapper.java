package fr.lapetina.llmgateway.infrastructure.config;

import fr.lapetina.llmgateway.domain.exception.ValidationException;
import fr.lapetina.llmgateway.domain.model.ModelCapability;
import fr.lapetina.llmgateway.domain.model.ModelCatalog;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ModelPrice;
import fr.lapetina.llmgateway.domain.model.PriceTable;
import fr.lapetina.llmgateway.domain.model.ProviderType;
import fr.lapetina.llmgateway.domain.model.SecretReference;
import fr.lapetina.llmgateway.infrastructure.credentials.CredentialStore;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns configuration entries into domain objects.
 *
 * API keys are resolved here, once: an explicit {@code apiKey} wins over the
 * credential store. Missing display name and context length are taken from
 * {@link ModelCatalog} when the model is a known one.
 */
public final class ModelConfigMapper {

    private final CredentialStore credentials;

    public ModelConfigMapper(CredentialStore credentials) {
        this.credentials = credentials;
    }

    /**
     * @throws ValidationException if the provider or a capability is unknown,
     *         or the base URL is not an absolute http(s) URL
     */
    public ModelConfig toModelConfig(GatewayConfig.ModelEntry entry) {
        if (entry.getId() == null || entry.getId().isBlank()) {
            throw new ValidationException("Model ID is required");
        }
        ProviderType provider = ProviderType.fromId(entry.getProvider())
                .orElseThrow(() -> new ValidationException(
                        "Unknown provider '" + entry.getProvider() + "' for model " + entry.getId()));

        String modelName = entry.getModelName() == null || entry.getModelName().isBlank()
                ? entry.getId() : entry.getModelName();
        if (entry.getContextLength() != null && entry.getContextLength() <= 0) {
            throw new ValidationException("contextLength must be positive for model " + entry.getId());
        }
        Optional<ModelCatalog.Metadata> known = ModelCatalog.lookup(entry.getId(), modelName);

        return ModelConfig.builder()
                .id(entry.getId())
                .provider(provider)
                .modelName(modelName)
                .apiKey(resolveKey(entry.getApiKey(), provider))
                .baseUrl(parseBaseUrl(entry.getBaseUrl(), entry.getId()))
                .priority(entry.getPriority())
                .enabled(entry.isEnabled())
                .capabilities(parseCapabilities(entry.getCapabilities(), entry.getId()))
                .maxTokens(entry.getMaxTokens())
                .temperature(entry.getTemperature())
                .contextLength(entry.getContextLength() != null
                        ? entry.getContextLength()
                        : known.map(ModelCatalog.Metadata::contextLength).orElse(null))
                .displayName(entry.getDisplayName() != null && !entry.getDisplayName().isBlank()
                        ? entry.getDisplayName()
                        : known.map(ModelCatalog.Metadata::displayName).orElse(null))
                .build();
    }

    public List<ModelConfig> toModelConfigs(List<GatewayConfig.ModelEntry> entries) {
        return entries.stream().map(this::toModelConfig).toList();
    }

    private SecretReference resolveKey(String explicitKey, ProviderType provider) {
        if (explicitKey != null && !explicitKey.isBlank()) {
            return SecretReference.of(explicitKey);
        }
        return credentials.get(provider.id())
                .map(SecretReference::of)
                .orElse(SecretReference.empty());
    }

    static URI parseBaseUrl(String value, String modelId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid baseUrl '" + value + "' for model " + modelId + ": " + e.getReason());
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
            throw new ValidationException("Invalid baseUrl '" + value + "' for model " + modelId
                    + ": expected an absolute http or https URL");
        }
        return uri;
    }

    static Set<ModelCapability> parseCapabilities(List<String> tags, String modelId) {
        Set<ModelCapability> capabilities = EnumSet.noneOf(ModelCapability.class);
        if (tags == null) {
            return capabilities;
        }
        for (String tag : tags) {
            capabilities.add(ModelCapability.fromTag(tag)
                    .orElseThrow(() -> new ValidationException(
                            "Unknown capability '" + tag + "' for model " + modelId)));
        }
        return capabilities;
    }

    /**
     * Builds the price table. A key naming a provider family prices every
     * model of that family; any other key is a model id.
     */
    public static PriceTable toPriceTable(Map<String, GatewayConfig.PriceEntry> prices) {
        if (prices == null || prices.isEmpty()) {
            return PriceTable.empty();
        }
        Map<String, ModelPrice> byModel = new HashMap<>();
        Map<ProviderType, ModelPrice> byProvider = new EnumMap<>(ProviderType.class);
        for (Map.Entry<String, GatewayConfig.PriceEntry> entry : prices.entrySet()) {
            GatewayConfig.PriceEntry value = entry.getValue();
            if (value == null) {
                continue;
            }
            ModelPrice price;
            try {
                price = new ModelPrice(value.getInput(), value.getOutput());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid price for " + entry.getKey() + ": " + e.getMessage());
            }
            ProviderType.fromId(entry.getKey()).ifPresentOrElse(
                    provider -> byProvider.put(provider, price),
                    () -> byModel.put(entry.getKey(), price));
        }
        return new PriceTable(byModel, byProvider);
    }
}

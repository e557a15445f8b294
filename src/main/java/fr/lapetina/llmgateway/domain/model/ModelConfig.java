package fr.lapetina.llmgateway.domain.model;

import java.net.URI;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a single routable model.
 *
 * Immutable. Enabling or disabling a model produces a copy through
 * {@link #withEnabled(boolean)} which the registry swaps in place.
 */
public final class ModelConfig {
    private final String id;
    private final ProviderType provider;
    private final String modelName;
    private final SecretReference apiKey;
    private final URI baseUrl;
    private final int priority;
    private final boolean enabled;
    private final Set<ModelCapability> capabilities;
    private final Integer maxTokens;
    private final Double temperature;
    private final Integer contextLength;
    private final String displayName;

    private ModelConfig(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Model ID is required");
        this.provider = Objects.requireNonNull(builder.provider, "Provider is required");
        this.modelName = builder.modelName != null ? builder.modelName : builder.id;
        this.apiKey = builder.apiKey != null ? builder.apiKey : SecretReference.empty();
        this.baseUrl = builder.baseUrl;
        this.priority = builder.priority;
        this.enabled = builder.enabled;
        Set<ModelCapability> copy = EnumSet.noneOf(ModelCapability.class);
        copy.addAll(builder.capabilities);
        this.capabilities = Collections.unmodifiableSet(copy);
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.contextLength = builder.contextLength;
        this.displayName = builder.displayName;
    }

    public String getId() {
        return id;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public String getModelName() {
        return modelName;
    }

    public SecretReference getApiKey() {
        return apiKey;
    }

    /**
     * Returns the configured base URL override, or null when the provider default applies.
     */
    public URI getBaseUrl() {
        return baseUrl;
    }

    public URI getEffectiveBaseUrl() {
        return baseUrl != null ? baseUrl : URI.create(provider.defaultBaseUrl());
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Set<ModelCapability> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(ModelCapability capability) {
        return capabilities.contains(capability);
    }

    public boolean hasCapabilities(Set<ModelCapability> required) {
        return capabilities.containsAll(required);
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    /**
     * Returns the context window in tokens, or null when unknown.
     */
    public Integer getContextLength() {
        return contextLength;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : id;
    }

    public ModelConfig withEnabled(boolean enabled) {
        if (this.enabled == enabled) {
            return this;
        }
        return toBuilder().enabled(enabled).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .provider(provider)
                .modelName(modelName)
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .priority(priority)
                .enabled(enabled)
                .capabilities(capabilities)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .contextLength(contextLength)
                .displayName(displayName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelConfig that = (ModelConfig) o;
        return priority == that.priority
                && enabled == that.enabled
                && id.equals(that.id)
                && provider == that.provider
                && modelName.equals(that.modelName)
                && apiKey.equals(that.apiKey)
                && Objects.equals(baseUrl, that.baseUrl)
                && capabilities.equals(that.capabilities)
                && Objects.equals(maxTokens, that.maxTokens)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(contextLength, that.contextLength)
                && Objects.equals(displayName, that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, provider, modelName, priority, enabled);
    }

    @Override
    public String toString() {
        return "ModelConfig{" +
                "id='" + id + '\'' +
                ", provider=" + provider.id() +
                ", modelName='" + modelName + '\'' +
                ", priority=" + priority +
                ", enabled=" + enabled +
                ", capabilities=" + capabilities +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderType provider;
        private String modelName;
        private SecretReference apiKey;
        private URI baseUrl;
        private int priority = 100;
        private boolean enabled = true;
        private final Set<ModelCapability> capabilities = EnumSet.noneOf(ModelCapability.class);
        private Integer maxTokens;
        private Double temperature;
        private Integer contextLength;
        private String displayName;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder provider(ProviderType provider) {
            this.provider = provider;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder apiKey(SecretReference apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = SecretReference.of(apiKey);
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = url == null || url.isBlank() ? null : URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder addCapability(ModelCapability capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder capabilities(Set<ModelCapability> capabilities) {
            this.capabilities.clear();
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder contextLength(Integer contextLength) {
            this.contextLength = contextLength;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public ModelConfig build() {
            return new ModelConfig(this);
        }
    }
}

package fr.lapetina.llmgateway.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches one adapter per model.
 *
 * Adapter variants are registered per {@link ProviderType}. All adapters share
 * one {@link HttpClient} and one {@link ObjectMapper}. A cached adapter is
 * replaced when the registry hands in a different configuration for the same
 * model id, e.g. after the model was re-added with new settings.
 */
public final class ProviderAdapterFactory implements AdapterResolver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderAdapterFactory.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Map<ProviderType, AdapterVariant> variants = new ConcurrentHashMap<>();
    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();

    public ProviderAdapterFactory(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = createObjectMapper();

        register(ProviderType.OPENAI, OpenAiCompatibleAdapter::new);
        register(ProviderType.DEEPSEEK, OpenAiCompatibleAdapter::new);
        register(ProviderType.ZHIPU, OpenAiCompatibleAdapter::new);
        register(ProviderType.QWEN, OpenAiCompatibleAdapter::new);
        register(ProviderType.MOONSHOT, OpenAiCompatibleAdapter::new);
        register(ProviderType.ANTHROPIC, AnthropicAdapter::new);
    }

    public ProviderAdapterFactory() {
        this(Duration.ofSeconds(3), Duration.ofSeconds(5));
    }

    /**
     * Registers or replaces the adapter variant of a provider family.
     */
    public ProviderAdapterFactory register(ProviderType provider, AdapterVariant variant) {
        variants.put(provider, variant);
        adapters.values().removeIf(adapter -> adapter.config().getProvider() == provider);
        return this;
    }

    public Set<ProviderType> supportedProviders() {
        return Set.copyOf(variants.keySet());
    }

    @Override
    public ProviderAdapter resolve(ModelConfig model) {
        return adapters.compute(model.getId(), (id, cached) -> {
            if (cached != null && cached.config().equals(model)) {
                return cached;
            }
            ProviderAdapter adapter = create(model);
            log.debug("Adapter created: modelId={}, provider={}, adapter={}",
                    id, model.getProvider().id(), adapter.getClass().getSimpleName());
            return adapter;
        });
    }

    /**
     * Drops the cached adapter of a model, typically after it was removed.
     */
    public void evict(String modelId) {
        adapters.remove(modelId);
    }

    private ProviderAdapter create(ModelConfig model) {
        AdapterVariant variant = variants.get(model.getProvider());
        if (variant == null) {
            throw new IllegalArgumentException("No adapter registered for provider: " + model.getProvider().id());
        }
        return variant.create(model, httpClient, objectMapper, requestTimeout);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void close() {
        adapters.clear();
        // HttpClient has no close() before JDK 21; its threads die with the last reference
    }

    /**
     * Creates an adapter for a model of the variant's provider family.
     */
    @FunctionalInterface
    public interface AdapterVariant {
        ProviderAdapter create(ModelConfig model, HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout);
    }
}

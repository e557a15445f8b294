package fr.lapetina.llmgateway;

import fr.lapetina.llmgateway.core.GatewayCore;
import fr.lapetina.llmgateway.domain.exception.ValidationException;
import fr.lapetina.llmgateway.domain.model.PriceTable;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.stats.StatsStore;
import fr.lapetina.llmgateway.domain.strategy.RoutingPolicies;
import fr.lapetina.llmgateway.infrastructure.config.ConfigLoader;
import fr.lapetina.llmgateway.infrastructure.config.GatewayConfig;
import fr.lapetina.llmgateway.infrastructure.config.ModelConfigMapper;
import fr.lapetina.llmgateway.infrastructure.credentials.CredentialStore;
import fr.lapetina.llmgateway.infrastructure.credentials.EnvironmentCredentialStore;
import fr.lapetina.llmgateway.infrastructure.health.HealthChecker;
import fr.lapetina.llmgateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmgateway.infrastructure.provider.AdapterResolver;
import fr.lapetina.llmgateway.infrastructure.provider.ProviderAdapterFactory;
import fr.lapetina.llmgateway.infrastructure.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for creating a fully-wired gateway from configuration.
 * This is the primary entry point for obtaining a configured {@link GatewayCore}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("gateway.yaml").start()) {
 *     GatewayCore gateway = factory.getGateway();
 *     // use gateway...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final GatewayConfig config;
    private final ModelConfigMapper modelMapper;
    private final ModelRegistry modelRegistry;
    private final StatsStore statsStore;
    private final PriceTable priceTable;
    private final MetricsRegistry metricsRegistry;
    private final ProviderAdapterFactory adapterFactory;
    private final AdapterResolver adapters;
    private final HealthChecker healthChecker;
    private final RoutingStrategy defaultStrategy;
    private final GatewayCore gateway;

    protected GatewayFactory(String configPath, CredentialStore credentials, AdapterResolver adapterOverride) {
        log.info("Initializing GatewayFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();
        this.defaultStrategy = RoutingStrategy.fromId(config.getRouting().getDefaultStrategy())
                .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                        "Unknown routing.defaultStrategy: " + config.getRouting().getDefaultStrategy()));

        // Initialize metrics and statistics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.statsStore = new StatsStore(config.getStats().getWindowSize());
        this.priceTable = ModelConfigMapper.toPriceTable(config.getPrices());

        // Initialize adapters (allow override for testing)
        this.adapterFactory = new ProviderAdapterFactory(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs())
        );
        this.adapters = adapterOverride != null ? adapterOverride : adapterFactory;

        // Initialize model registry
        this.modelMapper = new ModelConfigMapper(credentials);
        this.modelRegistry = new ModelRegistry();
        modelRegistry.addListener(this::onRegistryEvent);
        metricsRegistry.registerEnabledModels(() -> modelRegistry.list(true).size());
        loadModels();

        // Initialize health checker
        this.healthChecker = new HealthChecker(
                modelRegistry,
                adapters,
                metricsRegistry,
                Duration.ofMillis(config.getTimeouts().getCheckTimeoutMs()),
                Duration.ofMillis(config.getHealthCheck().getIntervalMs())
        );

        this.gateway = new GatewayCore(
                modelRegistry,
                statsStore,
                new RoutingPolicies(priceTable),
                adapters,
                priceTable,
                healthChecker,
                metricsRegistry,
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getStreamTimeoutMs())
        );

        log.info("GatewayFactory initialized with {} models, {} prices, default strategy {}",
                modelRegistry.size(), priceTable.size(), defaultStrategy.id());
    }

    /**
     * Creates a factory from the specified configuration file, reading API keys
     * from the environment.
     */
    public static GatewayFactory create(String configPath) {
        return new GatewayFactory(configPath, new EnvironmentCredentialStore(), null);
    }

    /**
     * Creates a factory from the specified configuration file and credential store.
     */
    public static GatewayFactory create(String configPath, CredentialStore credentials) {
        return new GatewayFactory(configPath, credentials, null);
    }

    /**
     * Creates a factory from the default configuration (gateway.yaml).
     */
    public static GatewayFactory create() {
        return create("gateway.yaml");
    }

    /**
     * Starts periodic checking when enabled in configuration.
     */
    public GatewayFactory start() {
        if (config.getHealthCheck().isEnabled()) {
            healthChecker.start();
        }
        log.info("Gateway started");
        return this;
    }

    public GatewayCore getGateway() {
        return gateway;
    }

    public ModelRegistry getModelRegistry() {
        return modelRegistry;
    }

    public StatsStore getStatsStore() {
        return statsStore;
    }

    public PriceTable getPriceTable() {
        return priceTable;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public HealthChecker getHealthChecker() {
        return healthChecker;
    }

    public ModelConfigMapper getModelMapper() {
        return modelMapper;
    }

    public RoutingStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    private void loadModels() {
        for (GatewayConfig.ModelEntry entry : config.getModels()) {
            try {
                modelRegistry.add(modelMapper.toModelConfig(entry));
            } catch (ValidationException e) {
                throw new ConfigLoader.ConfigurationException("Invalid model entry: " + e.getMessage(), e);
            }
        }
    }

    private void onRegistryEvent(ModelRegistry.ModelRegistryEvent event) {
        String modelId = event.model().getId();
        switch (event.type()) {
            case ADDED -> metricsRegistry.registerModelStats(modelId, statsStore);
            case REMOVED -> {
                metricsRegistry.removeModelStats(modelId);
                statsStore.reset(modelId);
                adapterFactory.evict(modelId);
            }
            case UPDATED -> log.debug("Model updated: modelId={}, enabled={}", modelId, event.model().isEnabled());
        }
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        try {
            adapterFactory.close();
        } catch (Exception e) {
            log.warn("Error closing adapter factory", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("GatewayFactory shut down");
    }
}

package fr.lapetina.llmgateway.infrastructure.metrics;

import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.stats.StatsStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters per strategy and result
 * - Attempt counters and latency timers per model
 * - Error counters by provider error type
 * - Gauges reading the rolling statistics of each model
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "llm_gateway";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> checkCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Meter.Id>> modelGauges = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Counts a gateway request by strategy and result
     * ({@code success}, {@code failed} or {@code rejected}).
     */
    public void incrementRequestCount(RoutingStrategy strategy, String result) {
        String key = strategy.id() + ":" + result;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of completion requests")
                        .tag("strategy", strategy.id())
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts one dispatch attempt against a model.
     */
    public void incrementAttemptCount(String modelId, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = modelId + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Total number of dispatch attempts")
                        .tag("model", modelId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records attempt latency.
     */
    public void recordLatency(String modelId, Duration latency) {
        latencyTimers.computeIfAbsent(modelId, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Provider call latency")
                        .tag("model", modelId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String modelId, ProviderErrorType errorType) {
        String key = modelId + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of provider errors")
                        .tag("model", modelId)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a connectivity check result.
     */
    public void incrementCheckCount(String modelId, boolean success) {
        String result = success ? "passed" : "failed";
        String key = modelId + ":" + result;
        checkCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_checks_total")
                        .description("Total number of connectivity checks")
                        .tag("model", modelId)
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers gauges reading a model's rolling statistics.
     */
    public void registerModelStats(String modelId, StatsStore stats) {
        modelGauges.computeIfAbsent(modelId, id -> List.of(
                Gauge.builder(prefix + "_model_avg_latency_ms", stats, s -> s.avgLatency(id).orElse(Double.NaN))
                        .description("Average latency over the stats window")
                        .tag("model", id)
                        .strongReference(true)
                        .register(registry)
                        .getId(),
                Gauge.builder(prefix + "_model_error_rate", stats, s -> s.errorRate(id))
                        .description("Failed attempts over all attempts")
                        .tag("model", id)
                        .strongReference(true)
                        .register(registry)
                        .getId(),
                Gauge.builder(prefix + "_model_cost_usd", stats, s -> s.cumulativeCost(id))
                        .description("Cumulative cost in USD")
                        .tag("model", id)
                        .strongReference(true)
                        .register(registry)
                        .getId()
        ));
    }

    /**
     * Removes the statistics gauges of a model.
     */
    public void removeModelStats(String modelId) {
        List<Meter.Id> ids = modelGauges.remove(modelId);
        if (ids != null) {
            ids.forEach(registry::remove);
        }
    }

    /**
     * Registers a gauge for the number of enabled models.
     */
    public void registerEnabledModels(Supplier<Number> count) {
        Gauge.builder(prefix + "_enabled_models", count, s -> s.get().doubleValue())
                .description("Number of enabled models")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

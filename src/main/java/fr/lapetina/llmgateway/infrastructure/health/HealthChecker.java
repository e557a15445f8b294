package fr.lapetina.llmgateway.infrastructure.health;

import fr.lapetina.llmgateway.domain.exception.ModelNotFoundException;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.TestResult;
import fr.lapetina.llmgateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmgateway.infrastructure.provider.AdapterResolver;
import fr.lapetina.llmgateway.infrastructure.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connectivity checks for registered models.
 *
 * Each check runs under its own timeout and a failing check never affects the
 * others. Results are reported, not kept: routing relies on dispatch
 * statistics only. Checks can also run periodically on a daemon thread.
 */
public final class HealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final ModelRegistry modelRegistry;
    private final AdapterResolver adapters;
    private final MetricsRegistry metrics;
    private final Duration checkTimeout;
    private final Duration checkInterval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthChecker(
            ModelRegistry modelRegistry,
            AdapterResolver adapters,
            MetricsRegistry metrics,
            Duration checkTimeout,
            Duration checkInterval
    ) {
        this.modelRegistry = modelRegistry;
        this.adapters = adapters;
        this.metrics = metrics;
        this.checkTimeout = checkTimeout;
        this.checkInterval = checkInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runScheduledCheck,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    private void runScheduledCheck() {
        try {
            List<TestResult> results = testAll().join();
            long passed = results.stream().filter(TestResult::success).count();
            log.info("Health check cycle completed: passed={}, failed={}", passed, results.size() - passed);
        } catch (Exception e) {
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Checks every registered model concurrently, enabled or not.
     *
     * @return one result per model, in registry order; never completes exceptionally
     */
    public CompletableFuture<List<TestResult>> testAll() {
        List<ModelConfig> models = modelRegistry.list(false);
        log.debug("Starting check cycle: modelCount={}", models.size());

        List<CompletableFuture<TestResult>> checks = models.stream()
                .map(this::check)
                .toList();

        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> checks.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Checks a single model.
     *
     * @throws ModelNotFoundException if the model is not registered
     */
    public CompletableFuture<TestResult> testModel(String modelId) {
        ModelConfig model = modelRegistry.get(modelId)
                .orElseThrow(() -> new ModelNotFoundException(modelId));
        return check(model);
    }

    private CompletableFuture<TestResult> check(ModelConfig model) {
        long start = System.nanoTime();
        CompletableFuture<TestResult> check;
        try {
            check = adapters.resolve(model).test();
        } catch (Exception e) {
            check = CompletableFuture.failedFuture(e);
        }

        return check
                .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    if (ex == null) {
                        return result;
                    }
                    long latencyMs = (System.nanoTime() - start) / 1_000_000;
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    String error = cause instanceof TimeoutException
                            ? "TIMEOUT: no answer within " + checkTimeout.toMillis() + " ms"
                            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    return TestResult.failed(model.getId(), latencyMs, error);
                })
                .whenComplete((result, ex) -> report(result));
    }

    private void report(TestResult result) {
        metrics.incrementCheckCount(result.modelId(), result.success());
        if (result.success()) {
            log.info("Check passed: modelId={}, latencyMs={}", result.modelId(), result.latencyMs());
        } else {
            log.warn("Check failed: modelId={}, latencyMs={}, error={}",
                    result.modelId(), result.latencyMs(), result.error());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Health checker stopped");
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

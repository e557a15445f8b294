package fr.lapetina.llmgateway.core;

import fr.lapetina.llmgateway.domain.exception.AllProvidersFailedException;
import fr.lapetina.llmgateway.domain.exception.GatewayException;
import fr.lapetina.llmgateway.domain.exception.ModelNotFoundException;
import fr.lapetina.llmgateway.domain.exception.NoModelsAvailableException;
import fr.lapetina.llmgateway.domain.exception.ProviderException;
import fr.lapetina.llmgateway.domain.model.ChatMessage;
import fr.lapetina.llmgateway.domain.model.CompletionRequest;
import fr.lapetina.llmgateway.domain.model.CompletionResult;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.PriceTable;
import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.ProviderRequest;
import fr.lapetina.llmgateway.domain.model.ProviderResponse;
import fr.lapetina.llmgateway.domain.model.RoutingDecision;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;
import fr.lapetina.llmgateway.domain.model.TestResult;
import fr.lapetina.llmgateway.domain.stats.Outcome;
import fr.lapetina.llmgateway.domain.stats.StatsSnapshot;
import fr.lapetina.llmgateway.domain.stats.StatsStore;
import fr.lapetina.llmgateway.domain.strategy.RoutingPolicies;
import fr.lapetina.llmgateway.infrastructure.health.HealthChecker;
import fr.lapetina.llmgateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmgateway.infrastructure.provider.AdapterResolver;
import fr.lapetina.llmgateway.infrastructure.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Routing and dispatch engine.
 *
 * <p>A completion goes through three steps:
 * <ol>
 *   <li>Plan: pick the explicit model, or rank the eligible enabled models with the request's policy</li>
 *   <li>Dispatch: call the candidates in rank order, each under its own timeout</li>
 *   <li>Account: record every attempt in the {@link StatsStore}, the successful one with its cost</li>
 * </ol>
 *
 * <p>Failover makes a single pass over the ranking. When every candidate
 * failed, the future completes with an {@link AllProvidersFailedException}
 * listing the failures in attempt order.
 *
 * <p>A streamed completion goes to the top-ranked candidate only: text
 * already handed to the caller cannot be taken back, so there is no failover.
 *
 * <p>Outcomes are recorded against the statistics generation read before the
 * call, so a call still running when its model is removed leaves no trace.
 *
 * <p>Thread-safe. All collaborators are injected and owned by the caller.
 */
public final class GatewayCore {

    private static final Logger log = LoggerFactory.getLogger(GatewayCore.class);

    static final String OVERRIDE_REASON = "explicit model override";
    public static final Duration DEFAULT_STREAM_TIMEOUT = Duration.ofMinutes(2);

    private final ModelRegistry modelRegistry;
    private final StatsStore statsStore;
    private final RoutingPolicies policies;
    private final AdapterResolver adapters;
    private final PriceTable prices;
    private final HealthChecker healthChecker;
    private final MetricsRegistry metrics;
    private final Duration requestTimeout;
    private final Duration streamTimeout;

    public GatewayCore(
            ModelRegistry modelRegistry,
            StatsStore statsStore,
            RoutingPolicies policies,
            AdapterResolver adapters,
            PriceTable prices,
            HealthChecker healthChecker,
            MetricsRegistry metrics,
            Duration requestTimeout
    ) {
        this(modelRegistry, statsStore, policies, adapters, prices, healthChecker, metrics,
                requestTimeout, DEFAULT_STREAM_TIMEOUT);
    }

    public GatewayCore(
            ModelRegistry modelRegistry,
            StatsStore statsStore,
            RoutingPolicies policies,
            AdapterResolver adapters,
            PriceTable prices,
            HealthChecker healthChecker,
            MetricsRegistry metrics,
            Duration requestTimeout,
            Duration streamTimeout
    ) {
        this.modelRegistry = modelRegistry;
        this.statsStore = statsStore;
        this.policies = policies;
        this.adapters = adapters;
        this.prices = prices;
        this.healthChecker = healthChecker;
        this.metrics = metrics;
        this.requestTimeout = requestTimeout;
        this.streamTimeout = streamTimeout;
    }

    /**
     * Routes and dispatches a completion request.
     *
     * @return the completion; fails with {@link ModelNotFoundException},
     *         {@link NoModelsAvailableException} or {@link AllProvidersFailedException}
     */
    public CompletableFuture<CompletionResult> complete(CompletionRequest request) {
        Plan plan;
        try {
            plan = plan(request);
        } catch (GatewayException e) {
            return rejected(request, e);
        }

        log.info("Routing decision: strategy={}, ranked={}, reason={}",
                plan.decision().strategy().id(), plan.decision().rankedIds(), plan.decision().reason());

        return attempt(request, plan, 0, new ArrayList<>())
                .whenComplete((result, ex) -> countRequest(request, result, ex));
    }

    /**
     * Routes a request and streams the answer of the top-ranked candidate.
     *
     * <p>Deltas reach {@code onDelta} in order, on a transport thread. The
     * whole stream runs under the stream timeout.
     *
     * @return the assembled completion; fails with {@link ModelNotFoundException},
     *         {@link NoModelsAvailableException}, or {@link AllProvidersFailedException}
     *         carrying the single failure
     */
    public CompletableFuture<CompletionResult> stream(CompletionRequest request, Consumer<String> onDelta) {
        Objects.requireNonNull(onDelta, "Delta consumer is required");
        Plan plan;
        try {
            plan = plan(request);
        } catch (GatewayException e) {
            return rejected(request, e);
        }

        ModelConfig model = plan.candidates().get(0);
        log.info("Streaming decision: strategy={}, modelId={}, reason={}",
                plan.decision().strategy().id(), model.getId(), plan.decision().reason());

        long generation = statsStore.generation(model.getId());
        long start = System.nanoTime();
        CompletableFuture<ProviderResponse> call;
        try {
            call = adapters.resolve(model).stream(ProviderRequest.from(request, model), onDelta);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        List<ProviderException> failures = new ArrayList<>();
        return call
                .orTimeout(streamTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> toFailure(model, ex, streamTimeout))
                .thenCompose(response -> {
                    long latencyMs = (System.nanoTime() - start) / 1_000_000;
                    if (response.isSuccess()) {
                        return CompletableFuture.completedFuture(
                                succeeded(model, plan, generation, latencyMs, response, failures));
                    }
                    failures.add(failed(model, generation, latencyMs, response));
                    log.warn("Stream failed: modelId={}, errorType={}, latencyMs={}, error={}",
                            model.getId(), response.errorType(), latencyMs, response.errorMessage());
                    return CompletableFuture.<CompletionResult>failedFuture(
                            new AllProvidersFailedException(failures));
                })
                .whenComplete((result, ex) -> countRequest(request, result, ex));
    }

    /**
     * Returns the routing decision for a request without dispatching it.
     *
     * @throws ModelNotFoundException      if an explicit model is unknown or disabled
     * @throws NoModelsAvailableException  if no enabled model is eligible
     */
    public RoutingDecision route(CompletionRequest request) {
        return plan(request).decision();
    }

    /**
     * Runs the same conversation once per routing strategy, concurrently.
     *
     * @return one entry per strategy in {@link RoutingStrategy} order; never completes exceptionally
     */
    public CompletableFuture<List<BenchmarkEntry>> benchmark(List<ChatMessage> messages) {
        List<RoutingStrategy> strategies = Arrays.asList(RoutingStrategy.values());
        // Validates the conversation once, before any dispatch
        CompletionRequest template = CompletionRequest.ofMessages(RoutingStrategy.SMART, messages);

        List<CompletableFuture<BenchmarkEntry>> runs = new ArrayList<>();
        for (RoutingStrategy strategy : strategies) {
            runs.add(complete(template.withStrategy(strategy))
                    .handle((result, ex) -> ex == null
                            ? BenchmarkEntry.succeeded(strategy, result)
                            : BenchmarkEntry.failed(strategy, unwrap(ex).getMessage())));
        }

        return CompletableFuture.allOf(runs.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> runs.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Checks every registered model, enabled or not.
     */
    public CompletableFuture<List<TestResult>> testAll() {
        return healthChecker.testAll();
    }

    /**
     * Returns the statistics of every registered model, in registry order.
     */
    public Map<String, StatsSnapshot> stats() {
        return statsStore.snapshots(modelRegistry.list(false).stream().map(ModelConfig::getId).toList());
    }

    public ModelRegistry registry() {
        return modelRegistry;
    }

    public StatsStore statsStore() {
        return statsStore;
    }

    private Plan plan(CompletionRequest request) {
        if (request.explicitModel().isPresent()) {
            String modelId = request.explicitModel().get();
            ModelConfig model = modelRegistry.get(modelId)
                    .orElseThrow(() -> new ModelNotFoundException(modelId));
            if (!model.isEnabled()) {
                throw new ModelNotFoundException(modelId, "model is disabled");
            }
            RoutingDecision decision = new RoutingDecision(request.strategy(), List.of(modelId), OVERRIDE_REASON);
            return new Plan(decision, List.of(model));
        }

        List<ModelConfig> candidates = modelRegistry.list(true).stream()
                .filter(model -> model.hasCapabilities(request.requiredCapabilities()))
                .toList();
        if (candidates.isEmpty()) {
            throw new NoModelsAvailableException(request.requiredCapabilities().isEmpty()
                    ? "No enabled models available"
                    : "No enabled model has capabilities " + request.requiredCapabilities());
        }

        Map<String, StatsSnapshot> stats = statsStore.snapshots(
                candidates.stream().map(ModelConfig::getId).toList());
        RoutingDecision decision = policies.get(request.strategy()).rank(request, candidates, stats);

        Map<String, ModelConfig> byId = new HashMap<>();
        candidates.forEach(model -> byId.put(model.getId(), model));
        List<ModelConfig> ranked = decision.rankedIds().stream().map(byId::get).toList();
        return new Plan(decision, ranked);
    }

    private CompletableFuture<CompletionResult> attempt(
            CompletionRequest request,
            Plan plan,
            int index,
            List<ProviderException> failures
    ) {
        if (index >= plan.candidates().size()) {
            return CompletableFuture.failedFuture(new AllProvidersFailedException(failures));
        }

        ModelConfig model = plan.candidates().get(index);
        long generation = statsStore.generation(model.getId());
        long start = System.nanoTime();
        log.debug("Dispatching: modelId={}, attempt={}/{}", model.getId(), index + 1, plan.candidates().size());

        return dispatch(model, ProviderRequest.from(request, model))
                .thenCompose(response -> {
                    long latencyMs = (System.nanoTime() - start) / 1_000_000;
                    if (response.isSuccess()) {
                        return CompletableFuture.completedFuture(
                                succeeded(model, plan, generation, latencyMs, response, failures));
                    }

                    failures.add(failed(model, generation, latencyMs, response));
                    log.warn("Attempt failed: modelId={}, errorType={}, latencyMs={}, remaining={}, error={}",
                            model.getId(), response.errorType(), latencyMs,
                            plan.candidates().size() - index - 1, response.errorMessage());

                    return attempt(request, plan, index + 1, failures);
                });
    }

    private CompletionResult succeeded(
            ModelConfig model,
            Plan plan,
            long generation,
            long latencyMs,
            ProviderResponse response,
            List<ProviderException> failures
    ) {
        double cost = prices.costOf(model, response.usage());
        if (statsStore.record(model.getId(), generation, Outcome.succeeded(latencyMs, cost))) {
            metrics.recordLatency(model.getId(), Duration.ofMillis(latencyMs));
            metrics.incrementAttemptCount(model.getId(), true);
        }
        return new CompletionResult(model, plan.decision(), latencyMs, cost,
                response.content(), response.usage(), failures);
    }

    private ProviderException failed(ModelConfig model, long generation, long latencyMs, ProviderResponse response) {
        if (statsStore.record(model.getId(), generation, Outcome.failed(latencyMs))) {
            metrics.recordLatency(model.getId(), Duration.ofMillis(latencyMs));
            metrics.incrementAttemptCount(model.getId(), false);
            metrics.incrementErrorCount(model.getId(), response.errorType());
        }
        return new ProviderException(model.getId(), model.getProvider(), response.errorType(),
                response.errorMessage(), latencyMs);
    }

    private CompletableFuture<CompletionResult> rejected(CompletionRequest request, GatewayException e) {
        log.warn("Request rejected: strategy={}, error={}", request.strategy().id(), e.getMessage());
        metrics.incrementRequestCount(request.strategy(), "rejected");
        return CompletableFuture.failedFuture(e);
    }

    private void countRequest(CompletionRequest request, CompletionResult result, Throwable ex) {
        if (ex == null) {
            metrics.incrementRequestCount(request.strategy(), "success");
            log.info("Completion succeeded: modelId={}, latencyMs={}, cost={}, recoveredFailures={}",
                    result.modelId(), result.latencyMs(), result.cost(),
                    result.recoveredFailures().size());
        } else {
            metrics.incrementRequestCount(request.strategy(), "failed");
            log.error("Completion failed: strategy={}, error={}",
                    request.strategy().id(), unwrap(ex).getMessage());
        }
    }

    private CompletableFuture<ProviderResponse> dispatch(ModelConfig model, ProviderRequest request) {
        CompletableFuture<ProviderResponse> call;
        try {
            call = adapters.resolve(model).complete(request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> toFailure(model, ex, requestTimeout));
    }

    private ProviderResponse toFailure(ModelConfig model, Throwable ex, Duration timeout) {
        Throwable cause = unwrap(ex);
        if (cause instanceof TimeoutException) {
            return ProviderResponse.failure(model.getId(), ProviderErrorType.TIMEOUT,
                    "No response within " + timeout.toMillis() + " ms");
        }
        return ProviderResponse.failure(model.getId(), ProviderErrorType.SERVER_ERROR,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Routing decision with the candidates resolved in dispatch order.
     */
    private record Plan(RoutingDecision decision, List<ModelConfig> candidates) {
    }
}

package fr.lapetina.llmgateway.domain.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-model rolling latency, error and cost statistics.
 *
 * Thread-safe. Synchronization is per model: each {@link StatsEntry} guards
 * itself, and the entry map is a {@link ConcurrentHashMap}. Nothing is persisted.
 *
 * Every entry carries a generation number. A caller that takes the generation
 * before a slow call and records with it loses its outcome when the entry was
 * reset in the meantime, so a model re-added under the same id starts empty.
 */
public final class StatsStore {

    private static final Logger log = LoggerFactory.getLogger(StatsStore.class);

    public static final int DEFAULT_WINDOW_SIZE = 20;

    private final Map<String, Slot> entries = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final int windowSize;

    public StatsStore(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public StatsStore() {
        this(DEFAULT_WINDOW_SIZE);
    }

    /**
     * Records the outcome of one dispatch attempt.
     */
    public void record(String modelId, Outcome outcome) {
        slot(modelId).entry().record(outcome);
        log.debug("Stats recorded: modelId={}, success={}, latencyMs={}, costDelta={}",
                modelId, outcome.success(), outcome.latencyMs(), outcome.costDelta());
    }

    /**
     * Returns the current generation of a model's entry, creating the entry if needed.
     */
    public long generation(String modelId) {
        return slot(modelId).generation();
    }

    /**
     * Records an outcome only if the model's entry is still the one of the given generation.
     *
     * @return false when the entry was reset since {@link #generation(String)} was read
     */
    public boolean record(String modelId, long generation, Outcome outcome) {
        boolean[] recorded = {false};
        entries.computeIfPresent(modelId, (id, slot) -> {
            if (slot.generation() == generation) {
                slot.entry().record(outcome);
                recorded[0] = true;
            }
            return slot;
        });
        if (recorded[0]) {
            log.debug("Stats recorded: modelId={}, success={}, latencyMs={}, costDelta={}",
                    modelId, outcome.success(), outcome.latencyMs(), outcome.costDelta());
        } else {
            log.debug("Stale outcome dropped: modelId={}, generation={}", modelId, generation);
        }
        return recorded[0];
    }

    public OptionalDouble avgLatency(String modelId) {
        Slot slot = entries.get(modelId);
        return slot == null ? OptionalDouble.empty() : slot.entry().averageLatency();
    }

    public double errorRate(String modelId) {
        Slot slot = entries.get(modelId);
        return slot == null ? 0d : slot.entry().errorRate();
    }

    public double cumulativeCost(String modelId) {
        Slot slot = entries.get(modelId);
        return slot == null ? 0d : slot.entry().cumulativeCost();
    }

    public StatsSnapshot snapshot(String modelId) {
        Slot slot = entries.get(modelId);
        return slot == null ? StatsSnapshot.empty(modelId) : slot.entry().snapshot();
    }

    /**
     * Snapshots for the given models, in iteration order of the ids.
     */
    public Map<String, StatsSnapshot> snapshots(Collection<String> modelIds) {
        Map<String, StatsSnapshot> result = new LinkedHashMap<>();
        for (String modelId : modelIds) {
            result.put(modelId, snapshot(modelId));
        }
        return result;
    }

    /**
     * Drops the statistics of a model, typically after it was removed from the registry.
     */
    public void reset(String modelId) {
        if (entries.remove(modelId) != null) {
            log.info("Stats reset: modelId={}", modelId);
        }
    }

    public int getWindowSize() {
        return windowSize;
    }

    private Slot slot(String modelId) {
        return entries.computeIfAbsent(modelId,
                id -> new Slot(generations.incrementAndGet(), new StatsEntry(id, windowSize)));
    }

    private record Slot(long generation, StatsEntry entry) {
    }
}

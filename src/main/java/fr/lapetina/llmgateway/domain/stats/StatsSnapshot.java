package fr.lapetina.llmgateway.domain.stats;

import java.util.OptionalDouble;

/**
 * Consistent point-in-time view of one model's statistics.
 */
public record StatsSnapshot(
        String modelId,
        int sampleCount,
        OptionalDouble averageLatencyMs,
        long successCount,
        long failureCount,
        double cumulativeCost
) {
    public static StatsSnapshot empty(String modelId) {
        return new StatsSnapshot(modelId, 0, OptionalDouble.empty(), 0, 0, 0d);
    }

    public boolean hasLatencySamples() {
        return sampleCount > 0;
    }

    public long totalAttempts() {
        return successCount + failureCount;
    }

    /**
     * Failure share of all recorded attempts, zero when nothing was recorded.
     */
    public double errorRate() {
        long total = totalAttempts();
        return total == 0 ? 0d : (double) failureCount / total;
    }
}

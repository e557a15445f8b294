package fr.lapetina.llmgateway.domain.stats;

import java.util.OptionalDouble;

/**
 * Rolling statistics of a single model.
 *
 * Latency samples of successful calls live in a fixed-size ring buffer; the
 * oldest sample is overwritten once the window is full. Every method holds
 * this entry's monitor, so readers never see a half-applied update and
 * entries of different models never contend.
 */
public final class StatsEntry {

    private final String modelId;
    private final long[] samples;
    private int head;
    private int count;
    private long windowSum;
    private long successCount;
    private long failureCount;
    private double cumulativeCost;

    public StatsEntry(String modelId, int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.modelId = modelId;
        this.samples = new long[windowSize];
    }

    public synchronized void record(Outcome outcome) {
        if (outcome.success()) {
            successCount++;
            addSample(outcome.latencyMs());
        } else {
            failureCount++;
        }
        cumulativeCost += outcome.costDelta();
    }

    private void addSample(long latencyMs) {
        if (count == samples.length) {
            windowSum -= samples[head];
        } else {
            count++;
        }
        samples[head] = latencyMs;
        windowSum += latencyMs;
        head = (head + 1) % samples.length;
    }

    public synchronized OptionalDouble averageLatency() {
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) windowSum / count);
    }

    public synchronized double errorRate() {
        long total = successCount + failureCount;
        return total == 0 ? 0d : (double) failureCount / total;
    }

    public synchronized double cumulativeCost() {
        return cumulativeCost;
    }

    public synchronized StatsSnapshot snapshot() {
        return new StatsSnapshot(
                modelId,
                count,
                averageLatency(),
                successCount,
                failureCount,
                cumulativeCost
        );
    }

    public String getModelId() {
        return modelId;
    }

    public int getWindowSize() {
        return samples.length;
    }
}

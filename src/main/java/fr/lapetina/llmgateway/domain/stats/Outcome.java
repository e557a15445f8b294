package fr.lapetina.llmgateway.domain.stats;

/**
 * One dispatch attempt as seen by the statistics window.
 */
public record Outcome(boolean success, long latencyMs, double costDelta) {

    public Outcome {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("Latency must not be negative: " + latencyMs);
        }
        if (costDelta < 0 || Double.isNaN(costDelta)) {
            throw new IllegalArgumentException("Cost delta must be a non-negative number: " + costDelta);
        }
    }

    public static Outcome succeeded(long latencyMs, double cost) {
        return new Outcome(true, latencyMs, cost);
    }

    public static Outcome failed(long latencyMs) {
        return new Outcome(false, latencyMs, 0d);
    }
}

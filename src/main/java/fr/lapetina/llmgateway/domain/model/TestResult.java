package fr.lapetina.llmgateway.domain.model;

import java.util.Optional;

/**
 * Result of a connectivity check against one model.
 */
public record TestResult(String modelId, boolean success, long latencyMs, String error) {

    public static TestResult passed(String modelId, long latencyMs) {
        return new TestResult(modelId, true, latencyMs, null);
    }

    public static TestResult failed(String modelId, long latencyMs, String error) {
        return new TestResult(modelId, false, latencyMs, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}

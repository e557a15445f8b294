package fr.lapetina.llmgateway.core;

import fr.lapetina.llmgateway.domain.model.CompletionResult;
import fr.lapetina.llmgateway.domain.model.RoutingStrategy;

/**
 * Outcome of one strategy in a benchmark run: either a result or an error message.
 */
public record BenchmarkEntry(RoutingStrategy strategy, CompletionResult result, String error) {

    public static BenchmarkEntry succeeded(RoutingStrategy strategy, CompletionResult result) {
        return new BenchmarkEntry(strategy, result, null);
    }

    public static BenchmarkEntry failed(RoutingStrategy strategy, String error) {
        return new BenchmarkEntry(strategy, null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}

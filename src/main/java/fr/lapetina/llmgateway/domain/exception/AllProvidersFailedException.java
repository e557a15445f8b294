package fr.lapetina.llmgateway.domain.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every candidate of a single failover pass failed.
 * Carries one {@link ProviderException} per attempted candidate, in attempt order.
 */
public final class AllProvidersFailedException extends GatewayException {

    private final List<ProviderException> failures;

    public AllProvidersFailedException(List<ProviderException> failures) {
        super(describe(failures));
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }

    public List<ProviderException> getFailures() {
        return failures;
    }

    private static String describe(List<ProviderException> failures) {
        return "All " + failures.size() + " candidate(s) failed: " + failures.stream()
                .map(f -> f.getModelId() + "=" + f.getErrorType())
                .collect(Collectors.joining(", "));
    }
}

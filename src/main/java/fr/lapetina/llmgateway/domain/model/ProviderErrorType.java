package fr.lapetina.llmgateway.domain.model;

/**
 * Classification of a failed provider call.
 */
public enum ProviderErrorType {
    /** Credentials missing, rejected or not authorized (401/403). */
    AUTH_ERROR(false),

    /** Provider throttled the call (429). */
    RATE_LIMITED(true),

    /** Provider or network failure (5xx, unexpected 4xx, connection errors). */
    SERVER_ERROR(true),

    /** No response within the per-call timeout. */
    TIMEOUT(true),

    /** Response received but could not be interpreted. */
    MALFORMED_RESPONSE(false);

    private final boolean transientFailure;

    ProviderErrorType(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether the same call is likely to succeed later without configuration changes.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}

package fr.lapetina.llmgateway.domain.exception;

import fr.lapetina.llmgateway.domain.model.ProviderErrorType;
import fr.lapetina.llmgateway.domain.model.ProviderType;

/**
 * A classified failure of one dispatch attempt.
 *
 * Recovered by failover while other candidates remain; otherwise reported
 * inside {@link AllProvidersFailedException}.
 */
public final class ProviderException extends GatewayException {

    private final String modelId;
    private final ProviderType provider;
    private final ProviderErrorType errorType;
    private final long latencyMs;

    public ProviderException(
            String modelId,
            ProviderType provider,
            ProviderErrorType errorType,
            String details,
            long latencyMs
    ) {
        super(errorType + " from " + modelId + (details != null ? ": " + details : ""));
        this.modelId = modelId;
        this.provider = provider;
        this.errorType = errorType;
        this.latencyMs = latencyMs;
    }

    public String getModelId() {
        return modelId;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public ProviderErrorType getErrorType() {
        return errorType;
    }

    public long getLatencyMs() {
        return latencyMs;
    }
}

package fr.lapetina.llmgateway.domain.exception;

/**
 * Thrown when a model id is unknown, or when an explicitly requested model is disabled.
 */
public final class ModelNotFoundException extends GatewayException {

    private final String modelId;

    public ModelNotFoundException(String modelId) {
        super("Model not found: " + modelId);
        this.modelId = modelId;
    }

    public ModelNotFoundException(String modelId, String details) {
        super("Model not found: " + modelId + " - " + details);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}

package fr.lapetina.llmgateway.domain.exception;

/**
 * Thrown when a request or a model configuration is rejected before any dispatch.
 */
public final class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super(message);
    }
}

package fr.lapetina.llmgateway.domain.exception;

/**
 * Thrown when routing finds no enabled model eligible for a request.
 */
public final class NoModelsAvailableException extends GatewayException {

    public NoModelsAvailableException(String message) {
        super(message);
    }
}

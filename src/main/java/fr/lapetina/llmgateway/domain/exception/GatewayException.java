package fr.lapetina.llmgateway.domain.exception;

/**
 * Base class for every error the gateway surfaces to callers.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}

package fr.lapetina.thesis.client.domain.exception;

import fr.lapetina.thesis.client.domain.model.ErrorType;

/**
 * Base class of every error surfaced by the client layer.
 */
public class AiClientException extends RuntimeException {

    private final ErrorType errorType;

    public AiClientException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public AiClientException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}

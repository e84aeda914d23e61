package fr.lapetina.thesis.client.domain.exception;

import fr.lapetina.thesis.client.domain.model.ErrorType;

/**
 * A failed attempt that is worth retrying: timeout, network error, error status or empty body.
 */
public final class TransientBackendException extends AiClientException {

    private final int statusCode;

    public TransientBackendException(ErrorType errorType, String message) {
        this(errorType, message, -1, null);
    }

    public TransientBackendException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, -1, cause);
    }

    public TransientBackendException(ErrorType errorType, String message, int statusCode, Throwable cause) {
        super(errorType, message, cause);
        this.statusCode = statusCode;
    }

    public static TransientBackendException httpStatus(int statusCode, String message) {
        return new TransientBackendException(ErrorType.BACKEND_ERROR, message, statusCode, null);
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

package fr.lapetina.thesis.client.domain.exception;

import fr.lapetina.thesis.client.domain.model.ErrorType;

/**
 * All attempts of a session call failed. The cause is the last attempt's error.
 */
public final class RetriesExhaustedException extends AiClientException {

    private final int attempts;

    public RetriesExhaustedException(String sessionId, int attempts, Throwable lastError) {
        super(ErrorType.RETRIES_EXHAUSTED,
                "Call failed after " + attempts + " attempt(s): sessionId=" + sessionId
                        + ", lastError=" + (lastError != null ? lastError.getMessage() : "none"),
                lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Error type of the last failed attempt, when it was classified.
     */
    public ErrorType getLastErrorType() {
        if (getCause() instanceof AiClientException) {
            return ((AiClientException) getCause()).getErrorType();
        }
        return ErrorType.BACKEND_ERROR;
    }
}

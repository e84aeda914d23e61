package fr.lapetina.thesis.client.domain.exception;

import fr.lapetina.thesis.client.domain.model.ErrorType;

/**
 * Thrown when a session's circuit breaker rejects a call. No network attempt was made.
 */
public final class CircuitOpenException extends AiClientException {

    private final String sessionId;

    public CircuitOpenException(String sessionId, String state) {
        super(ErrorType.CIRCUIT_OPEN,
                "Circuit breaker rejected call: sessionId=" + sessionId + ", state=" + state);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

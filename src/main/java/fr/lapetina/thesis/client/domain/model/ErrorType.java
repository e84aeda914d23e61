package fr.lapetina.thesis.client.domain.model;

/**
 * Error taxonomy for AI client calls.
 * Carried by every {@link fr.lapetina.thesis.client.domain.exception.AiClientException}.
 */
public enum ErrorType {
    /** Missing credentials, no reachable backend, invalid settings. Never retried. */
    CONFIGURATION,

    /** Circuit breaker rejected the call before any network attempt */
    CIRCUIT_OPEN,

    /** Backend call exceeded its timeout */
    TIMEOUT,

    /** Network failure or non-2xx answer from the backend */
    BACKEND_ERROR,

    /** Backend answered with an empty or blank body */
    EMPTY_RESPONSE,

    /** All attempts failed; the last transient error is the cause */
    RETRIES_EXHAUSTED,

    /** Internal system error */
    INTERNAL_ERROR
}

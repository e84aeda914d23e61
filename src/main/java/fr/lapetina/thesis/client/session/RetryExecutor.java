package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.exception.CircuitOpenException;
import fr.lapetina.thesis.client.domain.exception.RetriesExhaustedException;
import fr.lapetina.thesis.client.domain.exception.TransientBackendException;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.ErrorType;
import fr.lapetina.thesis.client.infrastructure.http.CircuitBreaker;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker, retry and backoff policy shared by every session variant.
 *
 * An empty reply, a timeout and a transport error are all failed attempts:
 * each one is recorded on the circuit breaker and retried the same way.
 */
final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final String sessionId;
    private final BackendKind backendKind;
    private final RetryPolicy policy;
    private final CircuitBreaker circuitBreaker;
    private final ClientMetrics metrics;
    private final Clock clock;

    /**
     * @param circuitBreaker may be null for variants without a breaker
     */
    RetryExecutor(
            String sessionId,
            BackendKind backendKind,
            RetryPolicy policy,
            CircuitBreaker circuitBreaker,
            ClientMetrics metrics,
            Clock clock
    ) {
        this.sessionId = sessionId;
        this.backendKind = backendKind;
        this.policy = policy;
        this.circuitBreaker = circuitBreaker;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Successful attempt: the reply plus the one-based attempt number that produced it.
     */
    record Outcome(BackendReply reply, int attempt, Duration responseTime) {
    }

    /**
     * Runs the call until it succeeds or attempts run out.
     *
     * @throws CircuitOpenException       when the breaker rejects the call; nothing is sent
     * @throws RetriesExhaustedException  when every attempt failed
     */
    Outcome execute(BackendCall call) {
        if (circuitBreaker != null && !circuitBreaker.canExecute()) {
            metrics.incrementCircuitRejections();
            log.warn("Call blocked by circuit breaker: sessionId={}, state={}",
                    sessionId, circuitBreaker.getState());
            throw new CircuitOpenException(sessionId, circuitBreaker.getState().name());
        }

        Instant callStart = clock.instant();
        TransientBackendException lastError = null;

        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            Instant attemptStart = clock.instant();
            try {
                BackendReply reply = call.invoke();
                Duration elapsed = Duration.between(attemptStart, clock.instant());

                if (elapsed.compareTo(policy.timeout()) > 0) {
                    throw new TransientBackendException(ErrorType.TIMEOUT,
                            "Call exceeded timeout: " + elapsed.toMillis() + "ms > " + policy.timeout().toMillis() + "ms");
                }
                if (reply == null || reply.isEmpty()) {
                    throw new TransientBackendException(ErrorType.EMPTY_RESPONSE,
                            "Backend returned empty content");
                }

                if (circuitBreaker != null) {
                    circuitBreaker.recordSuccess();
                }
                if (attempt > 0) {
                    log.info("Call succeeded on retry: sessionId={}, attempt={}/{}",
                            sessionId, attempt + 1, policy.totalAttempts());
                }
                metrics.recordCall(backendKind, true, Duration.between(callStart, clock.instant()));
                return new Outcome(reply, attempt + 1, elapsed);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                recordFailure(classify(e));
                metrics.recordCall(backendKind, false, Duration.between(callStart, clock.instant()));
                throw new RetriesExhaustedException(sessionId, attempt + 1, e);

            } catch (IOException | RuntimeException e) {
                lastError = classify(e);
                recordFailure(lastError);
                log.warn("Call failed: sessionId={}, attempt={}/{}, errorType={}, error={}, circuitState={}",
                        sessionId, attempt + 1, policy.totalAttempts(), lastError.getErrorType(),
                        lastError.getMessage(), circuitBreaker != null ? circuitBreaker.getState() : "n/a");
            }

            if (attempt < policy.maxRetries()) {
                Duration delay = policy.delayAfterAttempt(attempt);
                metrics.incrementRetryCount(backendKind);
                log.info("Retrying after backoff: sessionId={}, delayMs={}", sessionId, delay.toMillis());
                if (!sleep(delay)) {
                    metrics.recordCall(backendKind, false, Duration.between(callStart, clock.instant()));
                    throw new RetriesExhaustedException(sessionId, attempt + 1, lastError);
                }
            }
        }

        log.error("Call failed after all attempts: sessionId={}, attempts={}, lastError={}",
                sessionId, policy.totalAttempts(), lastError != null ? lastError.getMessage() : "none");
        metrics.recordCall(backendKind, false, Duration.between(callStart, clock.instant()));
        throw new RetriesExhaustedException(sessionId, policy.totalAttempts(), lastError);
    }

    private void recordFailure(TransientBackendException error) {
        metrics.incrementErrorCount(backendKind, error.getErrorType());
        if (circuitBreaker != null) {
            circuitBreaker.recordFailure();
        }
    }

    private static TransientBackendException classify(Exception e) {
        if (e instanceof TransientBackendException) {
            return (TransientBackendException) e;
        }
        if (e instanceof HttpTimeoutException) {
            return new TransientBackendException(ErrorType.TIMEOUT, "Request timeout: " + e.getMessage(), e);
        }
        if (e instanceof InterruptedException) {
            return new TransientBackendException(ErrorType.INTERNAL_ERROR, "Interrupted during call", e);
        }
        if (e instanceof IOException) {
            return new TransientBackendException(ErrorType.BACKEND_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        return new TransientBackendException(ErrorType.BACKEND_ERROR,
                "Unexpected error: " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }

    /**
     * @return false if interrupted while waiting
     */
    private static boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package fr.lapetina.thesis.client.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker protecting one AI session's backend.
 *
 * States:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Failures reached the threshold, calls rejected until the reset timeout elapses
 * - HALF_OPEN: Trial state, up to {@code halfOpenMaxCalls} calls allowed to probe recovery
 *
 * Every operation runs under the instance monitor; none of them blocks beyond it.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int halfOpenMaxCalls;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failureCount;
    private int halfOpenCalls;
    private Instant lastFailureTime;

    public CircuitBreaker(
            String name,
            int failureThreshold,
            Duration resetTimeout,
            int halfOpenMaxCalls,
            Clock clock
    ) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be positive: " + halfOpenMaxCalls);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.clock = clock;
    }

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, int halfOpenMaxCalls) {
        this(name, failureThreshold, resetTimeout, halfOpenMaxCalls, Clock.systemUTC());
    }

    public CircuitBreaker(String name) {
        this(name, 5, Duration.ofMinutes(5), 3);
    }

    /**
     * Checks if a call is allowed through the circuit breaker.
     * An OPEN breaker whose reset timeout has elapsed moves to HALF_OPEN here.
     *
     * @return true if the call should proceed, false if it must fail fast
     */
    public synchronized boolean canExecute() {
        switch (state) {
            case CLOSED:
                return true;

            case OPEN:
                if (lastFailureTime != null
                        && !clock.instant().isBefore(lastFailureTime.plus(resetTimeout))) {
                    state = State.HALF_OPEN;
                    halfOpenCalls = 0;
                    log.info("Circuit breaker transitioning to HALF_OPEN: name={}", name);
                    return true;
                }
                return false;

            case HALF_OPEN:
                return halfOpenCalls < halfOpenMaxCalls;

            default:
                return true;
        }
    }

    /**
     * Records a successful call.
     */
    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            halfOpenCalls++;
            if (halfOpenCalls >= halfOpenMaxCalls) {
                state = State.CLOSED;
                failureCount = 0;
                log.info("Circuit breaker CLOSED after recovery: name={}", name);
            }
            return;
        }
        // Every success in CLOSED is evidence of health
        failureCount = 0;
    }

    /**
     * Records a failed call.
     */
    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();

        if (failureCount >= failureThreshold) {
            if (state != State.OPEN) {
                log.warn("Circuit breaker OPENED: name={}, failures={}", name, failureCount);
            }
            state = State.OPEN;
        } else if (state == State.HALF_OPEN) {
            state = State.OPEN;
            log.warn("Circuit breaker OPENED (half-open failure): name={}", name);
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public synchronized void forceState(State newState) {
        State old = state;
        state = newState;
        if (newState == State.CLOSED) {
            failureCount = 0;
        }
        if (newState == State.OPEN) {
            lastFailureTime = clock.instant();
        }
        if (newState == State.HALF_OPEN) {
            halfOpenCalls = 0;
        }
        log.info("Circuit breaker forced from {} to {}: name={}", old, newState, name);
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized int getHalfOpenCalls() {
        return halfOpenCalls;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public String getName() {
        return name;
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + state +
                ", failures=" + failureCount +
                '}';
    }
}

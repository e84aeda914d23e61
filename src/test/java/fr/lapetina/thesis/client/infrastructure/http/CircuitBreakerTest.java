package fr.lapetina.thesis.client.infrastructure.http;

import fr.lapetina.thesis.client.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 3 failures, 100ms reset, 2 probe calls
        circuitBreaker = new CircuitBreaker("test-session", 3, Duration.ofMillis(100), 2, clock);
    }

    private void openCircuit() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.canExecute()).isTrue();
        assertThat(circuitBreaker.getLastFailureTime()).isNull();
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.canExecute()).isFalse();
        assertThat(circuitBreaker.getLastFailureTime()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should keep counting failures while open")
    void shouldStayOpenOnFurtherFailures() {
        openCircuit();
        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getFailureCount()).isZero();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should reject until the reset timeout has elapsed")
    void shouldRejectBeforeResetTimeout() {
        openCircuit();
        clock.advance(Duration.ofMillis(99));

        assertThat(circuitBreaker.canExecute()).isFalse();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should transition to HALF_OPEN once the reset timeout has elapsed")
    void shouldTransitionToHalfOpenAfterTimeout() {
        openCircuit();
        clock.advance(Duration.ofMillis(100));

        assertThat(circuitBreaker.canExecute()).isTrue();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(circuitBreaker.getHalfOpenCalls()).isZero();
    }

    @Test
    @DisplayName("should close after enough successes in HALF_OPEN")
    void shouldCloseAfterSuccessesInHalfOpen() {
        openCircuit();
        clock.advance(Duration.ofMillis(150));
        circuitBreaker.canExecute();

        circuitBreaker.recordSuccess();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThat(circuitBreaker.canExecute()).isTrue();

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should reopen on failure in HALF_OPEN")
    void shouldReopenOnFailureInHalfOpen() {
        openCircuit();
        clock.advance(Duration.ofMillis(150));
        circuitBreaker.canExecute();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.canExecute()).isFalse();
    }

    @Test
    @DisplayName("should allow forcing state")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.canExecute()).isFalse();

        circuitBreaker.forceState(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should reject non-positive thresholds")
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new CircuitBreaker("bad", 0, Duration.ofSeconds(1), 1, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreaker("bad", 1, Duration.ofSeconds(1), 0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry and timeout settings of one backend.
 *
 * @param maxRetries         retries after the first attempt; a call makes at most {@code maxRetries + 1} attempts
 * @param retryDelay         base delay between attempts
 * @param exponentialBackoff multiply the delay by {@code backoffFactor^attempt}
 * @param backoffFactor      growth factor for exponential backoff
 * @param timeout            bound on a single attempt
 */
public record RetryPolicy(
        int maxRetries,
        Duration retryDelay,
        boolean exponentialBackoff,
        double backoffFactor,
        Duration timeout
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        Objects.requireNonNull(retryDelay, "Retry delay is required");
        Objects.requireNonNull(timeout, "Timeout is required");
    }

    public static RetryPolicy from(ClientConfig.BackendConfig config) {
        return new RetryPolicy(
                config.getMaxRetries(),
                Duration.ofMillis(config.getRetryDelayMs()),
                config.isExponentialBackoff(),
                config.getBackoffFactor(),
                Duration.ofMillis(config.getTimeoutMs())
        );
    }

    public int totalAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay to wait after the failed attempt with the given zero-based index.
     */
    public Duration delayAfterAttempt(int attempt) {
        if (!exponentialBackoff) {
            return retryDelay;
        }
        double millis = retryDelay.toMillis() * Math.pow(backoffFactor, attempt);
        return Duration.ofMillis(Math.round(millis));
    }
}

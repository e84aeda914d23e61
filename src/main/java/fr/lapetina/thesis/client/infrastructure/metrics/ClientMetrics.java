package fr.lapetina.thesis.client.infrastructure.metrics;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.ErrorType;
import fr.lapetina.thesis.client.domain.model.SearchLanguage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Session call counters and latency per backend
 * - Retry, circuit rejection and error counters
 * - Pool gauges (active sessions, available handles) and overflow/expiry counters
 * - Literature search counters and latency
 * - Prometheus exposition
 */
public final class ClientMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> searchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> searchTimers = new ConcurrentHashMap<>();

    private final Counter circuitRejections;
    private final Counter overflowHandles;
    private final Counter expiredSessions;

    public ClientMetrics(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.circuitRejections = Counter.builder(prefix + "_circuit_rejections_total")
                .description("Calls rejected by an open circuit breaker")
                .register(registry);

        this.overflowHandles = Counter.builder(prefix + "_overflow_handles_total")
                .description("Temporary handles created because the pool was exhausted")
                .register(registry);

        this.expiredSessions = Counter.builder(prefix + "_sessions_expired_total")
                .description("Sessions evicted after exceeding their idle time")
                .register(registry);

        log.info("ClientMetrics initialized with prefix: {}", prefix);
    }

    public ClientMetrics() {
        this("thesis_client");
    }

    /**
     * Records the outcome and latency of a session call.
     */
    public void recordCall(BackendKind backend, boolean success, Duration latency) {
        String outcome = success ? "success" : "failure";
        String key = backend.name() + ":" + outcome;
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_calls_total")
                        .description("Total number of session calls")
                        .tag("backend", backend.getConfigName())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(backend.name(), k ->
                Timer.builder(prefix + "_call_latency")
                        .description("Session call latency, retries included")
                        .tag("backend", backend.getConfigName())
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter for one failed attempt.
     */
    public void incrementErrorCount(BackendKind backend, ErrorType errorType) {
        String key = backend.name() + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed attempts")
                        .tag("backend", backend.getConfigName())
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRetryCount(BackendKind backend) {
        retryCounters.computeIfAbsent(backend.name(), k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Total number of retried attempts")
                        .tag("backend", backend.getConfigName())
                        .register(registry)
        ).increment();
    }

    public void incrementCircuitRejections() {
        circuitRejections.increment();
    }

    public void incrementOverflowHandles() {
        overflowHandles.increment();
    }

    public void incrementExpiredSessions() {
        expiredSessions.increment();
    }

    /**
     * Records one literature search.
     */
    public void recordSearch(SearchLanguage language, boolean success, Duration latency) {
        String outcome = success ? "success" : "failure";
        String key = language.name() + ":" + outcome;
        searchCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_search_queries_total")
                        .description("Total number of literature search queries")
                        .tag("language", language.name())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        searchTimers.computeIfAbsent(language.name(), k ->
                Timer.builder(prefix + "_search_latency")
                        .description("Literature search latency")
                        .tag("language", language.name())
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers a gauge for the number of active sessions.
     */
    public void registerActiveSessions(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_active_sessions", valueSupplier, s -> s.get().doubleValue())
                .description("Sessions currently registered in the connection pool")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers a gauge for the number of idle pooled handles.
     */
    public void registerAvailableHandles(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_available_handles", valueSupplier, s -> s.get().doubleValue())
                .description("Backend handles waiting in the connection pool")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

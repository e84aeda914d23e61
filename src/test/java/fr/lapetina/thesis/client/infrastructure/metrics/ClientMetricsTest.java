package fr.lapetina.thesis.client.infrastructure.metrics;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.ErrorType;
import fr.lapetina.thesis.client.domain.model.SearchLanguage;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ClientMetricsTest {

    private ClientMetrics metrics;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = new ClientMetrics("test");
        registry = metrics.getRegistry();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count calls per backend and outcome")
    void shouldCountCalls() {
        metrics.recordCall(BackendKind.OPENAI, true, Duration.ofMillis(20));
        metrics.recordCall(BackendKind.OPENAI, true, Duration.ofMillis(30));
        metrics.recordCall(BackendKind.OPENAI, false, Duration.ofMillis(40));

        assertThat(registry.get("test_calls_total").tag("backend", "openai").tag("outcome", "success").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("test_calls_total").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_call_latency").tag("backend", "openai").timer().count())
                .isEqualTo(3);
    }

    @Test
    @DisplayName("should count errors, retries and pool events")
    void shouldCountFailures() {
        metrics.incrementErrorCount(BackendKind.GEMINI, ErrorType.TIMEOUT);
        metrics.incrementRetryCount(BackendKind.GEMINI);
        metrics.incrementRetryCount(BackendKind.GEMINI);
        metrics.incrementCircuitRejections();
        metrics.incrementOverflowHandles();
        metrics.incrementExpiredSessions();

        assertThat(registry.get("test_errors_total").tag("type", "TIMEOUT").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_retries_total").tag("backend", "gemini").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_circuit_rejections_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_overflow_handles_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("test_sessions_expired_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose pool gauges")
    void shouldExposeGauges() {
        AtomicInteger active = new AtomicInteger(3);
        metrics.registerActiveSessions(active::get);
        metrics.registerAvailableHandles(() -> 1);

        active.set(4);

        assertThat(registry.get("test_active_sessions").gauge().value()).isEqualTo(4.0);
        assertThat(registry.get("test_available_handles").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should render recorded searches in the Prometheus scrape")
    void shouldScrapeSearches() {
        metrics.recordSearch(SearchLanguage.ENGLISH, true, Duration.ofMillis(120));

        String scrape = metrics.scrape();

        assertThat(scrape).contains("test_search_queries_total");
        assertThat(scrape).contains("language=\"ENGLISH\"");
        assertThat(scrape).contains("test_search_latency_seconds_count");
    }
}

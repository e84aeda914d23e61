package fr.lapetina.thesis.client.search;

import fr.lapetina.thesis.client.domain.model.SearchLanguage;
import fr.lapetina.thesis.client.domain.model.SearchQuery;
import fr.lapetina.thesis.client.domain.model.SearchResult;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchClientPoolTest {

    private ClientMetrics metrics;
    private AtomicInteger inFlight;
    private AtomicInteger maxInFlight;
    private SearchClientPool pool;

    @BeforeEach
    void setUp() {
        metrics = new ClientMetrics("test");
        inFlight = new AtomicInteger();
        maxInFlight = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
        metrics.close();
    }

    /**
     * Stub answering with the expression as message. Expressions "slow:<ms>" sleep first, "fail" throws.
     */
    private LiteratureSearchClient stubClient() {
        return query -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                String expression = query.expression();
                if (expression.startsWith("slow:")) {
                    Thread.sleep(Long.parseLong(expression.substring(5)));
                }
                if (expression.equals("fail")) {
                    throw new IOException("Search service returned HTTP 500");
                }
                return new SearchResult("200", expression, 0, 0, List.of());
            } finally {
                inFlight.decrementAndGet();
            }
        };
    }

    private SearchClientPool poolOf(int size) {
        List<LiteratureSearchClient> clients = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            clients.add(stubClient());
        }
        return new SearchClientPool(clients, metrics);
    }

    @Test
    @DisplayName("should keep query order even when an earlier query is slowest")
    void shouldPreserveOrder() {
        pool = poolOf(3);

        List<SearchResult> results = pool.dispatchConcurrent(List.of(
                SearchQuery.of("q1"),
                SearchQuery.of("slow:200"),
                SearchQuery.of("q3", SearchLanguage.ENGLISH)
        ));

        assertThat(results).extracting(SearchResult::message).containsExactly("q1", "slow:200", "q3");
    }

    @Test
    @DisplayName("should put null at the index of a failed query")
    void shouldReturnNullForFailure() {
        pool = poolOf(2);

        List<SearchResult> results = pool.dispatchConcurrent(List.of(
                SearchQuery.of("q1"),
                SearchQuery.of("fail"),
                SearchQuery.of("q3")
        ));

        assertThat(results).hasSize(3);
        assertThat(results.get(0).message()).isEqualTo("q1");
        assertThat(results.get(1)).isNull();
        assertThat(results.get(2).message()).isEqualTo("q3");
        assertThat(pool.getAvailableClients()).isEqualTo(2);
    }

    @Test
    @DisplayName("should never run more queries than clients")
    void shouldBoundConcurrency() {
        pool = poolOf(2);
        List<SearchQuery> queries = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            queries.add(SearchQuery.of("slow:30"));
        }

        List<SearchResult> results = pool.dispatchConcurrent(queries);

        assertThat(results).hasSize(6).doesNotContainNull();
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(pool.getAvailableClients()).isEqualTo(2);
    }

    @Test
    @DisplayName("should lend and take back clients")
    void shouldAcquireAndRelease() throws InterruptedException {
        pool = poolOf(1);

        LiteratureSearchClient client = pool.acquire();
        assertThat(pool.getAvailableClients()).isZero();

        pool.release(client);
        assertThat(pool.getAvailableClients()).isEqualTo(1);
        assertThatThrownBy(() -> pool.release(client)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should return an empty list for no queries")
    void shouldHandleNoQueries() {
        pool = poolOf(1);

        assertThat(pool.dispatchConcurrent(List.of())).isEmpty();
    }

    @Test
    @DisplayName("should record search metrics")
    void shouldRecordMetrics() {
        pool = poolOf(2);

        pool.dispatchConcurrent(List.of(SearchQuery.of("q1"), SearchQuery.of("fail")));

        assertThat(metrics.scrape())
                .contains("test_search_queries_total")
                .contains("outcome=\"success\"")
                .contains("outcome=\"failure\"");
    }
}

package fr.lapetina.thesis.client.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.model.SearchQuery;
import fr.lapetina.thesis.client.domain.model.SearchResult;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.http.ObjectMappers;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of interchangeable search clients with a scatter/gather helper.
 *
 * <p>{@link #dispatchConcurrent} runs one task per query; every task borrows a client,
 * runs the query and gives the client back, so at most {@code maxClients} queries are in flight.
 * Results keep the order of the queries and a failed query leaves {@code null} at its index.
 */
public final class SearchClientPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchClientPool.class);

    private final BlockingQueue<LiteratureSearchClient> clients;
    private final int maxClients;
    private final ClientMetrics metrics;
    private final ExecutorService executor;

    public SearchClientPool(List<? extends LiteratureSearchClient> clients, ClientMetrics metrics) {
        if (clients.isEmpty()) {
            throw new IllegalArgumentException("At least one search client is required");
        }
        this.maxClients = clients.size();
        this.clients = new ArrayBlockingQueue<>(maxClients, false, clients);
        this.metrics = metrics;

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxClients, r -> {
            Thread t = new Thread(r, "search-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Search client pool created: maxClients={}", maxClients);
    }

    /**
     * Builds a pool of {@link CnkiSearchClient}s sharing one HTTP client.
     */
    public static SearchClientPool create(ClientConfig.SearchConfig config, String accessToken, ClientMetrics metrics) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .build();
        ObjectMapper objectMapper = ObjectMappers.standard();

        List<LiteratureSearchClient> clients = new ArrayList<>(config.getMaxClients());
        for (int i = 0; i < config.getMaxClients(); i++) {
            clients.add(new CnkiSearchClient(httpClient, objectMapper, config, accessToken));
        }
        return new SearchClientPool(clients, metrics);
    }

    /**
     * Takes a client, waiting until one is free.
     */
    public LiteratureSearchClient acquire() throws InterruptedException {
        return clients.take();
    }

    /**
     * Gives a client back to the pool.
     *
     * @throws IllegalStateException when the pool is already full
     */
    public void release(LiteratureSearchClient client) {
        if (!clients.offer(client)) {
            throw new IllegalStateException("Search client pool is full; client was not borrowed from it");
        }
    }

    /**
     * Runs every query concurrently and waits for all of them.
     *
     * @return one result per query, in query order; null where the query failed
     */
    public List<SearchResult> dispatchConcurrent(List<SearchQuery> queries) {
        List<CompletableFuture<SearchResult>> futures = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            int index = i;
            SearchQuery query = queries.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> runQuery(index, query), executor));
        }

        List<SearchResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<SearchResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private SearchResult runQuery(int index, SearchQuery query) {
        Instant start = Instant.now();
        LiteratureSearchClient client;
        try {
            client = acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for a search client: index={}", index);
            return null;
        }

        try {
            SearchResult result = client.search(query);
            metrics.recordSearch(query.language(), true, Duration.between(start, Instant.now()));
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordSearch(query.language(), false, Duration.between(start, Instant.now()));
            log.warn("Search interrupted: index={}", index);
            return null;
        } catch (Exception e) {
            metrics.recordSearch(query.language(), false, Duration.between(start, Instant.now()));
            log.error("Search failed: index={}, language={}, error={}", index, query.language(), e.getMessage());
            return null;
        } finally {
            release(client);
        }
    }

    public int getMaxClients() {
        return maxClients;
    }

    public int getAvailableClients() {
        return clients.size();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Search client pool closed");
    }
}

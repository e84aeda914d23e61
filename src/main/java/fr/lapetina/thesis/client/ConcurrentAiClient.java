package fr.lapetina.thesis.client;

import fr.lapetina.thesis.client.domain.model.AiResponse;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.pool.ConnectionPool;
import fr.lapetina.thesis.client.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Facade for sending messages to the AI backend concurrently.
 *
 * <p>Messages sent without a session id run on a fresh session that is released as soon as
 * the call ends, successful or not. Messages sent with an id reuse that session, which the
 * caller owns until {@link #closeSession}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ClientContext context = ClientContext.create("config.yaml")) {
 *     ConcurrentAiClient client = context.getAiClient();
 *     String sessionId = client.createSession();
 *     AiResponse first = client.send("Summarize chapter 1", sessionId);
 *     AiResponse second = client.send("Now chapter 2", sessionId);
 *     client.closeSession(sessionId);
 * }
 * }</pre>
 */
public final class ConcurrentAiClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentAiClient.class);

    private final ClientConfig config;
    private final ConnectionPool connectionPool;
    private final ExecutorService workers;
    private final int maxWorkers;
    private final Duration batchTimeout;

    private volatile boolean initialized;
    private volatile boolean closed;

    public ConcurrentAiClient(ClientConfig config, ConnectionPool connectionPool) {
        this.config = config;
        this.connectionPool = connectionPool;
        this.maxWorkers = config.getPool().getMaxWorkers();
        this.batchTimeout = Duration.ofMillis(config.getPool().getBatchTimeoutMs());

        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxWorkers, r -> {
            Thread t = new Thread(r, "ai-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Initializes the connection pool. Called lazily by every operation; safe to call twice.
     *
     * @throws fr.lapetina.thesis.client.domain.exception.ConfigurationException when no backend is usable
     */
    public synchronized void initialize() {
        ensureOpen();
        if (initialized) {
            return;
        }
        connectionPool.initialize();
        initialized = true;
        log.info("ConcurrentAiClient initialized: backend={}, maxWorkers={}, maxConnections={}",
                connectionPool.getBackendKind(), maxWorkers, connectionPool.getMaxConnections());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ConcurrentAiClient is closed");
        }
    }

    /**
     * Sends a message on a fresh session, released after the call.
     */
    public AiResponse send(String message) {
        return send(message, null);
    }

    /**
     * Sends a message, reusing {@code sessionId} when given.
     *
     * @throws fr.lapetina.thesis.client.domain.exception.AiClientException when the call fails
     */
    public AiResponse send(String message, String sessionId) {
        ensureInitialized();
        boolean anonymous = sessionId == null;
        Session session = connectionPool.getSession(sessionId);
        try {
            return session.send(message);
        } catch (RuntimeException e) {
            log.error("Error sending message: sessionId={}, error={}", session.getId(), e.getMessage());
            throw e;
        } finally {
            if (anonymous) {
                connectionPool.releaseSession(session.getId());
            }
        }
    }

    public CompletableFuture<AiResponse> sendAsync(String message) {
        return sendAsync(message, null);
    }

    /**
     * Runs {@link #send(String, String)} on the worker pool.
     */
    public CompletableFuture<AiResponse> sendAsync(String message, String sessionId) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> send(message, sessionId), workers);
    }

    public List<AiResponse> sendBatch(List<String> messages) {
        return sendBatch(messages, null);
    }

    /**
     * Sends every message concurrently. Each message runs on its own session unless the batch holds
     * a single message and {@code sessionId} is given.
     *
     * @return one entry per message, in input order; null where the call failed or timed out
     */
    public List<AiResponse> sendBatch(List<String> messages, String sessionId) {
        ensureInitialized();
        String batchSessionId = sessionId != null && messages.size() == 1 ? sessionId : null;

        List<Future<AiResponse>> futures = new ArrayList<>(messages.size());
        for (String message : messages) {
            futures.add(workers.submit(() -> send(message, batchSessionId)));
        }

        List<AiResponse> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<AiResponse> future = futures.get(i);
            try {
                results.add(future.get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (ExecutionException e) {
                log.error("Batch message failed: index={}, error={}", i, e.getCause().getMessage());
                results.add(null);
            } catch (TimeoutException e) {
                // The call keeps running to its final outcome; only this entry gives up on it
                log.error("Batch message timed out: index={}, timeoutMs={}", i, batchTimeout.toMillis());
                results.add(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch interrupted: index={}", i);
                results.add(null);
            }
        }
        return results;
    }

    public CompletableFuture<List<AiResponse>> sendBatchAsync(List<String> messages) {
        return sendBatchAsync(messages, null);
    }

    /**
     * Asynchronous batch: every message is sent with the given session id, failures become null.
     */
    public CompletableFuture<List<AiResponse>> sendBatchAsync(List<String> messages, String sessionId) {
        ensureInitialized();
        List<CompletableFuture<AiResponse>> futures = new ArrayList<>(messages.size());
        for (String message : messages) {
            futures.add(sendAsync(message, sessionId).handle((response, error) -> {
                if (error != null) {
                    log.error("Async batch message failed: error={}", error.getMessage());
                    return null;
                }
                return response;
            }));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<AiResponse> results = new ArrayList<>(futures.size());
                    futures.forEach(f -> results.add(f.join()));
                    return results;
                });
    }

    /**
     * Registers a new session and returns its id. The caller must {@link #closeSession} it.
     */
    public String createSession() {
        ensureInitialized();
        return connectionPool.getSession().getId();
    }

    public void closeSession(String sessionId) {
        connectionPool.releaseSession(sessionId);
    }

    public List<String> getActiveSessions() {
        return connectionPool.getActiveSessionIds();
    }

    public BackendKind getBackendKind() {
        ensureInitialized();
        return connectionPool.getBackendKind();
    }

    /**
     * Describes the current backend configuration.
     */
    public Map<String, Object> getModelInfo() {
        BackendKind kind = getBackendKind();
        ClientConfig.BackendConfig backendConfig = config.backend(kind);
        String modelName = backendConfig.getModelName() != null && !backendConfig.getModelName().isBlank()
                ? backendConfig.getModelName()
                : kind.getDefaultModel();

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("backendKind", kind.getConfigName());
        info.put("modelName", modelName);
        info.put("maxWorkers", maxWorkers);
        info.put("maxConnections", connectionPool.getMaxConnections());
        info.put("activeSessions", connectionPool.getActiveSessionIds().size());
        return info;
    }

    public ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Shutting down ConcurrentAiClient...");

        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getPool().getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        connectionPool.shutdown();
        initialized = false;
        log.info("ConcurrentAiClient shut down");
    }
}

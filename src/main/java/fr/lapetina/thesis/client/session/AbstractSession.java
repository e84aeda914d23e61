package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.AiResponse;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.ChatMessage;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;
import fr.lapetina.thesis.client.infrastructure.http.BackendHandle;
import fr.lapetina.thesis.client.infrastructure.http.CircuitBreaker;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Send algorithm common to both backend shapes. Subclasses only provide the wire call.
 */
public abstract class AbstractSession implements Session {

    private final String id;
    private final BackendKind backendKind;
    private final Instant createdAt;
    private final Clock clock;
    private final ReentrantLock callLock = new ReentrantLock();
    private final RetryExecutor retryExecutor;
    private final CircuitBreaker circuitBreaker;
    private volatile Instant lastUsedAt;

    protected final ConversationHistory history = new ConversationHistory();
    protected final GenerationOptions options;
    protected final RetryPolicy retryPolicy;

    protected AbstractSession(
            String id,
            BackendKind backendKind,
            GenerationOptions options,
            RetryPolicy retryPolicy,
            CircuitBreaker circuitBreaker,
            ClientMetrics metrics,
            Clock clock
    ) {
        this.id = Objects.requireNonNull(id, "Session ID is required");
        this.backendKind = backendKind;
        this.options = options;
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastUsedAt = createdAt;
        this.retryExecutor = new RetryExecutor(id, backendKind, retryPolicy, circuitBreaker, metrics, clock);
    }

    /**
     * Performs one wire call for the given user message.
     */
    protected abstract BackendReply invokeBackend(String message) throws IOException, InterruptedException;

    @Override
    public final AiResponse send(String message) {
        Objects.requireNonNull(message, "Message is required");
        callLock.lock();
        try {
            touch();
            RetryExecutor.Outcome outcome = retryExecutor.execute(() -> invokeBackend(message));
            BackendReply reply = outcome.reply();
            history.appendTurn(message, reply.content());
            return new AiResponse(reply.content(), metadata(outcome), id, clock.instant(), backendKind);
        } finally {
            callLock.unlock();
        }
    }

    private Map<String, Object> metadata(RetryExecutor.Outcome outcome) {
        BackendReply reply = outcome.reply();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("attempt", outcome.attempt());
        metadata.put("totalAttempts", retryPolicy.totalAttempts());
        metadata.put("responseTimeMs", outcome.responseTime().toMillis());
        metadata.put("model", reply.model() != null ? reply.model() : options.modelName());
        metadata.put("finishReason", reply.finishReason());
        metadata.put("usage", reply.usage());
        if (circuitBreaker != null) {
            metadata.put("circuitBreakerState", circuitBreaker.getState().name());
        }
        return metadata;
    }

    private void touch() {
        Instant now = clock.instant();
        if (now.isAfter(lastUsedAt)) {
            lastUsedAt = now;
        }
    }

    @Override
    public boolean isExpired(Duration maxIdle) {
        return Duration.between(lastUsedAt, clock.instant()).compareTo(maxIdle) > 0;
    }

    @Override
    public List<ChatMessage> historySnapshot() {
        return history.snapshot();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public BackendKind getBackendKind() {
        return backendKind;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    /**
     * Circuit breaker owned by this session, or null.
     */
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public abstract BackendHandle getHandle();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id='" + id + '\'' +
                ", handle=" + getHandle().getId() +
                ", historySize=" + history.size() +
                '}';
    }
}

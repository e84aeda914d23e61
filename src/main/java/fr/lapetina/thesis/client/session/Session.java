package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.AiResponse;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.ChatMessage;
import fr.lapetina.thesis.client.infrastructure.http.BackendHandle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Stateful conversation against one AI backend.
 *
 * Calls on the same session are strictly serialized; the history is consistent
 * with the order in which they completed.
 */
public interface Session {

    String getId();

    BackendKind getBackendKind();

    Instant getCreatedAt();

    Instant getLastUsedAt();

    /**
     * Sends one user message, applying the session's circuit breaker and retry policy.
     *
     * @throws fr.lapetina.thesis.client.domain.exception.CircuitOpenException      if the breaker rejects the call
     * @throws fr.lapetina.thesis.client.domain.exception.RetriesExhaustedException if every attempt failed
     */
    AiResponse send(String message);

    /**
     * True once the session has been idle for longer than {@code maxIdle}.
     */
    boolean isExpired(Duration maxIdle);

    List<ChatMessage> historySnapshot();

    /**
     * Backend handle this session borrowed from the pool.
     */
    BackendHandle getHandle();
}

package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.ChatMessage;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;
import fr.lapetina.thesis.client.infrastructure.http.ChatBackend;
import fr.lapetina.thesis.client.infrastructure.http.CircuitBreaker;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Session over a multi-turn chat backend, guarded by its own circuit breaker.
 * Each call sends the system prompt, the compacted history and the new user message.
 */
public final class ChatSession extends AbstractSession {

    private static final Logger log = LoggerFactory.getLogger(ChatSession.class);

    private final ChatBackend backend;
    private final String systemPrompt;
    private final int maxHistoryPairs;
    private final boolean compressHistory;

    public ChatSession(
            String id,
            ChatBackend backend,
            GenerationOptions options,
            RetryPolicy retryPolicy,
            CircuitBreaker circuitBreaker,
            String systemPrompt,
            int maxHistoryPairs,
            boolean compressHistory,
            ClientMetrics metrics,
            Clock clock
    ) {
        super(id, BackendKind.OPENAI, options, retryPolicy,
                Objects.requireNonNull(circuitBreaker, "Circuit breaker is required"), metrics, clock);
        this.backend = backend;
        this.systemPrompt = systemPrompt;
        this.maxHistoryPairs = maxHistoryPairs;
        this.compressHistory = compressHistory;
    }

    @Override
    protected BackendReply invokeBackend(String message) throws IOException, InterruptedException {
        List<ChatMessage> managed = history.outbound(maxHistoryPairs, compressHistory);

        List<ChatMessage> messages = new ArrayList<>(managed.size() + 2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        messages.addAll(managed);
        messages.add(ChatMessage.user(message));

        if (log.isDebugEnabled()) {
            int totalChars = messages.stream().mapToInt(m -> m.content().length()).sum();
            log.debug("Chat request: sessionId={}, messages={}, chars={}, historyKept={}/{}",
                    getId(), messages.size(), totalChars, managed.size(), history.size());
        }
        return backend.chat(messages, options);
    }

    @Override
    public ChatBackend getHandle() {
        return backend;
    }
}

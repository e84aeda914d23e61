package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.http.BackendHandle;
import fr.lapetina.thesis.client.infrastructure.http.ChatBackend;
import fr.lapetina.thesis.client.infrastructure.http.CircuitBreaker;
import fr.lapetina.thesis.client.infrastructure.http.GenerateBackend;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;

import java.time.Clock;
import java.time.Duration;

/**
 * Wraps a backend handle into the session variant matching its protocol.
 */
public final class SessionFactory {

    private final ClientConfig config;
    private final ClientMetrics metrics;
    private final Clock clock;

    public SessionFactory(ClientConfig config, ClientMetrics metrics, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SessionFactory(ClientConfig config, ClientMetrics metrics) {
        this(config, metrics, Clock.systemUTC());
    }

    public Session create(String sessionId, BackendHandle handle) {
        BackendKind kind = handle.getKind();
        ClientConfig.BackendConfig backendConfig = config.backend(kind);
        GenerationOptions options = generationOptions(kind, backendConfig);
        RetryPolicy retryPolicy = RetryPolicy.from(backendConfig);

        switch (kind) {
            case OPENAI:
                if (!(handle instanceof ChatBackend)) {
                    throw new IllegalStateException("Handle " + handle.getId() + " does not speak the chat protocol");
                }
                ClientConfig.SessionConfig sessionConfig = config.getSession();
                return new ChatSession(
                        sessionId,
                        (ChatBackend) handle,
                        options,
                        retryPolicy,
                        newCircuitBreaker(sessionId),
                        backendConfig.getSystemPrompt(),
                        sessionConfig.getMaxHistoryPairs(),
                        sessionConfig.isCompressHistory(),
                        metrics,
                        clock
                );
            case GEMINI:
                if (!(handle instanceof GenerateBackend)) {
                    throw new IllegalStateException("Handle " + handle.getId() + " does not speak the generate protocol");
                }
                return new GenerateSession(sessionId, (GenerateBackend) handle, options, retryPolicy, metrics, clock);
            default:
                throw new IllegalStateException("Unsupported backend kind: " + kind);
        }
    }

    private GenerationOptions generationOptions(BackendKind kind, ClientConfig.BackendConfig backendConfig) {
        String modelName = backendConfig.getModelName() != null && !backendConfig.getModelName().isBlank()
                ? backendConfig.getModelName()
                : kind.getDefaultModel();
        return new GenerationOptions(
                modelName,
                backendConfig.getTemperature(),
                backendConfig.getMaxTokens(),
                Duration.ofMillis(backendConfig.getTimeoutMs())
        );
    }

    private CircuitBreaker newCircuitBreaker(String sessionId) {
        ClientConfig.CircuitBreakerConfig cb = config.getCircuitBreaker();
        return new CircuitBreaker(
                "session-" + sessionId,
                cb.getFailureThreshold(),
                Duration.ofMillis(cb.getResetTimeoutMs()),
                cb.getHalfOpenMaxCalls(),
                clock
        );
    }
}

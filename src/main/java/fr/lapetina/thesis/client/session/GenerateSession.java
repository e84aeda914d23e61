package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;
import fr.lapetina.thesis.client.infrastructure.http.GenerateBackend;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;

import java.io.IOException;
import java.time.Clock;

/**
 * Session over a single-prompt backend. Sends only the new message; history is kept locally.
 */
public final class GenerateSession extends AbstractSession {

    private final GenerateBackend backend;

    public GenerateSession(
            String id,
            GenerateBackend backend,
            GenerationOptions options,
            RetryPolicy retryPolicy,
            ClientMetrics metrics,
            Clock clock
    ) {
        super(id, BackendKind.GEMINI, options, retryPolicy, null, metrics, clock);
        this.backend = backend;
    }

    @Override
    protected BackendReply invokeBackend(String message) throws IOException, InterruptedException {
        return backend.generate(message, options);
    }

    @Override
    public GenerateBackend getHandle() {
        return backend;
    }
}

package fr.lapetina.thesis.client.infrastructure.http;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;

import java.io.IOException;

/**
 * Single-prompt backend.
 */
public interface GenerateBackend extends BackendHandle {

    BackendReply generate(String prompt, GenerationOptions options)
            throws IOException, InterruptedException;

    @Override
    default BackendKind getKind() {
        return BackendKind.GEMINI;
    }
}

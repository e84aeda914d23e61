package fr.lapetina.thesis.client.infrastructure.http;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.ChatMessage;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;

import java.io.IOException;
import java.util.List;

/**
 * Multi-turn backend taking a role-tagged message list.
 */
public interface ChatBackend extends BackendHandle {

    BackendReply chat(List<ChatMessage> messages, GenerationOptions options)
            throws IOException, InterruptedException;

    @Override
    default BackendKind getKind() {
        return BackendKind.OPENAI;
    }
}

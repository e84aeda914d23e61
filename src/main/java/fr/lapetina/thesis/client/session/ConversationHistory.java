package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.ChatMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of a session's conversation.
 *
 * The full record stays in memory; {@link #outbound} bounds what is sent upstream.
 */
public final class ConversationHistory {

    static final String SUMMARY_PREFIX = "[Summary of earlier conversation: ";

    private final List<ChatMessage> messages = new ArrayList<>();

    public synchronized void appendTurn(String userMessage, String assistantMessage) {
        messages.add(ChatMessage.user(userMessage));
        messages.add(ChatMessage.assistant(assistantMessage));
    }

    public synchronized List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    /**
     * Returns the messages to send upstream, keeping at most the last {@code maxPairs} exchanges.
     * With {@code compress}, older messages are replaced by one synthetic assistant summary turn.
     */
    public synchronized List<ChatMessage> outbound(int maxPairs, boolean compress) {
        int window = Math.max(0, maxPairs) * 2;
        if (messages.size() <= window) {
            return List.copyOf(messages);
        }

        List<ChatMessage> recent = messages.subList(messages.size() - window, messages.size());
        if (!compress) {
            return List.copyOf(recent);
        }

        int omitted = messages.size() - window;
        List<ChatMessage> result = new ArrayList<>(window + 1);
        result.add(ChatMessage.assistant(SUMMARY_PREFIX + omitted + " earlier messages ("
                + (omitted / 2) + " exchanges) omitted; they covered the user's previous questions"
                + " and the assistant's answers.]"));
        result.addAll(recent);
        return result;
    }
}

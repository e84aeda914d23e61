package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.ChatMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationHistoryTest {

    private ConversationHistory history;

    @BeforeEach
    void setUp() {
        history = new ConversationHistory();
        for (int i = 1; i <= 4; i++) {
            history.appendTurn("question " + i, "answer " + i);
        }
    }

    @Test
    @DisplayName("should record turns in order")
    void shouldRecordTurnsInOrder() {
        List<ChatMessage> snapshot = history.snapshot();

        assertThat(snapshot).hasSize(8);
        assertThat(snapshot.get(0)).isEqualTo(ChatMessage.user("question 1"));
        assertThat(snapshot.get(1)).isEqualTo(ChatMessage.assistant("answer 1"));
        assertThat(snapshot.get(7)).isEqualTo(ChatMessage.assistant("answer 4"));
    }

    @Test
    @DisplayName("should send everything while within the window")
    void shouldSendEverythingWithinWindow() {
        assertThat(history.outbound(4, true)).isEqualTo(history.snapshot());
        assertThat(history.outbound(10, false)).hasSize(8);
    }

    @Test
    @DisplayName("should replace older turns with a summary when compressing")
    void shouldSummarizeOlderTurns() {
        List<ChatMessage> outbound = history.outbound(2, true);

        assertThat(outbound).hasSize(5);
        assertThat(outbound.get(0).role()).isEqualTo(ChatMessage.ASSISTANT);
        assertThat(outbound.get(0).content()).startsWith(ConversationHistory.SUMMARY_PREFIX).contains("4 earlier messages");
        assertThat(outbound.subList(1, 5)).containsExactly(
                ChatMessage.user("question 3"),
                ChatMessage.assistant("answer 3"),
                ChatMessage.user("question 4"),
                ChatMessage.assistant("answer 4")
        );
    }

    @Test
    @DisplayName("should truncate to the window without compression")
    void shouldTruncateWithoutCompression() {
        List<ChatMessage> outbound = history.outbound(1, false);

        assertThat(outbound).containsExactly(
                ChatMessage.user("question 4"),
                ChatMessage.assistant("answer 4")
        );
    }

    @Test
    @DisplayName("should never truncate the stored history")
    void shouldKeepFullHistory() {
        history.outbound(1, true);
        history.outbound(1, false);

        assertThat(history.size()).isEqualTo(8);
    }
}

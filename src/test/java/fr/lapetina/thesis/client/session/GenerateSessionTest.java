package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.exception.RetriesExhaustedException;
import fr.lapetina.thesis.client.domain.model.AiResponse;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import fr.lapetina.thesis.client.support.MutableClock;
import fr.lapetina.thesis.client.support.StubBackends.StubGenerateBackend;
import fr.lapetina.thesis.client.support.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static fr.lapetina.thesis.client.support.StubBackends.fail;
import static fr.lapetina.thesis.client.support.StubBackends.reply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerateSessionTest {

    private ClientMetrics metrics;
    private StubGenerateBackend backend;
    private GenerateSession session;

    @BeforeEach
    void setUp() {
        ClientConfig config = TestConfigs.fastConfig("gemini");
        metrics = new ClientMetrics("test");
        backend = new StubGenerateBackend("gemini-1");
        session = (GenerateSession) new SessionFactory(config, metrics, new MutableClock()).create("gen-1", backend);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should send only the new prompt")
    void shouldSendOnlyThePrompt() {
        backend.script(reply("first answer"), reply("second answer"));

        session.send("first");
        AiResponse response = session.send("second");

        assertThat(backend.getPrompts()).containsExactly("first", "second");
        assertThat(response.content()).isEqualTo("second answer");
        assertThat(response.backendKind()).isEqualTo(BackendKind.GEMINI);
        assertThat(response.metadata()).doesNotContainKey("circuitBreakerState");
        assertThat(session.historySnapshot()).hasSize(4);
    }

    @Test
    @DisplayName("should have no circuit breaker and keep retrying on every call")
    void shouldNotTripBreaker() {
        backend.setDefault(fail(new IOException("down")));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> session.send("question")).isInstanceOf(RetriesExhaustedException.class);
        }

        assertThat(session.getCircuitBreaker()).isNull();
        assertThat(backend.getCalls()).isEqualTo(9);
    }
}

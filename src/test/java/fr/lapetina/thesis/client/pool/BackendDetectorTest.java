package fr.lapetina.thesis.client.pool;

import fr.lapetina.thesis.client.domain.exception.ConfigurationException;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendDetectorTest {

    private final BackendDetector detector = new BackendDetector();
    private ClientConfig config;

    @BeforeEach
    void setUp() {
        config = new ClientConfig();
    }

    private static ClientEnvironment env(String... pairs) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put(pairs[i], pairs[i + 1]);
        }
        return ClientEnvironment.of(values);
    }

    @Test
    @DisplayName("should honor an explicit override")
    void shouldHonorOverride() {
        config.getPool().setBackendKind("gemini");

        assertThat(detector.detect(config, env())).isEqualTo(BackendKind.GEMINI);
    }

    @Test
    @DisplayName("should reject an unknown override")
    void shouldRejectUnknownOverride() {
        config.getPool().setBackendKind("claude");

        assertThatThrownBy(() -> detector.detect(config, env()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("backendKind");
    }

    @Test
    @DisplayName("should pick OpenAI when its base and a key are configured")
    void shouldPickConfiguredOpenAi() {
        config.getOpenai().setApiBase("https://proxy.example.com/v1");

        assertThat(detector.detect(config, env("GOOGLE_API_KEY", "k"))).isEqualTo(BackendKind.OPENAI);
    }

    @Test
    @DisplayName("should pick Gemini when only a key is present")
    void shouldPickGeminiWithKeyOnly() {
        assertThat(detector.detect(config, env("GOOGLE_API_KEY", "k"))).isEqualTo(BackendKind.GEMINI);
    }

    @Test
    @DisplayName("should prefer OpenAI when the environment base looks OpenAI-compatible")
    void shouldUseEnvironmentBase() {
        assertThat(detector.detect(config, env(
                "GOOGLE_API_KEY", "k",
                "GOOGLE_API_BASE", "https://gateway.example.com/v1"))).isEqualTo(BackendKind.OPENAI);
    }

    @Test
    @DisplayName("should fall back to the environment when both sections are disabled")
    void shouldFallBackToEnvironment() {
        config.getOpenai().setEnabled(false);
        config.getGemini().setEnabled(false);

        assertThat(detector.detect(config, env("GOOGLE_API_BASE", "https://openai.example.com")))
                .isEqualTo(BackendKind.OPENAI);
        assertThat(detector.detect(config, env("GOOGLE_API_KEY", "k")))
                .isEqualTo(BackendKind.GEMINI);
    }

    @Test
    @DisplayName("should fail when nothing is configured")
    void shouldFailWithoutConfiguration() {
        assertThatThrownBy(() -> detector.detect(config, env()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No valid AI backend configuration");
    }

    @Test
    @DisplayName("should evaluate custom rules in order")
    void shouldEvaluateCustomRulesInOrder() {
        BackendDetector custom = new BackendDetector(List.of(
                (c, e) -> Optional.empty(),
                (c, e) -> Optional.of(BackendKind.GEMINI),
                (c, e) -> Optional.of(BackendKind.OPENAI)
        ));

        assertThat(custom.detect(config, env())).isEqualTo(BackendKind.GEMINI);
    }
}

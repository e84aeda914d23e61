package fr.lapetina.thesis.client.pool;

import fr.lapetina.thesis.client.domain.exception.ConfigurationException;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which backend protocol the pool speaks.
 *
 * Rules are evaluated in order, first match wins:
 * <ol>
 *   <li>explicit {@code pool.backendKind} override</li>
 *   <li>OpenAI section enabled, with both an API base and an API key</li>
 *   <li>Gemini section enabled, with an API key</li>
 *   <li>environment fallback: an API base containing {@code /v1} or {@code openai}
 *       selects OpenAI, otherwise a key alone selects Gemini</li>
 * </ol>
 */
public final class BackendDetector {

    private static final Logger log = LoggerFactory.getLogger(BackendDetector.class);

    private final List<DetectionRule> rules;

    public BackendDetector(List<DetectionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public BackendDetector() {
        this(defaultRules());
    }

    public static List<DetectionRule> defaultRules() {
        return List.of(
                BackendDetector::explicitOverride,
                BackendDetector::configuredOpenAi,
                BackendDetector::configuredGemini,
                BackendDetector::environmentFallback
        );
    }

    /**
     * @throws ConfigurationException when no rule matches or the override is unknown
     */
    public BackendKind detect(ClientConfig config, ClientEnvironment environment) {
        for (DetectionRule rule : rules) {
            Optional<BackendKind> kind = rule.match(config, environment);
            if (kind.isPresent()) {
                log.info("Backend detected: kind={}", kind.get());
                return kind.get();
            }
        }
        ClientConfig.CredentialsConfig credentials = config.getCredentials();
        throw new ConfigurationException("No valid AI backend configuration found: "
                + "override=" + config.getPool().getBackendKind()
                + ", openaiEnabled=" + config.getOpenai().isEnabled()
                + ", geminiEnabled=" + config.getGemini().isEnabled()
                + ", apiKeySet=" + apiKey(config, environment).isPresent()
                + ", apiKeyEnv=" + credentials.getApiKeyEnv());
    }

    static Optional<BackendKind> explicitOverride(ClientConfig config, ClientEnvironment environment) {
        try {
            return BackendKind.fromConfig(config.getPool().getBackendKind());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid pool.backendKind: " + e.getMessage(), e);
        }
    }

    static Optional<BackendKind> configuredOpenAi(ClientConfig config, ClientEnvironment environment) {
        ClientConfig.BackendConfig openai = config.getOpenai();
        if (!openai.isEnabled()) {
            return Optional.empty();
        }
        Optional<String> base = nonBlank(openai.getApiBase())
                .or(() -> environment.lookup(config.getCredentials().getApiBaseEnv()));
        if (base.isPresent() && apiKey(config, environment).isPresent()) {
            log.debug("OpenAI-compatible backend configured: apiBase={}", base.get());
            return Optional.of(BackendKind.OPENAI);
        }
        return Optional.empty();
    }

    static Optional<BackendKind> configuredGemini(ClientConfig config, ClientEnvironment environment) {
        if (config.getGemini().isEnabled() && apiKey(config, environment).isPresent()) {
            return Optional.of(BackendKind.GEMINI);
        }
        return Optional.empty();
    }

    static Optional<BackendKind> environmentFallback(ClientConfig config, ClientEnvironment environment) {
        Optional<String> base = environment.lookup(config.getCredentials().getApiBaseEnv());
        if (base.isPresent()) {
            String value = base.get().toLowerCase(Locale.ROOT);
            if (value.contains("/v1") || value.contains("openai")) {
                return Optional.of(BackendKind.OPENAI);
            }
        }
        if (apiKey(config, environment).isPresent()) {
            return Optional.of(BackendKind.GEMINI);
        }
        return Optional.empty();
    }

    private static Optional<String> apiKey(ClientConfig config, ClientEnvironment environment) {
        return nonBlank(config.getCredentials().getApiKey())
                .or(() -> environment.lookup(config.getCredentials().getApiKeyEnv()));
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}

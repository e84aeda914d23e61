package fr.lapetina.thesis.client.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.exception.ConfigurationException;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates HTTP backend handles from configuration and environment.
 *
 * Credentials are resolved on every {@link #create} so that a missing key surfaces
 * as a {@link ConfigurationException} at pool initialization.
 */
public final class HttpBackendFactory implements BackendFactory {

    private static final Logger log = LoggerFactory.getLogger(HttpBackendFactory.class);

    static final String DEFAULT_GEMINI_BASE = "https://generativelanguage.googleapis.com";

    private final ClientConfig config;
    private final ClientEnvironment environment;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicInteger sequence = new AtomicInteger();

    public HttpBackendFactory(ClientConfig config, ClientEnvironment environment, Duration connectTimeout) {
        this.config = config;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = ObjectMappers.standard();
    }

    public HttpBackendFactory(ClientConfig config, ClientEnvironment environment) {
        this(config, environment, Duration.ofSeconds(10));
    }

    @Override
    public BackendHandle create(BackendKind kind) {
        String apiKey = resolveApiKey()
                .orElseThrow(() -> new ConfigurationException(
                        "API key not found: set credentials.apiKey or the "
                                + config.getCredentials().getApiKeyEnv() + " environment variable"));
        String id = kind.getConfigName() + "-" + sequence.incrementAndGet();

        switch (kind) {
            case OPENAI: {
                String baseUrl = resolveOpenAiBase()
                        .orElseThrow(() -> new ConfigurationException(
                                "API base URL not found in openai.apiBase or the "
                                        + config.getCredentials().getApiBaseEnv() + " environment variable"));
                log.debug("Creating OpenAI-compatible handle: id={}, baseUrl={}", id, baseUrl);
                return new OpenAiChatBackend(id, httpClient, objectMapper, baseUrl, apiKey);
            }
            case GEMINI: {
                String baseUrl = nonBlank(config.getGemini().getApiBase()).orElse(DEFAULT_GEMINI_BASE);
                log.debug("Creating Gemini handle: id={}, baseUrl={}", id, baseUrl);
                return new GeminiGenerateBackend(id, httpClient, objectMapper, baseUrl, apiKey);
            }
            default:
                throw new ConfigurationException("Unsupported backend kind: " + kind);
        }
    }

    Optional<String> resolveApiKey() {
        return nonBlank(config.getCredentials().getApiKey())
                .or(() -> environment.lookup(config.getCredentials().getApiKeyEnv()));
    }

    Optional<String> resolveOpenAiBase() {
        return nonBlank(config.getOpenai().getApiBase())
                .or(() -> environment.lookup(config.getCredentials().getApiBaseEnv()));
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}

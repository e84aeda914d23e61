package fr.lapetina.thesis.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.exception.TransientBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * JSON-over-HTTP plumbing shared by the backend implementations.
 *
 * Uses java.net.http.HttpClient; the client instance is shared by every handle
 * created from the same factory, so each handle only carries its identity and credentials.
 */
abstract class AbstractHttpBackend implements BackendHandle {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpBackend.class);

    private final String id;
    private final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final String baseUrl;
    protected final String apiKey;

    protected AbstractHttpBackend(String id, HttpClient httpClient, ObjectMapper objectMapper,
                                  String baseUrl, String apiKey) {
        this.id = id;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
    }

    @Override
    public String getId() {
        return id;
    }

    /**
     * Posts a JSON body and returns the parsed JSON answer.
     *
     * @throws TransientBackendException on a non-2xx status
     * @throws IOException on network failure, timeout or an unparseable body
     */
    protected JsonNode postJson(URI uri, Map<String, String> headers, Object body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
        headers.forEach(builder::header);

        Instant startTime = Instant.now();
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.warn("Backend call failed with HTTP error: handleId={}, status={}, latencyMs={}",
                    id, statusCode, latencyMs);
            throw TransientBackendException.httpStatus(statusCode,
                    "HTTP " + statusCode + " from " + uri.getHost() + ": " + errorMessage(response.body()));
        }

        log.debug("Backend call successful: handleId={}, status={}, latencyMs={}", id, statusCode, latencyMs);
        return objectMapper.readTree(response.body());
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: handleId={}", id);
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    @SuppressWarnings("unchecked")
    protected Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, Map.class);
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', baseUrl='" + baseUrl + "'}";
    }
}

package fr.lapetina.thesis.client.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.model.AccessToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetches a bearer token for the search service with the OAuth2 client-credentials grant.
 */
public final class AccessTokenClient {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI tokenUri;
    private final Duration timeout;

    public AccessTokenClient(HttpClient httpClient, ObjectMapper objectMapper, String oauthUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.tokenUri = URI.create(oauthUrl);
        this.timeout = timeout;
    }

    /**
     * @throws IOException when the server refuses the credentials or answers without a token
     */
    public AccessToken fetch(String clientId, String clientSecret) throws IOException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("grant_type", "client_credentials");

        String body = form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(tokenUri)
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.error("Token request failed: status={}, uri={}", response.statusCode(), tokenUri);
            throw new IOException("Token endpoint returned HTTP " + response.statusCode());
        }

        JsonNode json = objectMapper.readTree(response.body());
        JsonNode token = json.path("access_token");
        if (!token.isTextual() || token.asText().isBlank()) {
            throw new IOException("Token endpoint answered without access_token");
        }

        AccessToken accessToken = new AccessToken(
                token.asText(),
                json.path("token_type").asText("Bearer"),
                json.path("expires_in").asLong(0)
        );
        log.info("Access token obtained: {}", accessToken);
        return accessToken;
    }
}

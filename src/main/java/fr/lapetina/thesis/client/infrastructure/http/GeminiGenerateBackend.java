package fr.lapetina.thesis.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Gemini generate-content backend
 * ({@code POST {base}/v1beta/models/{model}:generateContent}).
 */
public final class GeminiGenerateBackend extends AbstractHttpBackend implements GenerateBackend {

    public GeminiGenerateBackend(String id, HttpClient httpClient, ObjectMapper objectMapper,
                                 String baseUrl, String apiKey) {
        super(id, httpClient, objectMapper, baseUrl, apiKey);
    }

    @Override
    public BackendReply generate(String prompt, GenerationOptions options)
            throws IOException, InterruptedException {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", prompt))
                )),
                "generationConfig", Map.of(
                        "temperature", options.temperature(),
                        "maxOutputTokens", options.maxTokens()
                )
        );

        String model = URLEncoder.encode(options.modelName(), StandardCharsets.UTF_8);
        JsonNode json = postJson(
                URI.create(baseUrl + "/v1beta/models/" + model + ":generateContent"),
                Map.of("x-goog-api-key", apiKey),
                body,
                options.timeout()
        );
        return parseReply(json, options.modelName());
    }

    private BackendReply parseReply(JsonNode json, String requestedModel) {
        JsonNode candidate = json.path("candidates").path(0);
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.path("text").isTextual()) {
                text.append(part.path("text").asText());
            }
        }
        return new BackendReply(
                text.length() > 0 ? text.toString() : null,
                json.path("modelVersion").asText(requestedModel),
                candidate.path("finishReason").isTextual() ? candidate.path("finishReason").asText() : null,
                toMap(json.path("usageMetadata"))
        );
    }
}

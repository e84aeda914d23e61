package fr.lapetina.thesis.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.model.BackendReply;
import fr.lapetina.thesis.client.domain.model.ChatMessage;
import fr.lapetina.thesis.client.domain.model.GenerationOptions;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions backend ({@code POST {base}/chat/completions}).
 */
public final class OpenAiChatBackend extends AbstractHttpBackend implements ChatBackend {

    public OpenAiChatBackend(String id, HttpClient httpClient, ObjectMapper objectMapper,
                             String baseUrl, String apiKey) {
        super(id, httpClient, objectMapper, baseUrl, apiKey);
    }

    @Override
    public BackendReply chat(List<ChatMessage> messages, GenerationOptions options)
            throws IOException, InterruptedException {
        Map<String, Object> body = new HashMap<>();
        body.put("model", options.modelName());
        body.put("messages", messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());
        body.put("temperature", options.temperature());
        body.put("max_tokens", options.maxTokens());

        JsonNode json = postJson(
                URI.create(baseUrl + "/chat/completions"),
                Map.of("Authorization", "Bearer " + apiKey),
                body,
                options.timeout()
        );
        return parseReply(json, options.modelName());
    }

    private BackendReply parseReply(JsonNode json, String requestedModel) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        return new BackendReply(
                content.isTextual() ? content.asText() : null,
                json.path("model").asText(requestedModel),
                choice.path("finish_reason").isTextual() ? choice.path("finish_reason").asText() : null,
                toMap(json.path("usage"))
        );
    }
}

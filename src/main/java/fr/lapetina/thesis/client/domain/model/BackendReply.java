package fr.lapetina.thesis.client.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw answer of a single backend call, before it is wrapped into an {@link AiResponse}.
 * {@code content} may be null or blank; callers treat that as a failed attempt.
 */
public record BackendReply(String content, String model, String finishReason, Map<String, Object> usage) {

    public BackendReply {
        // Usage values may be null
        usage = usage != null ? Collections.unmodifiableMap(new LinkedHashMap<>(usage)) : Map.of();
    }

    public static BackendReply of(String content) {
        return new BackendReply(content, null, null, null);
    }

    public boolean isEmpty() {
        return content == null || content.isBlank();
    }
}

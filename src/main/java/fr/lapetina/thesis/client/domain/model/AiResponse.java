package fr.lapetina.thesis.client.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Response of a session call. Immutable and thread-safe.
 */
public record AiResponse(
        String content,
        Map<String, Object> metadata,
        String sessionId,
        Instant timestamp,
        BackendKind backendKind
) {
    public AiResponse {
        Objects.requireNonNull(content, "Content is required");
        Objects.requireNonNull(sessionId, "Session ID is required");
        Objects.requireNonNull(backendKind, "Backend kind is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        // Metadata values may be null
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }
}

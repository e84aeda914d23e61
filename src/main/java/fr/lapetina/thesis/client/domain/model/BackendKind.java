package fr.lapetina.thesis.client.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Wire protocol shape of an AI backend.
 */
public enum BackendKind {
    /** OpenAI-compatible multi-turn chat completions */
    OPENAI("openai", "gpt-3.5-turbo"),

    /** Gemini-style single prompt generation */
    GEMINI("gemini", "gemini-1.5-flash");

    private final String configName;
    private final String defaultModel;

    BackendKind(String configName, String defaultModel) {
        this.configName = configName;
        this.defaultModel = defaultModel;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Model used when the backend section does not name one.
     */
    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Parses a configured backend kind.
     *
     * @return the kind, or empty for {@code auto}, blank or null
     * @throws IllegalArgumentException for an unknown name
     */
    public static Optional<BackendKind> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("auto".equals(normalized)) {
            return Optional.empty();
        }
        for (BackendKind kind : values()) {
            if (kind.configName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        throw new IllegalArgumentException("Unknown backend kind: " + value);
    }
}

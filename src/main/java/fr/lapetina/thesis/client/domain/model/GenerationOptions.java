package fr.lapetina.thesis.client.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call generation parameters handed to a backend.
 */
public record GenerationOptions(String modelName, double temperature, int maxTokens, Duration timeout) {

    public GenerationOptions {
        Objects.requireNonNull(modelName, "Model name is required");
        Objects.requireNonNull(timeout, "Timeout is required");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }
}

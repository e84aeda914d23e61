package fr.lapetina.thesis.client.infrastructure.config;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of process environment variables.
 * Tests substitute a fixed map.
 */
@FunctionalInterface
public interface ClientEnvironment {

    /**
     * Returns the raw value, or null when unset.
     */
    String get(String name);

    /**
     * Returns the value when set and not blank.
     */
    default Optional<String> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String value = get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    static ClientEnvironment system() {
        return System::getenv;
    }

    static ClientEnvironment of(Map<String, String> variables) {
        Map<String, String> copy = Map.copyOf(variables);
        return copy::get;
    }
}

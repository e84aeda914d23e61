package fr.lapetina.thesis.client.domain.model;

import java.util.Objects;

/**
 * OAuth2 bearer token for the literature search service.
 */
public record AccessToken(String value, String tokenType, long expiresInSeconds) {

    public AccessToken {
        Objects.requireNonNull(value, "Token value is required");
    }

    @Override
    public String toString() {
        return "AccessToken{tokenType='" + tokenType + "', expiresInSeconds=" + expiresInSeconds + '}';
    }
}

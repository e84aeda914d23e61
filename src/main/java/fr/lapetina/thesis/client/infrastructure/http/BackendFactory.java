package fr.lapetina.thesis.client.infrastructure.http;

import fr.lapetina.thesis.client.domain.model.BackendKind;

/**
 * Creates raw backend handles for the connection pool.
 */
@FunctionalInterface
public interface BackendFactory {

    /**
     * Creates a new handle speaking the given protocol.
     *
     * @throws fr.lapetina.thesis.client.domain.exception.ConfigurationException when credentials are missing
     */
    BackendHandle create(BackendKind kind);
}

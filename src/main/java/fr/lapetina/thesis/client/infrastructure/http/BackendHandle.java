package fr.lapetina.thesis.client.infrastructure.http;

import fr.lapetina.thesis.client.domain.model.BackendKind;

/**
 * Raw connection to an AI backend, owned by the connection pool and lent to one session at a time.
 */
public interface BackendHandle extends AutoCloseable {

    /**
     * Stable identifier, used in logs.
     */
    String getId();

    BackendKind getKind();

    @Override
    default void close() {
        // Nothing to release by default
    }
}

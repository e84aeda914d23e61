package fr.lapetina.thesis.client.session;

import fr.lapetina.thesis.client.domain.model.BackendReply;

import java.io.IOException;

/**
 * One wire call of a session, repeated by {@link RetryExecutor} on failure.
 */
@FunctionalInterface
interface BackendCall {

    BackendReply invoke() throws IOException, InterruptedException;
}

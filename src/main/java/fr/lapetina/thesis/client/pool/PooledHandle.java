package fr.lapetina.thesis.client.pool;

import fr.lapetina.thesis.client.infrastructure.http.BackendHandle;

/**
 * A backend handle lent to a session. Temporary handles were created past
 * {@code maxConnections} and are dropped on release instead of being pooled.
 */
record PooledHandle(BackendHandle handle, boolean temporary) {
}

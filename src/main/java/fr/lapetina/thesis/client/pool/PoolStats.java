package fr.lapetina.thesis.client.pool;

import fr.lapetina.thesis.client.domain.model.BackendKind;

/**
 * Statistics for a {@link ConnectionPool}.
 *
 * @param backendKind        detected backend, null before initialization
 * @param maxConnections     number of pooled handles created at initialization
 * @param availableHandles   pooled handles waiting to be lent
 * @param activeSessions     sessions currently registered
 * @param sessionsCreated    cumulative session creation count
 * @param overflowHandles    cumulative temporary handle count
 * @param sessionsExpired    cumulative count of sessions evicted for idleness
 */
public record PoolStats(
        BackendKind backendKind,
        int maxConnections,
        int availableHandles,
        int activeSessions,
        long sessionsCreated,
        long overflowHandles,
        long sessionsExpired
) {
}

/**
 * Connection pool for AI backend handles.
 *
 * <p>{@link fr.lapetina.thesis.client.pool.ConnectionPool} creates a fixed number of handles once the
 * backend has been detected by {@link fr.lapetina.thesis.client.pool.BackendDetector}, lends them to
 * sessions and takes them back on release. A background sweep evicts idle sessions.
 */
package fr.lapetina.thesis.client.pool;

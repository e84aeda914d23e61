/**
 * Stateful AI sessions.
 *
 * <p>A {@link fr.lapetina.thesis.client.session.Session} wraps one pooled backend handle and owns
 * its conversation history. Both variants share the send algorithm of
 * {@link fr.lapetina.thesis.client.session.AbstractSession}:
 * <ol>
 *   <li>take the per-session lock and mark the session used</li>
 *   <li>fail fast with {@code CircuitOpenException} when the session's breaker is open</li>
 *   <li>call the backend up to {@code maxRetries + 1} times, treating empty replies and
 *       timeouts like transport errors, backing off between attempts</li>
 *   <li>append the exchange to the history on success</li>
 * </ol>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link fr.lapetina.thesis.client.session.ChatSession} - chat protocol, owns a circuit breaker,
 *       sends a compacted history with each call</li>
 *   <li>{@link fr.lapetina.thesis.client.session.GenerateSession} - single prompt protocol</li>
 * </ul>
 */
package fr.lapetina.thesis.client.session;

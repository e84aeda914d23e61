/**
 * Resilient concurrent client layer for thesis evaluation.
 *
 * <h2>Entry points</h2>
 * <ul>
 *   <li>{@link fr.lapetina.thesis.client.ClientContext} - wires configuration, metrics, the AI client
 *       and the optional search pool</li>
 *   <li>{@link fr.lapetina.thesis.client.ConcurrentAiClient} - synchronous, asynchronous and batch sends
 *       over pooled sessions</li>
 *   <li>{@link fr.lapetina.thesis.client.ClientRegistry} - one shared context for callers that cannot
 *       receive it explicitly</li>
 * </ul>
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code session} - stateful sessions with circuit breaking and retry</li>
 *   <li>{@code pool} - backend handle pool, session registry and expiry sweep</li>
 *   <li>{@code search} - literature search clients and their fan-out pool</li>
 *   <li>{@code infrastructure} - configuration, HTTP backends and metrics</li>
 * </ul>
 */
package fr.lapetina.thesis.client;

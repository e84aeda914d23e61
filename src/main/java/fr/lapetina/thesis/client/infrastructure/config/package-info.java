/**
 * Configuration model and loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.thesis.client.infrastructure.config.ClientConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.thesis.client.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 *   <li>{@link fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment} - Environment variable lookup</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pool} - Worker and connection pool sizing, backend selection</li>
 *   <li>{@code credentials} - API key and endpoint sources</li>
 *   <li>{@code openai}, {@code gemini} - Model, timeout and retry policy per backend</li>
 *   <li>{@code circuitBreaker} - Failure threshold and recovery settings</li>
 *   <li>{@code session} - Idle expiry, sweep interval, history compaction</li>
 *   <li>{@code search} - Literature search endpoint, credentials and pool size</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.thesis.client.infrastructure.config;

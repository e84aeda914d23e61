/**
 * Value objects exchanged with the AI and literature search clients.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.thesis.client.domain.model.AiResponse} - Result of a session call</li>
 *   <li>{@link fr.lapetina.thesis.client.domain.model.ChatMessage} - Role-tagged conversation turn</li>
 *   <li>{@link fr.lapetina.thesis.client.domain.model.BackendKind} - Wire protocol of the AI backend</li>
 *   <li>{@link fr.lapetina.thesis.client.domain.model.SearchQuery} - Literature search input</li>
 *   <li>{@link fr.lapetina.thesis.client.domain.model.SearchResult} - Restructured search output</li>
 *   <li>{@link fr.lapetina.thesis.client.domain.model.ErrorType} - Categorized error types</li>
 * </ul>
 *
 * <p>All records in this package are immutable and safe to share between threads.
 */
package fr.lapetina.thesis.client.domain.model;

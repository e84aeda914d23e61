package fr.lapetina.thesis.client.search;

import fr.lapetina.thesis.client.domain.model.SearchQuery;
import fr.lapetina.thesis.client.domain.model.SearchResult;

import java.io.IOException;

/**
 * One connection to the literature search service. Instances are interchangeable
 * and are used by one caller at a time through {@link SearchClientPool}.
 */
@FunctionalInterface
public interface LiteratureSearchClient {

    /**
     * Runs one query.
     *
     * @throws IOException on a transport failure, a non-2xx status or a body that is not JSON
     */
    SearchResult search(SearchQuery query) throws IOException, InterruptedException;
}

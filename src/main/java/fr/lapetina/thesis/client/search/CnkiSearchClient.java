package fr.lapetina.thesis.client.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thesis.client.domain.model.SearchQuery;
import fr.lapetina.thesis.client.domain.model.SearchResult;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CNKI search API client: one expert-syntax query per call, filtered by publication date
 * and sorted newest first.
 */
public final class CnkiSearchClient implements LiteratureSearchClient {

    private static final Logger log = LoggerFactory.getLogger(CnkiSearchClient.class);

    static final String FALLBACK_UPPER_BOUND = "20220101";
    static final String SELECTED_FIELDS = "TI,AB,KY,DB,LY,YE,PT";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SearchResultParser parser;
    private final URI searchUri;
    private final String uniplatform;
    private final String accessToken;
    private final int pageSize;
    private final String defaultUpperBound;
    private final Duration requestTimeout;

    public CnkiSearchClient(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            ClientConfig.SearchConfig config,
            String accessToken
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.parser = new SearchResultParser();
        this.searchUri = URI.create(config.getSearchUrl());
        this.uniplatform = config.getUniplatform();
        this.accessToken = accessToken;
        this.pageSize = config.getPageSize();
        this.defaultUpperBound = PublicationDates.normalize(config.getDefaultPublicationUpperBound())
                .orElse(FALLBACK_UPPER_BOUND);
        this.requestTimeout = Duration.ofMillis(config.getRequestTimeoutMs());
    }

    @Override
    public SearchResult search(SearchQuery query) throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(requestBody(query));

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(searchUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("language", "CHS")
                .header("Authorization", "Bearer " + accessToken)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (uniplatform != null) {
            request.header("uniplatform", uniplatform);
        }

        Instant startTime = Instant.now();
        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("Search failed with HTTP error: status={}, language={}, latencyMs={}",
                    status, query.language(), latencyMs);
            throw new IOException("Search service returned HTTP " + status);
        }

        JsonNode json = objectMapper.readTree(response.body());
        SearchResult result = parser.parse(json);
        log.debug("Search completed: language={}, total={}, items={}, latencyMs={}",
                query.language(), result.total(), result.items().size(), latencyMs);
        return result;
    }

    Map<String, Object> requestBody(SearchQuery query) {
        String upperBound = query.publicationUpperBound()
                .map(PublicationDates::format)
                .orElse(defaultUpperBound);

        Map<String, Object> expertItem = new LinkedHashMap<>();
        expertItem.put("logic", "AND");
        expertItem.put("operator", "");
        expertItem.put("uf", "EXPERT");
        expertItem.put("uv", query.expression());

        Map<String, Object> dateItem = new LinkedHashMap<>();
        dateItem.put("logic", "AND");
        dateItem.put("operator", "LE");
        dateItem.put("uf", "PT");
        dateItem.put("uv", upperBound);

        Map<String, Object> q = new LinkedHashMap<>();
        q.put("logic", "AND");
        q.put("items", List.of(expertItem, dateItem));
        q.put("childItems", List.of());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("resource", "CROSSDB");
        body.put("product", query.language().getProducts());
        body.put("extend", 1);
        body.put("start", 1);
        body.put("size", pageSize);
        body.put("sort", "PT");
        body.put("sequence", "DESC");
        body.put("select", SELECTED_FIELDS);
        body.put("q", q);
        return body;
    }
}

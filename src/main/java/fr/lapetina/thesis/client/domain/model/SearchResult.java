package fr.lapetina.thesis.client.domain.model;

import java.util.List;

/**
 * Restructured answer of one literature search.
 */
public record SearchResult(String code, String message, long total, int size, List<Paper> items) {

    public SearchResult {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}

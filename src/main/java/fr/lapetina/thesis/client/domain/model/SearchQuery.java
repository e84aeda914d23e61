package fr.lapetina.thesis.client.domain.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A single literature search: an expert-syntax expression, its language
 * and an optional inclusive upper bound on publication date.
 */
public record SearchQuery(String expression, SearchLanguage language, LocalDate publishedBefore) {

    public SearchQuery {
        Objects.requireNonNull(expression, "Expression is required");
        if (language == null) {
            language = SearchLanguage.CHINESE;
        }
    }

    public static SearchQuery of(String expression) {
        return new SearchQuery(expression, SearchLanguage.CHINESE, null);
    }

    public static SearchQuery of(String expression, SearchLanguage language) {
        return new SearchQuery(expression, language, null);
    }

    public Optional<LocalDate> publicationUpperBound() {
        return Optional.ofNullable(publishedBefore);
    }
}

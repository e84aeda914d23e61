package fr.lapetina.thesis.client.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * One literature record returned by the search service, with HTML markup removed.
 */
public record Paper(
        String title,
        String abstractText,
        String keywords,
        String journal,
        String database,
        String publicationYear,
        List<Author> authors,
        List<String> affiliations,
        List<String> coreJournalIndexes,
        List<String> funds,
        List<String> detailedKeywords,
        int downloadCount,
        int citationCount
) {
    public Paper {
        authors = authors != null ? List.copyOf(authors) : List.of();
        affiliations = affiliations != null ? List.copyOf(affiliations) : List.of();
        coreJournalIndexes = coreJournalIndexes != null ? List.copyOf(coreJournalIndexes) : List.of();
        funds = funds != null ? List.copyOf(funds) : List.of();
        detailedKeywords = detailedKeywords != null ? List.copyOf(detailedKeywords) : List.of();
    }

    public Optional<String> firstAuthor() {
        return authors.isEmpty() ? Optional.empty() : Optional.of(authors.get(0).name());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title = "";
        private String abstractText = "";
        private String keywords = "";
        private String journal = "";
        private String database = "";
        private String publicationYear = "";
        private List<Author> authors;
        private List<String> affiliations;
        private List<String> coreJournalIndexes;
        private List<String> funds;
        private List<String> detailedKeywords;
        private int downloadCount;
        private int citationCount;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder abstractText(String abstractText) {
            this.abstractText = abstractText;
            return this;
        }

        public Builder keywords(String keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder journal(String journal) {
            this.journal = journal;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder publicationYear(String publicationYear) {
            this.publicationYear = publicationYear;
            return this;
        }

        public Builder authors(List<Author> authors) {
            this.authors = authors;
            return this;
        }

        public Builder affiliations(List<String> affiliations) {
            this.affiliations = affiliations;
            return this;
        }

        public Builder coreJournalIndexes(List<String> coreJournalIndexes) {
            this.coreJournalIndexes = coreJournalIndexes;
            return this;
        }

        public Builder funds(List<String> funds) {
            this.funds = funds;
            return this;
        }

        public Builder detailedKeywords(List<String> detailedKeywords) {
            this.detailedKeywords = detailedKeywords;
            return this;
        }

        public Builder downloadCount(int downloadCount) {
            this.downloadCount = downloadCount;
            return this;
        }

        public Builder citationCount(int citationCount) {
            this.citationCount = citationCount;
            return this;
        }

        public Paper build() {
            return new Paper(
                    title, abstractText, keywords, journal, database, publicationYear,
                    authors, affiliations, coreJournalIndexes, funds, detailedKeywords,
                    downloadCount, citationCount
            );
        }
    }
}

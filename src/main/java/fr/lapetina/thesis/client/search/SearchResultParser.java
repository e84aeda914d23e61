package fr.lapetina.thesis.client.search;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.thesis.client.domain.model.Author;
import fr.lapetina.thesis.client.domain.model.Paper;
import fr.lapetina.thesis.client.domain.model.SearchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Restructures the raw search service payload into a {@link SearchResult}.
 *
 * Raw layout: {@code {code, message, data: {total, size, data: [record...]}}} where each record
 * carries a {@code metadata} list of name/value pairs plus optional {@code authors},
 * {@code affiliations}, {@code indexes}, {@code funds}, {@code keywords} and {@code metrics}.
 */
public final class SearchResultParser {

    private static final Pattern HTML_TAG = Pattern.compile("<.*?>");

    public SearchResult parse(JsonNode root) {
        JsonNode data = root.path("data");
        List<Paper> papers = new ArrayList<>();
        for (JsonNode record : data.path("data")) {
            papers.add(parsePaper(record));
        }
        return new SearchResult(
                textOrNull(root.path("code")),
                textOrNull(root.path("message")),
                data.path("total").asLong(0),
                data.path("size").asInt(0),
                papers
        );
    }

    private Paper parsePaper(JsonNode record) {
        Paper.Builder paper = Paper.builder();

        for (JsonNode meta : record.path("metadata")) {
            String value = meta.path("value").asText("");
            switch (meta.path("name").asText("")) {
                case "TI":
                    paper.title(cleanHtml(value));
                    break;
                case "AB":
                    paper.abstractText(cleanHtml(value));
                    break;
                case "KY":
                    paper.keywords(cleanHtml(value));
                    break;
                case "LY":
                    paper.journal(cleanHtml(value));
                    break;
                case "DB":
                    paper.database(value);
                    break;
                case "YE":
                    paper.publicationYear(value);
                    break;
                default:
                    break;
            }
        }

        List<Author> authors = new ArrayList<>();
        for (JsonNode author : record.path("authors")) {
            authors.add(new Author(
                    author.path("title").asText(""),
                    author.path("id").asText(""),
                    author.path("corresponding").asBoolean(false)
            ));
        }
        paper.authors(authors);

        paper.affiliations(titles(record.path("affiliations"), "title"));
        paper.coreJournalIndexes(titles(record.path("indexes"), "name"));
        paper.funds(titles(record.path("funds"), "title"));

        List<String> detailedKeywords = new ArrayList<>();
        for (JsonNode group : record.path("keywords")) {
            for (JsonNode item : group.path("items")) {
                detailedKeywords.add(cleanHtml(item.path("item").asText("")));
            }
        }
        paper.detailedKeywords(detailedKeywords);

        for (JsonNode metric : record.path("metrics")) {
            String name = metric.path("name").asText("");
            if ("DTC".equals(name)) {
                paper.downloadCount(count(metric.path("value")));
            } else if ("CTC".equals(name)) {
                paper.citationCount(count(metric.path("value")));
            }
        }

        return paper.build();
    }

    private static List<String> titles(JsonNode array, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            values.add(node.path(field).asText(""));
        }
        return values;
    }

    // Non-numeric counts are reported as zero
    private static int count(JsonNode value) {
        String text = value.asText("0").trim();
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            return 0;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    static String cleanHtml(String raw) {
        return raw == null ? "" : HTML_TAG.matcher(raw).replaceAll("");
    }
}

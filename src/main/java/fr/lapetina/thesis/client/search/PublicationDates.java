package fr.lapetina.thesis.client.search;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes free-form publication dates to the {@code yyyyMMdd} form the search service filters on.
 *
 * Accepted inputs include {@code 2021年5月3日}, {@code 2021/05/03}, {@code 2021.5},
 * {@code 20210503} and values followed by a parenthesised note. A missing day defaults to the 1st.
 */
public final class PublicationDates {

    private static final Pattern NOTE = Pattern.compile("（.*?）|\\(.*?\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern DASHED_DAY = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern COMPACT_DAY = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})$");
    private static final Pattern DASHED_MONTH = Pattern.compile("^(\\d{4})-(\\d{1,2})$");
    private static final Pattern COMPACT_MONTH = Pattern.compile("^(\\d{4})(\\d{1,2})$");
    private static final Pattern EMBEDDED_DAY = Pattern.compile("(\\d{4})(\\d{1,2})(\\d{1,2})");

    private PublicationDates() {
    }

    public static String format(LocalDate date) {
        return date.format(DateTimeFormatter.BASIC_ISO_DATE);
    }

    /**
     * @return the date as {@code yyyyMMdd}, or empty when the text holds no recognizable date
     */
    public static Optional<String> normalize(String text) {
        return parse(text).map(PublicationDates::format);
    }

    public static Optional<LocalDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String chunk = NOTE.matcher(text.trim()).replaceAll("");
        chunk = chunk.replace('年', '-')
                .replace('月', '-')
                .replace("日", "")
                .replace('/', '-')
                .replace('.', '-')
                .replace('．', '-');
        chunk = WHITESPACE.matcher(chunk).replaceAll("");
        if (chunk.isEmpty()) {
            return Optional.empty();
        }

        String trimmedDashes = chunk.replaceAll("-+$", "");
        for (String candidate : List.of(chunk, trimmedDashes, chunk.replace("-", ""))) {
            Optional<LocalDate> date = matchDay(DASHED_DAY, candidate)
                    .or(() -> matchDay(COMPACT_DAY, candidate))
                    .or(() -> matchMonth(DASHED_MONTH, candidate))
                    .or(() -> matchMonth(COMPACT_MONTH, candidate));
            if (date.isPresent()) {
                return date;
            }
        }

        Matcher embedded = EMBEDDED_DAY.matcher(chunk);
        if (embedded.find()) {
            return toDate(embedded.group(1), embedded.group(2), embedded.group(3));
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> matchDay(Pattern pattern, String candidate) {
        Matcher m = pattern.matcher(candidate);
        return m.matches() ? toDate(m.group(1), m.group(2), m.group(3)) : Optional.empty();
    }

    private static Optional<LocalDate> matchMonth(Pattern pattern, String candidate) {
        Matcher m = pattern.matcher(candidate);
        return m.matches() ? toDate(m.group(1), m.group(2), "1") : Optional.empty();
    }

    private static Optional<LocalDate> toDate(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}

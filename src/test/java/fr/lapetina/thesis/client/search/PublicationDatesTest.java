package fr.lapetina.thesis.client.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PublicationDatesTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("should normalize free-form dates")
    @CsvSource({
            "2021年5月3日, 20210503",
            "2021年5月, 20210501",
            "2021/05/03, 20210503",
            "2021.5, 20210501",
            "20210503, 20210503",
            "2021-12, 20211201",
            "'2021-05-03 (online first)', 20210503",
            "2021年5月3日（网络首发）, 20210503",
            "' 2020 - 1 - 15 ', 20200115"
    })
    void shouldNormalize(String input, String expected) {
        assertThat(PublicationDates.normalize(input)).contains(expected);
    }

    @ParameterizedTest
    @DisplayName("should reject text without a date")
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "unknown", "2021", "2021-13-01", "(note only)"})
    void shouldRejectInvalid(String input) {
        assertThat(PublicationDates.normalize(input)).isEmpty();
    }
}

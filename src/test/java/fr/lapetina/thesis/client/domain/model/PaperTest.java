package fr.lapetina.thesis.client.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperTest {

    @Test
    void builderShouldDefaultTextAndLists() {
        Paper paper = Paper.builder().title("T").build();

        assertThat(paper.title()).isEqualTo("T");
        assertThat(paper.journal()).isEmpty();
        assertThat(paper.authors()).isEmpty();
        assertThat(paper.funds()).isEmpty();
        assertThat(paper.firstAuthor()).isEmpty();
    }

    @Test
    void listsShouldBeDefensiveCopies() {
        List<String> funds = new ArrayList<>(List.of("NSFC"));
        Paper paper = Paper.builder().funds(funds).build();

        funds.add("Other");

        assertThat(paper.funds()).containsExactly("NSFC");
        assertThatThrownBy(() -> paper.funds().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}

package com.finscan.compliance.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.finscan.compliance.document.InMemoryPage;
import com.finscan.compliance.domain.SearchHit;
import java.util.List;
import org.junit.jupiter.api.Test;

class TermLocatorTest {

    private static final String FILLER = "lorem ipsum ".repeat(40);

    private final TermLocator locator = new TermLocator();

    private final List<InMemoryPage> pages = List.of(
        InMemoryPage.of(1, "Cover page"),
        InMemoryPage.of(2, "Table of contents"),
        InMemoryPage.of(3, "Risk factors overview. " + FILLER + "Item 1A. Details follow.")
    );

    @Test
    void firstListedTermWinsOnTheSamePage() {
        SearchHit hit = locator.locate(pages, List.of("item 1a", "risk factors"));

        assertThat(hit.found()).isTrue();
        assertThat(hit.page()).isEqualTo(3);
        assertThat(hit.excerpt()).contains("Item 1A").doesNotContain("Risk factors");
    }

    @Test
    void reversedTermOrderPicksTheOtherTerm() {
        SearchHit hit = locator.locate(pages, List.of("risk factors", "item 1a"));

        assertThat(hit.page()).isEqualTo(3);
        assertThat(hit.excerpt()).startsWith("Risk factors").doesNotContain("Item 1A");
    }

    @Test
    void earlierPageWinsOverTermOrder() {
        List<InMemoryPage> split = List.of(
            InMemoryPage.of(1, "nothing here"),
            InMemoryPage.of(2, "Discussion of RISK FACTORS"),
            InMemoryPage.of(3, "Item 1A")
        );

        SearchHit hit = locator.locate(split, List.of("item 1a", "risk factors"));

        assertThat(hit.page()).isEqualTo(2);
    }

    @Test
    void excerptSpansOneHundredBeforeAndTwoHundredAfter() {
        String text = "a".repeat(150) + "TARGET" + "b".repeat(250);

        SearchHit hit = locator.locate(List.of(InMemoryPage.of(1, text)), List.of("target"));

        assertThat(hit.excerpt()).isEqualTo("a".repeat(100) + "TARGET" + "b".repeat(194));
    }

    @Test
    void excerptIsClippedAndTrimmed() {
        SearchHit hit = locator.locate(List.of(InMemoryPage.of(1, "  see Item 8 below \n")), List.of("item 8"));

        assertThat(hit.excerpt()).isEqualTo("see Item 8 below");
    }

    @Test
    void noMatchIsNotFound() {
        SearchHit hit = locator.locate(pages, List.of("controls and procedures"));

        assertThat(hit.found()).isFalse();
        assertThat(hit.page()).isNull();
        assertThat(hit.excerpt()).isNull();
    }
}

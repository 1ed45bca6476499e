package com.finscan.compliance.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.finscan.compliance.domain.DocumentType;
import com.finscan.compliance.domain.SectionRequirement;
import java.util.List;
import org.junit.jupiter.api.Test;

class SectionCatalogTest {

    private final SectionCatalog catalog = new SectionCatalog();

    @Test
    void tenKRequiresFiveItems() {
        List<SectionRequirement> sections = catalog.requirementsFor("10-K");

        assertThat(sections).extracting(SectionRequirement::name).containsExactly(
            "Item 1: Business",
            "Item 1A: Risk Factors",
            "Item 7: MD&A",
            "Item 8: Financial Statements",
            "Item 9A: Controls and Procedures"
        );
        assertThat(sections.get(0).critical()).isFalse();
        assertThat(sections.get(1).critical()).isTrue();
        assertThat(sections.get(1).searchTerms()).containsExactly("item 1a", "risk factors");
    }

    @Test
    void everyKnownTypeHasRequirements() {
        for (DocumentType type : DocumentType.values()) {
            assertThat(catalog.requirementsFor(type)).isNotEmpty();
        }
        assertThat(catalog.requirementsFor(DocumentType.SOX_404))
            .filteredOn(section -> !section.critical())
            .extracting(SectionRequirement::name)
            .containsExactly("Change Management");
    }

    @Test
    void unknownTypeHasNoRequirements() {
        assertThat(catalog.requirementsFor("10-Q")).isEmpty();
        assertThat(catalog.requirementsFor("10-k")).isEmpty();
        assertThat(catalog.requirementsFor((String) null)).isEmpty();
    }
}

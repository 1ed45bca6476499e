package com.finscan.compliance.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.finscan.compliance.document.InMemoryPage;
import com.finscan.compliance.domain.RedFlagCategory;
import com.finscan.compliance.domain.RedFlagFinding;
import com.finscan.compliance.domain.RedFlagReport;
import com.finscan.compliance.domain.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class RedFlagDetectorTest {

    private final RedFlagDetector detector = new RedFlagDetector();

    @Test
    void overlappingRelatedPartyPhrasesAreReportedSeparately() {
        InMemoryPage page = InMemoryPage.of(9,
            "Note 12 Related Party Transactions\nThe company entered a related party transaction with a director.");

        List<RedFlagFinding> findings = detector.detect(List.of(page));

        assertThat(findings).extracting(RedFlagFinding::phrase)
            .containsExactly("related party transaction", "related party");
        assertThat(findings).allSatisfy(finding -> {
            assertThat(finding.category()).isEqualTo(RedFlagCategory.RELATED_PARTY);
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.page()).isEqualTo(9);
            assertThat(finding.context()).isEqualTo("Note 12 Related Party Transactions");
        });
    }

    @Test
    void contextIsTheNearestPrecedingMarkerLine() {
        InMemoryPage page = InMemoryPage.of(1,
            "Item 7 Management's Discussion\nSection 3 Liquidity\nThere is substantial doubt about our ability to continue as a going concern.");

        RedFlagFinding finding = detector.detect(List.of(page)).get(0);

        assertThat(finding.phrase()).isEqualTo("going concern");
        assertThat(finding.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.context()).isEqualTo("Section 3 Liquidity");
    }

    @Test
    void contextIsUnknownWithoutMarker() {
        InMemoryPage page = InMemoryPage.of(1, "Management identified a material weakness in internal control.");

        RedFlagFinding finding = detector.detect(List.of(page)).get(0);

        assertThat(finding.category()).isEqualTo(RedFlagCategory.MATERIAL_WEAKNESS);
        assertThat(finding.context()).isEqualTo("Unknown section");
        assertThat(finding.excerpt()).isEqualTo("Management identified a material weakness in internal control.");
    }

    @Test
    void eachPageReportsItsOwnMatches() {
        List<InMemoryPage> pages = List.of(
            InMemoryPage.of(1, "Restatement of prior period results"),
            InMemoryPage.of(2, "nothing to see"),
            InMemoryPage.of(3, "The RESTATEMENT also affected an adverse opinion")
        );

        List<RedFlagFinding> findings = detector.detect(pages);

        assertThat(findings).extracting(RedFlagFinding::phrase, RedFlagFinding::page).containsExactly(
            tuple("restatement", 1),
            tuple("restatement", 3),
            tuple("adverse opinion", 3)
        );

        RedFlagReport.Summary summary = RedFlagReport.Summary.of(findings);
        assertThat(summary.totalFlags()).isEqualTo(3);
        assertThat(summary.critical()).isEqualTo(2);
        assertThat(summary.high()).isEqualTo(1);
        assertThat(summary.medium()).isZero();
    }
}

package com.finscan.compliance.engine;

import com.finscan.compliance.document.DocumentPage;
import com.finscan.compliance.domain.RedFlagCategory;
import com.finscan.compliance.domain.RedFlagFinding;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class RedFlagDetector {

    static final String UNKNOWN_SECTION = "Unknown section";

    private static final int EXCERPT_BEFORE = 100;
    private static final int EXCERPT_AFTER = 300;

    private static final List<String> CONTEXT_MARKERS = List.of("note ", "item ", "section ");

    // "related party transaction" and "related party" are both listed; each is reported on its own.
    private static final Map<String, RedFlagCategory> PHRASES = new LinkedHashMap<>();

    static {
        PHRASES.put("going concern", RedFlagCategory.GOING_CONCERN);
        PHRASES.put("material weakness", RedFlagCategory.MATERIAL_WEAKNESS);
        PHRASES.put("restatement", RedFlagCategory.RESTATEMENT);
        PHRASES.put("significant deficiency", RedFlagCategory.SIGNIFICANT_DEFICIENCY);
        PHRASES.put("qualified opinion", RedFlagCategory.QUALIFIED_OPINION);
        PHRASES.put("adverse opinion", RedFlagCategory.ADVERSE_OPINION);
        PHRASES.put("related party transaction", RedFlagCategory.RELATED_PARTY);
        PHRASES.put("related party", RedFlagCategory.RELATED_PARTY);
        PHRASES.put("subsequent event", RedFlagCategory.SUBSEQUENT_EVENT);
        PHRASES.put("contingent liability", RedFlagCategory.CONTINGENT_LIABILITY);
    }

    public List<RedFlagFinding> detect(List<? extends DocumentPage> pages) {
        List<RedFlagFinding> findings = new ArrayList<>();
        Set<FindingKey> seen = new HashSet<>();

        for (DocumentPage page : pages) {
            String text = page.text() == null ? "" : page.text();
            String lower = text.toLowerCase(Locale.ROOT);

            for (Map.Entry<String, RedFlagCategory> entry : PHRASES.entrySet()) {
                String phrase = entry.getKey();
                int position = lower.indexOf(phrase);
                if (position < 0 || !seen.add(new FindingKey(phrase, page.number()))) {
                    continue;
                }
                RedFlagCategory category = entry.getValue();
                findings.add(new RedFlagFinding(
                    phrase,
                    category,
                    category.severity(),
                    page.number(),
                    TextWindows.around(text, position, EXCERPT_BEFORE, EXCERPT_AFTER),
                    sectionContext(text, lower, position)
                ));
            }
        }
        return findings;
    }

    String sectionContext(String text, String lower, int position) {
        int best = -1;
        int bestEnd = -1;
        for (String marker : CONTEXT_MARKERS) {
            int start = lower.lastIndexOf(marker, position - marker.length());
            if (start < 0 || start <= best) {
                continue;
            }
            int end = text.indexOf('\n', start);
            if (end != -1) {
                best = start;
                bestEnd = end;
            }
        }
        if (best < 0) {
            return UNKNOWN_SECTION;
        }
        return text.substring(best, bestEnd).strip();
    }

    private record FindingKey(String phrase, int page) {
    }
}

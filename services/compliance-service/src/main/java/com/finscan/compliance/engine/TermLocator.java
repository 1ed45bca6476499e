package com.finscan.compliance.engine;

import com.finscan.compliance.document.DocumentPage;
import com.finscan.compliance.domain.SearchHit;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Case-insensitive phrase search across pages. The earliest page with any match wins; on that
 * page the first term in the caller's order wins, wherever it sits in the text.
 */
@Component
public class TermLocator {

    static final int EXCERPT_BEFORE = 100;
    static final int EXCERPT_AFTER = 200;

    public SearchHit locate(List<? extends DocumentPage> pages, List<String> terms) {
        for (DocumentPage page : pages) {
            String text = page.text() == null ? "" : page.text();
            String lower = text.toLowerCase(Locale.ROOT);
            for (String term : terms) {
                int position = lower.indexOf(term.toLowerCase(Locale.ROOT));
                if (position >= 0) {
                    return SearchHit.at(page.number(), TextWindows.around(text, position, EXCERPT_BEFORE, EXCERPT_AFTER));
                }
            }
        }
        return SearchHit.notFound();
    }
}

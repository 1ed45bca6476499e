package com.finscan.compliance.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tokens that share a baseline, kept in left-to-right order.
 */
final class TextLine {

    private final float y;
    private final List<PositionedToken> tokens = new ArrayList<>();
    private boolean sorted = true;

    TextLine(float y) {
        this.y = y;
    }

    float y() {
        return y;
    }

    void addToken(PositionedToken token) {
        if (token == null || token.text().isBlank()) {
            return;
        }
        tokens.add(token);
        sorted = false;
    }

    List<PositionedToken> tokens() {
        if (!sorted) {
            tokens.sort(Comparator.comparing(PositionedToken::x));
            sorted = true;
        }
        return tokens;
    }
}

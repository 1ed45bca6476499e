package com.finscan.compliance.document;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Extracts the text of a page while recording where each word sits, so that table rows can be
 * rebuilt from the same pass.
 */
final class PositionalTextStripper extends PDFTextStripper {

    private static final float Y_TOLERANCE = 1.5f;

    private final List<TextLine> lines = new ArrayList<>();

    PositionalTextStripper() throws IOException {
        setSortByPosition(true);
        setLineSeparator("\n");
        setParagraphEnd("\n");
    }

    List<TextLine> lines() {
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty() && !text.isBlank()) {
            float x = Float.MAX_VALUE;
            float endX = 0f;
            float y = Float.MAX_VALUE;
            for (TextPosition position : textPositions) {
                x = Math.min(x, position.getXDirAdj());
                endX = Math.max(endX, position.getXDirAdj() + position.getWidthDirAdj());
                y = Math.min(y, position.getYDirAdj());
            }
            resolveLine(y).addToken(new PositionedToken(x, endX, text));
        }
        super.writeString(text, textPositions);
    }

    private TextLine resolveLine(float y) {
        for (TextLine line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        TextLine line = new TextLine(y);
        lines.add(line);
        return line;
    }
}

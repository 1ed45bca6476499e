package com.finscan.compliance.document;

/**
 * A run of text on one baseline with its horizontal extent, in page units.
 */
record PositionedToken(float x, float endX, String text) {

    PositionedToken {
        endX = Math.max(endX, x);
        text = text == null ? "" : text;
    }
}

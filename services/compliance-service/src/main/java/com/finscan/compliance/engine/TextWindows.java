package com.finscan.compliance.engine;

final class TextWindows {

    private TextWindows() {
    }

    static String around(String text, int position, int before, int after) {
        int start = Math.max(0, Math.min(text.length(), position - before));
        int end = Math.max(start, Math.min(text.length(), position + after));
        return text.substring(start, end).strip();
    }
}

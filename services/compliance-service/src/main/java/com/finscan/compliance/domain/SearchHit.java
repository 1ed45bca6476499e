package com.finscan.compliance.domain;

public record SearchHit(
    boolean found,
    Integer page,
    String excerpt
) {
    private static final SearchHit NOT_FOUND = new SearchHit(false, null, null);

    public static SearchHit notFound() {
        return NOT_FOUND;
    }

    public static SearchHit at(int page, String excerpt) {
        return new SearchHit(true, page, excerpt);
    }
}

package com.docsearch.dto;

import java.util.List;

public record KeywordSearchResult(
        String query,
        String term,
        List<KeywordHit> results,
        int totalOccurrences
) {
    public boolean found() {
        return totalOccurrences > 0;
    }
}

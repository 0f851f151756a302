package com.docsearch.dto;

import java.util.List;

public record MultiSearchResult(
        String query,
        List<String> keywords,
        List<MultiHit> results
) {}

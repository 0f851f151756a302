package com.docsearch.dto;

import java.util.List;

public record PrefixSearchResult(
        String query,
        String prefix,
        List<PrefixMatch> results
) {}

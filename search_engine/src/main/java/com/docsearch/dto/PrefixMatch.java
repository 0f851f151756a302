package com.docsearch.dto;

public record PrefixMatch(
        String word,
        int frequency,
        int docCount
) {}

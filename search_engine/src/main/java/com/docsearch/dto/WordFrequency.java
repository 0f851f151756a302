package com.docsearch.dto;

public record WordFrequency(
        String word,
        int frequency
) {}

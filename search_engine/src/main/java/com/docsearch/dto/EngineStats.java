package com.docsearch.dto;

public record EngineStats(
        int totalDocs,
        int uniqueWords,
        long totalIndexed
) {}

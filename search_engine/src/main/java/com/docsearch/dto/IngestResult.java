package com.docsearch.dto;

public record IngestResult(
        int docId,
        String name,
        int wordsIndexed,
        int uniqueWords
) {}

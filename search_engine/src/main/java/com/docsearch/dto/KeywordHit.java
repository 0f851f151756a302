package com.docsearch.dto;

public record KeywordHit(
        int docId,
        String docName,
        int frequency,
        int totalWords
) {}

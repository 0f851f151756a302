package com.docsearch.dto;

public record MultiHit(
        int docId,
        String docName,
        int score,
        int totalWords
) {}

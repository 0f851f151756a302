package com.docsearch.dto;

public record Document(
        int id,
        String name,
        String content,
        int wordCount
) {}

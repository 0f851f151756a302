package com.docsearch.dto;

import java.util.List;

public record TopKResult(
        int k,
        int totalUniqueWords,
        List<WordFrequency> topWords
) {}

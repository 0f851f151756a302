package com.docsearch.dto;

public record ReplaceResult(
        String originalWord,
        String replacementWord,
        String modifiedText,
        int occurrencesReplaced
) {}

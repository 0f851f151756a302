package com.docsearch.core;

import java.util.List;

/**
 * A tokenized document that has not been committed to an index yet.
 *
 * @param wordCount whitespace-delimited words in the raw content
 * @param tokens    normalized tokens, in order, duplicates kept
 */
public record PreparedDocument(
        String name,
        String content,
        int wordCount,
        List<String> tokens
) {
    public PreparedDocument {
        tokens = List.copyOf(tokens);
    }
}

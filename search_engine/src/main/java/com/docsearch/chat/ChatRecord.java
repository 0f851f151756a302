package com.docsearch.chat;

/**
 * @param timestamp epoch seconds
 */
public record ChatRecord(
        String id,
        String title,
        long timestamp
) {}

package com.docsearch.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-term record of which documents contain the term and how often.
 * Entries keep the order in which documents were first recorded.
 */
public final class PostingsList {

    private final Map<Integer, PostingsEntry> entries = new LinkedHashMap<>();
    private int totalOccurrences;

    public void record(int docId) {
        if (docId < 0) throw new IllegalArgumentException("docId must be >= 0: " + docId);

        PostingsEntry e = entries.get(docId);
        if (e == null) {
            entries.put(docId, new PostingsEntry(docId));
        } else {
            e.increment();
        }
        totalOccurrences++;
    }

    public int totalOccurrences() {
        return totalOccurrences;
    }

    public int documentCount() {
        return entries.size();
    }

    public boolean contains(int docId) {
        return entries.containsKey(docId);
    }

    /** 0 when the document does not contain the term. */
    public int frequencyOf(int docId) {
        PostingsEntry e = entries.get(docId);
        return e == null ? 0 : e.frequency();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<PostingsEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }
}

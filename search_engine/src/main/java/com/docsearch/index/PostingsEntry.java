package com.docsearch.index;

public final class PostingsEntry {

    private final int docId;
    private int frequency;

    PostingsEntry(int docId) {
        this.docId = docId;
        this.frequency = 1;
    }

    public int docId() {
        return docId;
    }

    public int frequency() {
        return frequency;
    }

    void increment() {
        frequency++;
    }

    @Override
    public String toString() {
        return docId + ":" + frequency;
    }
}

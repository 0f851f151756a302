package com.docsearch.index;

/**
 * Fixed-size chained hash table from a term to its trie terminal node.
 * Used only to skip the root-to-leaf walk on exact lookups; the {@link Trie}
 * stays authoritative.
 *
 * <p>The table never resizes: chains get longer as the vocabulary grows.
 */
public final class HashIndex {

    public static final int BUCKET_COUNT = 1000;

    private final Entry[] buckets;
    private int size;

    public HashIndex() {
        this(BUCKET_COUNT);
    }

    HashIndex(int bucketCount) {
        if (bucketCount <= 0) throw new IllegalArgumentException("bucketCount must be > 0");
        this.buckets = new Entry[bucketCount];
    }

    /**
     * Sum of the term's char codes modulo the bucket count.
     */
    public static int bucketOf(String term, int bucketCount) {
        long sum = 0;
        for (int i = 0; i < term.length(); i++) {
            sum += term.charAt(i);
        }
        return (int) (sum % bucketCount);
    }

    public void put(String term, int node) {
        if (term == null || term.isEmpty()) throw new IllegalArgumentException("term must not be empty");

        int b = bucketOf(term, buckets.length);
        for (Entry e = buckets[b]; e != null; e = e.next) {
            if (e.term.equals(term)) {
                e.node = node;
                return;
            }
        }
        buckets[b] = new Entry(term, node, buckets[b]);
        size++;
    }

    /**
     * @return the node for {@code term}, or {@link Trie#NONE}
     */
    public int get(String term) {
        if (term == null || term.isEmpty()) return Trie.NONE;

        for (Entry e = buckets[bucketOf(term, buckets.length)]; e != null; e = e.next) {
            if (e.term.equals(term)) return e.node;
        }
        return Trie.NONE;
    }

    public int size() {
        return size;
    }

    public int bucketCount() {
        return buckets.length;
    }

    public int longestChain() {
        int longest = 0;
        for (Entry head : buckets) {
            int len = 0;
            for (Entry e = head; e != null; e = e.next) len++;
            longest = Math.max(longest, len);
        }
        return longest;
    }

    private static final class Entry {
        final String term;
        int node;
        final Entry next;

        Entry(String term, int node, Entry next) {
            this.term = term;
            this.node = node;
            this.next = next;
        }
    }
}

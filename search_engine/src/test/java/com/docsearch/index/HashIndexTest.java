package com.docsearch.index;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class HashIndexTest {

    @Test
    void bucketIsCharCodeSumModuloBucketCount() {
        // 'a' + 'b' = 97 + 98
        assertEquals(195, HashIndex.bucketOf("ab", HashIndex.BUCKET_COUNT));
        assertEquals(195 % 7, HashIndex.bucketOf("ab", 7));
    }

    @Test
    void anagramsCollideAndChainCorrectly() {
        HashIndex index = new HashIndex();
        index.put("listen", 10);
        index.put("silent", 20);
        index.put("enlist", 30);

        assertEquals(HashIndex.bucketOf("listen", 1000), HashIndex.bucketOf("silent", 1000));
        assertEquals(10, index.get("listen"));
        assertEquals(20, index.get("silent"));
        assertEquals(30, index.get("enlist"));
        assertEquals(3, index.longestChain());
        assertEquals(3, index.size());
    }

    @Test
    void putOnExistingTermUpdatesInPlace() {
        HashIndex index = new HashIndex();
        index.put("cat", 1);
        index.put("cat", 2);

        assertEquals(2, index.get("cat"));
        assertEquals(1, index.size());
    }

    @Test
    void missingTermReturnsNone() {
        HashIndex index = new HashIndex();
        index.put("cat", 1);

        assertEquals(Trie.NONE, index.get("act"));
        assertEquals(Trie.NONE, index.get(""));
        assertEquals(Trie.NONE, index.get(null));
    }

    @Test
    void tableDoesNotGrowWithManyTerms() {
        HashIndex index = new HashIndex(4);
        for (int i = 0; i < 100; i++) {
            index.put("term" + (char) ('a' + (i % 26)) + (char) ('a' + (i / 26)), i);
        }

        assertEquals(4, index.bucketCount());
        assertEquals(100, index.size());
        assertEquals(57, index.get("termfc"));
    }
}

package com.docsearch.core;

import com.docsearch.dto.Document;
import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.EngineStats;
import com.docsearch.dto.IngestResult;
import com.docsearch.dto.KeywordHit;
import com.docsearch.dto.KeywordSearchResult;
import com.docsearch.dto.MultiHit;
import com.docsearch.dto.MultiSearchResult;
import com.docsearch.dto.PrefixMatch;
import com.docsearch.dto.PrefixSearchResult;
import com.docsearch.dto.ReplaceResult;
import com.docsearch.dto.TopKResult;
import com.docsearch.dto.WordFrequency;
import com.docsearch.index.HashIndex;
import com.docsearch.index.PostingsEntry;
import com.docsearch.index.PostingsList;
import com.docsearch.index.Trie;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * In-memory full-text index over ingested documents.
 *
 * <p>Composes a {@link Trie} (authoritative term store), a {@link HashIndex}
 * (exact-lookup shortcut) and one {@link PostingsList} per term. Document ids
 * are issued sequentially from 0 and never reused.
 *
 * <p>Not thread-safe: at most one mutating call at a time, and no reads while
 * a mutation is in flight.
 */
public final class SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private static final Comparator<PrefixMatch> BY_FREQUENCY_THEN_WORD =
            Comparator.comparingInt(PrefixMatch::frequency).reversed()
                    .thenComparing(PrefixMatch::word);

    // equal totals: the term concentrated in fewer documents first, then by word
    private static final Comparator<TermTotal> TOP_WORDS =
            Comparator.comparingInt(TermTotal::frequency).reversed()
                    .thenComparingInt(TermTotal::docCount)
                    .thenComparing(TermTotal::word);

    private static final Comparator<MultiHit> BY_SCORE_THEN_ID =
            Comparator.comparingInt(MultiHit::score).reversed()
                    .thenComparingInt(MultiHit::docId);

    private final Trie trie = new Trie();
    private final HashIndex hashIndex = new HashIndex();
    private final List<Document> documents = new ArrayList<>();
    private long totalIndexed;

    // ---------------------------------------------------------------
    // ingestion
    // ---------------------------------------------------------------

    /**
     * Validates and tokenizes a document without touching any index.
     */
    public static EngineResponse<PreparedDocument> prepare(String name, String content) {
        if (Normalizer.isBlank(name)) {
            return EngineResponse.validation("name missing");
        }
        if (Normalizer.isBlank(content)) {
            return EngineResponse.validation("content missing");
        }

        int wordCount = Normalizer.words(content).size();
        return EngineResponse.ok(new PreparedDocument(name, content, wordCount, Normalizer.tokenize(content)));
    }

    /**
     * Assigns the next document id and records every token of the document.
     */
    public IngestResult commit(PreparedDocument doc) {
        int docId = documents.size();
        documents.add(new Document(docId, doc.name(), doc.content(), doc.wordCount()));

        Set<String> unique = new LinkedHashSet<>();
        for (String token : doc.tokens()) {
            Trie.Insertion ins = trie.insert(token, docId);
            if (ins.newTerm()) {
                hashIndex.put(token, ins.node());
            }
            unique.add(token);
        }
        totalIndexed += doc.tokens().size();

        logger.debug("Indexed document {} ({}) with {} tokens, {} unique",
                docId, doc.name(), doc.tokens().size(), unique.size());
        return new IngestResult(docId, doc.name(), doc.tokens().size(), unique.size());
    }

    public EngineResponse<IngestResult> index(String name, String content) {
        EngineResponse<PreparedDocument> prepared = prepare(name, content);
        if (!prepared.isOk()) return prepared.failure();
        return EngineResponse.ok(commit(prepared.payload()));
    }

    // ---------------------------------------------------------------
    // queries
    // ---------------------------------------------------------------

    public EngineResponse<KeywordSearchResult> searchKeyword(String query) {
        if (Normalizer.isBlank(query)) {
            return EngineResponse.validation("query missing");
        }

        Optional<String> term = Normalizer.normalize(query);
        if (term.isEmpty()) {
            return EngineResponse.ok(new KeywordSearchResult(query, "", List.of(), 0));
        }

        PostingsList postings = postingsFor(term.get());
        if (postings == null) {
            return EngineResponse.ok(new KeywordSearchResult(query, term.get(), List.of(), 0));
        }

        List<KeywordHit> hits = new ArrayList<>(postings.documentCount());
        int total = 0;
        for (PostingsEntry e : postings.entries()) {
            if (e.frequency() <= 0) continue;
            Document d = documents.get(e.docId());
            hits.add(new KeywordHit(d.id(), d.name(), e.frequency(), d.wordCount()));
            total += e.frequency();
        }
        hits.sort(Comparator.comparingInt(KeywordHit::docId));

        return EngineResponse.ok(new KeywordSearchResult(query, term.get(), hits, total));
    }

    public EngineResponse<PrefixSearchResult> searchPrefix(String query) {
        if (Normalizer.isBlank(query)) {
            return EngineResponse.validation("query missing");
        }

        String prefix = Normalizer.normalizePrefix(query);
        if (prefix.isEmpty()) {
            // nothing alphabetic to anchor on; do not dump the whole vocabulary
            return EngineResponse.ok(new PrefixSearchResult(query, prefix, List.of()));
        }

        List<PrefixMatch> matches = new ArrayList<>();
        for (Trie.TermPostings tp : trie.collectWithPrefix(prefix)) {
            PostingsList p = tp.postings();
            matches.add(new PrefixMatch(tp.term(), p.totalOccurrences(), p.documentCount()));
        }
        matches.sort(BY_FREQUENCY_THEN_WORD);

        return EngineResponse.ok(new PrefixSearchResult(query, prefix, matches));
    }

    /**
     * Documents containing every keyword of the query (logical AND). Score is
     * the sum of the keywords' frequencies in the document.
     */
    public EngineResponse<MultiSearchResult> searchMulti(String query) {
        if (Normalizer.isBlank(query)) {
            return EngineResponse.validation("query missing");
        }

        List<String> keywords = Normalizer.tokenize(query);
        if (keywords.isEmpty()) {
            return EngineResponse.ok(new MultiSearchResult(query, List.of(), List.of()));
        }

        // one entry per query keyword; a repeated keyword adds its frequency again
        List<PostingsList> perKeyword = new ArrayList<>(keywords.size());
        Map<String, PostingsList> distinct = new LinkedHashMap<>();
        for (String keyword : keywords) {
            PostingsList p = distinct.get(keyword);
            if (p == null) {
                p = postingsFor(keyword);
                if (p == null) {
                    return EngineResponse.ok(new MultiSearchResult(query, keywords, List.of()));
                }
                distinct.put(keyword, p);
            }
            perKeyword.add(p);
        }

        // drive the intersection from the shortest list
        List<PostingsList> lists = new ArrayList<>(distinct.values());
        lists.sort(Comparator.comparingInt(PostingsList::documentCount));
        PostingsList smallest = lists.get(0);

        List<MultiHit> hits = new ArrayList<>();
        for (PostingsEntry candidate : smallest.entries()) {
            int docId = candidate.docId();
            boolean all = true;
            for (PostingsList p : lists) {
                if (p.frequencyOf(docId) == 0) {
                    all = false;
                    break;
                }
            }
            if (all) {
                int score = 0;
                for (PostingsList p : perKeyword) {
                    score += p.frequencyOf(docId);
                }
                Document d = documents.get(docId);
                hits.add(new MultiHit(docId, d.name(), score, d.wordCount()));
            }
        }
        hits.sort(BY_SCORE_THEN_ID);

        return EngineResponse.ok(new MultiSearchResult(query, keywords, hits));
    }

    /**
     * The {@code k} terms with the highest corpus-wide occurrence count.
     */
    public EngineResponse<TopKResult> topK(int k) {
        if (k < 0) {
            return EngineResponse.validation("k must be >= 0");
        }
        if (k == 0) {
            return EngineResponse.ok(new TopKResult(k, trie.termCount(), List.of()));
        }

        // min-heap of the best k seen so far; head is the weakest
        PriorityQueue<TermTotal> heap = new PriorityQueue<>(TOP_WORDS.reversed());
        for (Trie.TermPostings tp : trie.allTerms()) {
            PostingsList p = tp.postings();
            heap.offer(new TermTotal(tp.term(), p.totalOccurrences(), p.documentCount()));
            if (heap.size() > k) heap.poll();
        }

        List<TermTotal> ranked = new ArrayList<>(heap);
        ranked.sort(TOP_WORDS);

        List<WordFrequency> top = new ArrayList<>(ranked.size());
        for (TermTotal t : ranked) {
            top.add(new WordFrequency(t.word(), t.frequency()));
        }
        return EngineResponse.ok(new TopKResult(k, trie.termCount(), top));
    }

    /**
     * Pure text transform; never reads or mutates the index.
     */
    public static EngineResponse<ReplaceResult> replace(String content, String findWord, String replaceWord) {
        return TextReplacer.replaceAll(content, findWord, replaceWord);
    }

    // ---------------------------------------------------------------
    // corpus
    // ---------------------------------------------------------------

    public List<Document> documents() {
        return Collections.unmodifiableList(new ArrayList<>(documents));
    }

    public Optional<Document> document(int id) {
        if (id < 0 || id >= documents.size()) return Optional.empty();
        return Optional.of(documents.get(id));
    }

    public EngineStats stats() {
        return new EngineStats(documents.size(), trie.termCount(), totalIndexed);
    }

    /** The id the next committed document will receive. */
    public int nextDocumentId() {
        return documents.size();
    }

    HashIndex hashIndex() {
        return hashIndex;
    }

    Trie trie() {
        return trie;
    }

    private PostingsList postingsFor(String term) {
        int node = hashIndex.get(term);
        PostingsList p = node == Trie.NONE ? null : trie.postings(node);
        if (p == null) {
            node = trie.lookup(term);
            if (node == Trie.NONE) return null;
            p = trie.postings(node);
        }
        return p == null || p.isEmpty() ? null : p;
    }

    private record TermTotal(String word, int frequency, int docCount) {}
}

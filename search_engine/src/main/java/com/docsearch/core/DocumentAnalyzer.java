package com.docsearch.core;

import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.KeywordSearchResult;
import com.docsearch.dto.PrefixSearchResult;
import com.docsearch.dto.TopKResult;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs engine queries against a single piece of text by indexing it into a
 * throwaway {@link SearchEngine}. The shared corpus is never involved.
 */
public final class DocumentAnalyzer {

    public static final int DEFAULT_TOP_K = 5;

    private static final String ANALYZED_NAME = "analyzed";

    public enum Action {
        FREQ,
        SEARCH,
        PREFIX,
        TOPK;

        public static Optional<Action> parse(String raw) {
            if (raw == null || raw.isBlank()) return Optional.empty();
            try {
                return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    private DocumentAnalyzer() {}

    /** Occurrences of one word in the text. */
    public static EngineResponse<KeywordSearchResult> frequency(String content, String word) {
        return withEngine(content, engine -> engine.searchKeyword(word));
    }

    public static EngineResponse<KeywordSearchResult> search(String content, String query) {
        return frequency(content, query);
    }

    public static EngineResponse<PrefixSearchResult> prefix(String content, String prefix) {
        return withEngine(content, engine -> engine.searchPrefix(prefix));
    }

    public static EngineResponse<TopKResult> topK(String content, int k) {
        return withEngine(content, engine -> engine.topK(k));
    }

    private static <T> EngineResponse<T> withEngine(String content,
                                                    Function<SearchEngine, EngineResponse<T>> query) {
        SearchEngine engine = new SearchEngine();
        EngineResponse<?> ingested = engine.index(ANALYZED_NAME, content);
        if (!ingested.isOk()) return ingested.failure();
        return query.apply(engine);
    }
}

package com.docsearch.service;

import com.docsearch.chat.ChatRecord;
import com.docsearch.chat.SplayTree;
import com.docsearch.core.DocumentAnalyzer;
import com.docsearch.core.PreparedDocument;
import com.docsearch.core.SearchEngine;
import com.docsearch.dto.Document;
import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.EngineStats;
import com.docsearch.dto.IngestResult;
import com.docsearch.dto.KeywordSearchResult;
import com.docsearch.dto.MultiSearchResult;
import com.docsearch.dto.PrefixSearchResult;
import com.docsearch.dto.ReplaceResult;
import com.docsearch.dto.TopKResult;
import com.docsearch.service.store.ChatSnapshotStore;
import com.docsearch.service.store.CorpusStore;
import com.docsearch.service.store.SnapshotIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The one object every request goes through. Owns the search engine, the
 * chat tree and their snapshot stores.
 *
 * <p>Each structure has its own read/write lock: mutations are exclusive,
 * reads share. Index reads and the tokenizing half of ingestion run on a
 * worker pool with a time budget; a call that overruns is abandoned and
 * reported as {@code TIMEOUT}. Mutations write the new snapshot first and
 * only then touch memory, so a failed write changes nothing.
 */
public final class EngineGateway implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EngineGateway.class);

    private final SearchEngine engine;
    private final SplayTree chats;
    private final ChatSnapshotStore chatStore;
    private final CorpusStore corpusStore;
    private final ExecutorService workers;
    private final long callTimeoutMs;

    private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock chatLock = new ReentrantReadWriteLock();

    private volatile boolean open;

    EngineGateway(SearchEngine engine,
                  SplayTree chats,
                  ChatSnapshotStore chatStore,
                  CorpusStore corpusStore,
                  int workerThreads,
                  long callTimeoutMs) {
        this.engine = engine;
        this.chats = chats;
        this.chatStore = chatStore;
        this.corpusStore = corpusStore;
        this.callTimeoutMs = callTimeoutMs;
        this.workers = Executors.newFixedThreadPool(workerThreads, new WorkerFactory());
    }

    /**
     * Builds a gateway from the snapshots on disk.
     *
     * @throws SnapshotIntegrityException when a snapshot is unreadable; the
     *         gateway is not created in that case
     */
    public static EngineGateway open(ChatSnapshotStore chatStore,
                                     CorpusStore corpusStore,
                                     int workerThreads,
                                     long callTimeoutMs) throws IOException {
        SearchEngine engine = new SearchEngine();
        for (CorpusStore.StoredDocument d : corpusStore.load()) {
            EngineResponse<IngestResult> r = engine.index(d.name(), d.content());
            if (!r.isOk() || r.payload().docId() != d.id()) {
                throw new SnapshotIntegrityException(corpusStore.file(), "replay diverged at document " + d.id());
            }
        }

        SplayTree chats = new SplayTree();
        for (ChatRecord c : chatStore.load()) {
            chats.insert(c.id(), c.title(), c.timestamp());
        }

        EngineGateway gateway = new EngineGateway(engine, chats, chatStore, corpusStore, workerThreads, callTimeoutMs);
        gateway.open = true;
        logger.info("Engine ready: {} documents, {} terms, {} chats",
                engine.stats().totalDocs(), engine.stats().uniqueWords(), chats.size());
        return gateway;
    }

    // ---------------------------------------------------------------
    // documents
    // ---------------------------------------------------------------

    public EngineResponse<IngestResult> ingest(String name, String content) {
        EngineResponse<PreparedDocument> prepared = bounded("ingest", () -> SearchEngine.prepare(name, content));
        if (!prepared.isOk()) return prepared.failure();
        if (!open) return unavailable();

        PreparedDocument doc = prepared.payload();
        indexLock.writeLock().lock();
        try {
            List<Document> next = new ArrayList<>(engine.documents());
            next.add(new Document(engine.nextDocumentId(), doc.name(), doc.content(), doc.wordCount()));
            try {
                corpusStore.replace(next);
            } catch (IOException e) {
                logger.error("Corpus snapshot write failed, document '{}' not indexed", doc.name(), e);
                return EngineResponse.unavailable("corpus snapshot write failed");
            }

            IngestResult result = engine.commit(doc);
            logger.info("Indexed document {} '{}' ({} words, {} unique)",
                    result.docId(), result.name(), result.wordsIndexed(), result.uniqueWords());
            return EngineResponse.ok(result);
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    public EngineResponse<List<Document>> documents() {
        return bounded("documents", () -> read(() -> EngineResponse.ok(engine.documents())));
    }

    public EngineResponse<EngineStats> stats() {
        return bounded("stats", () -> read(() -> EngineResponse.ok(engine.stats())));
    }

    // ---------------------------------------------------------------
    // queries
    // ---------------------------------------------------------------

    public EngineResponse<KeywordSearchResult> searchKeyword(String query) {
        return bounded("searchKeyword", () -> read(() -> engine.searchKeyword(query)));
    }

    public EngineResponse<PrefixSearchResult> searchPrefix(String query) {
        return bounded("searchPrefix", () -> read(() -> engine.searchPrefix(query)));
    }

    public EngineResponse<MultiSearchResult> searchMulti(String query) {
        return bounded("searchMulti", () -> read(() -> engine.searchMulti(query)));
    }

    public EngineResponse<TopKResult> topK(int k) {
        return bounded("topK", () -> read(() -> engine.topK(k)));
    }

    public EngineResponse<ReplaceResult> replace(String content, String find, String replacement) {
        return bounded("replace", () -> SearchEngine.replace(content, find, replacement));
    }

    public EngineResponse<KeywordSearchResult> analyzeFrequency(String content, String word) {
        return bounded("analyzeFrequency", () -> DocumentAnalyzer.frequency(content, word));
    }

    public EngineResponse<PrefixSearchResult> analyzePrefix(String content, String prefix) {
        return bounded("analyzePrefix", () -> DocumentAnalyzer.prefix(content, prefix));
    }

    public EngineResponse<TopKResult> analyzeTopK(String content, int k) {
        return bounded("analyzeTopK", () -> DocumentAnalyzer.topK(content, k));
    }

    // ---------------------------------------------------------------
    // chats
    // ---------------------------------------------------------------

    public EngineResponse<ChatRecord> chatAdd(String id, String title, long timestamp) {
        if (id == null || id.isBlank()) return EngineResponse.validation("chat id missing");
        if (title == null || title.isBlank()) return EngineResponse.validation("chat title missing");
        if (!open) return unavailable();

        chatLock.writeLock().lock();
        try {
            List<ChatRecord> next = new ArrayList<>();
            for (ChatRecord c : chats.inOrder()) {
                if (!c.id().equals(id)) next.add(c);
            }
            next.add(new ChatRecord(id, title, timestamp));
            next.sort(Comparator.comparing(ChatRecord::id));

            EngineResponse<ChatRecord> failed = persistChats(next);
            if (failed != null) return failed;

            return EngineResponse.ok(chats.insert(id, title, timestamp));
        } finally {
            chatLock.writeLock().unlock();
        }
    }

    public EngineResponse<ChatRecord> chatAccess(String id) {
        if (id == null || id.isBlank()) return EngineResponse.validation("chat id missing");
        if (!open) return unavailable();

        chatLock.writeLock().lock();
        try {
            if (!chats.contains(id)) return EngineResponse.notFound("Chat not found");

            // splaying changes the shape only; the id-ordered snapshot is rewritten as is
            EngineResponse<ChatRecord> failed = persistChats(chats.inOrder());
            if (failed != null) return failed;

            return EngineResponse.ok(chats.access(id).orElseThrow());
        } finally {
            chatLock.writeLock().unlock();
        }
    }

    public EngineResponse<List<ChatRecord>> chatList() {
        if (!open) return unavailable();

        chatLock.readLock().lock();
        try {
            return EngineResponse.ok(chats.list());
        } finally {
            chatLock.readLock().unlock();
        }
    }

    public EngineResponse<String> chatDelete(String id) {
        if (id == null || id.isBlank()) return EngineResponse.validation("chat id missing");
        if (!open) return unavailable();

        chatLock.writeLock().lock();
        try {
            List<ChatRecord> current = chats.inOrder();
            List<ChatRecord> next = new ArrayList<>(current.size());
            for (ChatRecord c : current) {
                if (!c.id().equals(id)) next.add(c);
            }
            if (next.size() == current.size()) return EngineResponse.notFound("Chat not found");

            EngineResponse<String> failed = persistChats(next);
            if (failed != null) return failed;

            chats.delete(id);
            return EngineResponse.ok("Chat deleted");
        } finally {
            chatLock.writeLock().unlock();
        }
    }

    public EngineResponse<String> chatClear() {
        if (!open) return unavailable();

        chatLock.writeLock().lock();
        try {
            EngineResponse<String> failed = persistChats(List.of());
            if (failed != null) return failed;

            chats.clear();
            return EngineResponse.ok("All chats cleared");
        } finally {
            chatLock.writeLock().unlock();
        }
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        workers.shutdownNow();
        logger.info("Engine gateway closed");
    }

    // ---------------------------------------------------------------
    // plumbing
    // ---------------------------------------------------------------

    /**
     * Runs {@code call} on the worker pool and waits at most the configured
     * budget. An overrunning call is cancelled and never retried.
     */
    <T> EngineResponse<T> bounded(String operation, Callable<EngineResponse<T>> call) {
        if (!open) return unavailable();

        Future<EngineResponse<T>> future;
        try {
            future = workers.submit(call);
        } catch (RejectedExecutionException e) {
            return EngineResponse.unavailable("engine is shutting down");
        }

        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("{} exceeded {} ms and was abandoned", operation, callTimeoutMs);
            return EngineResponse.timeout(operation + " timed out after " + callTimeoutMs + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return EngineResponse.unavailable("interrupted while waiting for " + operation);
        } catch (ExecutionException e) {
            throw new IllegalStateException(operation + " failed", e.getCause());
        }
    }

    SplayTree chats() {
        return chats;
    }

    private <T> EngineResponse<T> read(Supplier<EngineResponse<T>> query) {
        indexLock.readLock().lock();
        try {
            return query.get();
        } finally {
            indexLock.readLock().unlock();
        }
    }

    private <T> EngineResponse<T> persistChats(List<ChatRecord> snapshot) {
        try {
            chatStore.replace(snapshot);
            return null;
        } catch (IOException e) {
            logger.error("Chat snapshot write failed", e);
            return EngineResponse.unavailable("chat snapshot write failed");
        }
    }

    private static <T> EngineResponse<T> unavailable() {
        return EngineResponse.unavailable("search engine not initialized");
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "engine-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

package com.docsearch.service.store;

import com.docsearch.dto.Document;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ingested documents: {@code {"documents":[{"id":..,"name":..,"content":..}]}}.
 * Replayed through the engine at start so ids come out identical.
 */
public final class CorpusStore {

    private static final Logger logger = LoggerFactory.getLogger(CorpusStore.class);

    private final Path file;
    private final Gson gson;

    public CorpusStore(Path file, Gson gson) {
        this.file = file;
        this.gson = gson;
    }

    public List<StoredDocument> load() throws IOException {
        Optional<String> raw = SnapshotFiles.read(file);
        if (raw.isEmpty()) {
            logger.info("No corpus snapshot at {}, starting empty", file);
            return List.of();
        }

        RawCorpus corpus;
        try {
            corpus = gson.fromJson(raw.get(), RawCorpus.class);
        } catch (JsonParseException e) {
            throw new SnapshotIntegrityException(file, "invalid json", e);
        }
        if (corpus == null || corpus.documents == null) {
            throw new SnapshotIntegrityException(file, "missing documents array");
        }

        List<StoredDocument> docs = new ArrayList<>(corpus.documents.size());
        for (int i = 0; i < corpus.documents.size(); i++) {
            RawDocument d = corpus.documents.get(i);
            if (d == null || d.id == null || d.id != i) {
                throw new SnapshotIntegrityException(file, "document #" + i + " is out of sequence");
            }
            if (d.name == null || d.name.isBlank() || d.content == null || d.content.isBlank()) {
                throw new SnapshotIntegrityException(file, "document " + i + " has no name or content");
            }
            docs.add(new StoredDocument(d.id, d.name, d.content));
        }

        logger.info("Loaded {} documents from {}", docs.size(), file);
        return docs;
    }

    public void replace(List<Document> documents) throws IOException {
        RawCorpus corpus = new RawCorpus();
        corpus.documents = new ArrayList<>(documents.size());
        for (Document d : documents) {
            RawDocument rd = new RawDocument();
            rd.id = d.id();
            rd.name = d.name();
            rd.content = d.content();
            corpus.documents.add(rd);
        }
        SnapshotFiles.replace(file, gson.toJson(corpus));
        logger.debug("Wrote {} documents to {}", documents.size(), file);
    }

    public Path file() {
        return file;
    }

    public record StoredDocument(int id, String name, String content) {}

    private static final class RawCorpus {
        List<RawDocument> documents;
    }

    private static final class RawDocument {
        Integer id;
        String name;
        String content;
    }
}

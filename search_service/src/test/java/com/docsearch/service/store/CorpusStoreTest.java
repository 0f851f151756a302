package com.docsearch.service.store;

import com.docsearch.dto.Document;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class CorpusStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsEmpty() throws Exception {
        assertTrue(new CorpusStore(dir.resolve("corpus.json"), new Gson()).load().isEmpty());
    }

    @Test
    void storedDocumentsComeBackInIdOrder() throws Exception {
        CorpusStore store = new CorpusStore(dir.resolve("nested/corpus.json"), new Gson());

        store.replace(List.of(
                new Document(0, "a.txt", "the cat sat on the mat", 6),
                new Document(1, "b.txt", "a cat ran fast", 4)
        ));

        assertEquals(List.of(
                new CorpusStore.StoredDocument(0, "a.txt", "the cat sat on the mat"),
                new CorpusStore.StoredDocument(1, "b.txt", "a cat ran fast")
        ), store.load());
    }

    @Test
    void gapInIdsIsRejected() throws Exception {
        Path file = dir.resolve("corpus.json");
        Files.writeString(file,
                "{\"documents\":[{\"id\":0,\"name\":\"a\",\"content\":\"x y\"},{\"id\":2,\"name\":\"b\",\"content\":\"z\"}]}",
                StandardCharsets.UTF_8);

        assertThrows(SnapshotIntegrityException.class, () -> new CorpusStore(file, new Gson()).load());
    }

    @Test
    void blankContentIsRejected() throws Exception {
        Path file = dir.resolve("corpus.json");
        Files.writeString(file, "{\"documents\":[{\"id\":0,\"name\":\"a\",\"content\":\"  \"}]}", StandardCharsets.UTF_8);

        assertThrows(SnapshotIntegrityException.class, () -> new CorpusStore(file, new Gson()).load());
    }

    @Test
    void truncatedFileIsRejected() throws Exception {
        Path file = dir.resolve("corpus.json");
        Files.writeString(file, "{\"documents\":[{\"id\":0,", StandardCharsets.UTF_8);

        assertThrows(SnapshotIntegrityException.class, () -> new CorpusStore(file, new Gson()).load());
    }
}

package com.docsearch.service;

import com.docsearch.chat.ChatRecord;
import com.docsearch.dto.EngineResponse;
import com.docsearch.dto.IngestResult;
import com.docsearch.dto.KeywordSearchResult;
import com.docsearch.dto.Status;
import com.docsearch.service.store.ChatSnapshotStore;
import com.docsearch.service.store.CorpusStore;
import com.docsearch.service.store.SnapshotIntegrityException;
import com.google.gson.Gson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class EngineGatewayTest {

    @TempDir
    Path dir;

    private EngineGateway gateway;

    @AfterEach
    void tearDown() {
        if (gateway != null) gateway.close();
    }

    private EngineGateway open(long timeoutMs) throws Exception {
        Gson gson = new Gson();
        return EngineGateway.open(
                new ChatSnapshotStore(dir.resolve("chat_history.json"), gson),
                new CorpusStore(dir.resolve("corpus.json"), gson),
                2,
                timeoutMs
        );
    }

    @Test
    void ingestedDocumentIsSearchable() throws Exception {
        gateway = open(5000);

        EngineResponse<IngestResult> ingested = gateway.ingest("a.txt", "the cat sat on the mat");
        assertEquals(Status.OK, ingested.status());
        assertEquals(0, ingested.payload().docId());

        EngineResponse<KeywordSearchResult> hit = gateway.searchKeyword("Cat");
        assertEquals(Status.OK, hit.status());
        assertEquals(1, hit.payload().totalOccurrences());
    }

    @Test
    void corpusAndChatsSurviveRestart() throws Exception {
        gateway = open(5000);
        gateway.ingest("a.txt", "the cat sat on the mat");
        gateway.ingest("b.txt", "a cat ran fast");
        gateway.chatAdd("c1", "Cats", 10L);
        gateway.chatAdd("c2", "Dogs", 20L);
        gateway.close();

        gateway = open(5000);

        assertEquals(2, gateway.stats().payload().totalDocs());
        assertEquals(2, gateway.searchKeyword("cat").payload().results().size());
        assertEquals(List.of(new ChatRecord("c2", "Dogs", 20L), new ChatRecord("c1", "Cats", 10L)),
                gateway.chatList().payload());
        assertEquals(2, gateway.ingest("c.txt", "another cat").payload().docId());
    }

    @Test
    void validationFailureChangesNothing() throws Exception {
        gateway = open(5000);

        assertEquals(Status.VALIDATION_ERROR, gateway.ingest("empty.txt", "   ").status());
        assertEquals(Status.VALIDATION_ERROR, gateway.searchKeyword("").status());
        assertEquals(0, gateway.stats().payload().totalDocs());
        assertFalse(Files.exists(dir.resolve("corpus.json")));
    }

    @Test
    void slowCallTimesOut() throws Exception {
        gateway = open(100);

        EngineResponse<String> resp = gateway.bounded("slow", () -> {
            Thread.sleep(5_000);
            return EngineResponse.ok("late");
        });

        assertEquals(Status.TIMEOUT, resp.status());
        assertTrue(resp.error().contains("slow"));
        // the pool is still usable afterwards
        assertEquals(Status.OK, gateway.stats().status());
    }

    @Test
    void closedGatewayIsUnavailable() throws Exception {
        gateway = open(5000);
        gateway.close();

        assertFalse(gateway.isOpen());
        assertEquals(Status.BACKEND_UNAVAILABLE, gateway.searchKeyword("cat").status());
        assertEquals(Status.BACKEND_UNAVAILABLE, gateway.ingest("a.txt", "text here").status());
        assertEquals(Status.BACKEND_UNAVAILABLE, gateway.chatList().status());
    }

    @Test
    void chatAccessMissIsNotFound() throws Exception {
        gateway = open(5000);
        gateway.chatAdd("c1", "Cats", 10L);

        assertEquals(Status.NOT_FOUND, gateway.chatAccess("nope").status());
        assertEquals(Status.OK, gateway.chatAccess("c1").status());
        assertEquals(Status.NOT_FOUND, gateway.chatDelete("nope").status());
    }

    @Test
    void chatDeleteAndClearArePersisted() throws Exception {
        gateway = open(5000);
        gateway.chatAdd("c1", "Cats", 10L);
        gateway.chatAdd("c2", "Dogs", 20L);

        assertEquals("Chat deleted", gateway.chatDelete("c1").payload());
        gateway.close();
        gateway = open(5000);
        assertEquals(List.of(new ChatRecord("c2", "Dogs", 20L)), gateway.chatList().payload());

        assertEquals("All chats cleared", gateway.chatClear().payload());
        gateway.close();
        gateway = open(5000);
        assertTrue(gateway.chatList().payload().isEmpty());
    }

    @Test
    void failedSnapshotWriteLeavesMemoryUntouched() throws Exception {
        Gson gson = new Gson();
        Path snapshotDir = dir.resolve("snapshots");
        gateway = EngineGateway.open(
                new ChatSnapshotStore(snapshotDir.resolve("chat_history.json"), gson),
                new CorpusStore(snapshotDir.resolve("corpus.json"), gson),
                1,
                5000
        );
        // a plain file where the snapshot directory should be makes every replace fail
        Files.writeString(snapshotDir, "blocked", StandardCharsets.UTF_8);

        assertEquals(Status.BACKEND_UNAVAILABLE, gateway.ingest("a.txt", "the cat sat").status());
        assertEquals(Status.BACKEND_UNAVAILABLE, gateway.chatAdd("c1", "Cats", 1L).status());

        assertEquals(0, gateway.stats().payload().totalDocs());
        assertEquals(0, gateway.searchKeyword("cat").payload().totalOccurrences());
        assertTrue(gateway.chatList().payload().isEmpty());
    }

    @Test
    void failedChatAccessWriteLeavesTreeShapeUntouched() throws Exception {
        gateway = open(5000);
        gateway.chatAdd("c1", "Cats", 10L);
        gateway.chatAdd("c2", "Dogs", 20L);
        assertEquals("c2", gateway.chats().root().orElseThrow().id());

        // a non-empty directory in place of the snapshot file makes the rename fail
        Path snapshot = dir.resolve("chat_history.json");
        Files.delete(snapshot);
        Files.createDirectories(snapshot.resolve("occupied"));

        assertEquals(Status.BACKEND_UNAVAILABLE, gateway.chatAccess("c1").status());
        assertEquals("c2", gateway.chats().root().orElseThrow().id());
    }

    @Test
    void malformedSnapshotRefusesToOpen() throws Exception {
        Files.writeString(dir.resolve("corpus.json"), "not json at all {", StandardCharsets.UTF_8);

        assertThrows(SnapshotIntegrityException.class, () -> open(5000));
    }
}

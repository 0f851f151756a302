package com.docsearch.service.store;

import com.docsearch.chat.ChatRecord;
import com.google.gson.Gson;
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

public final class ChatSnapshotStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsEmpty() throws Exception {
        ChatSnapshotStore store = new ChatSnapshotStore(dir.resolve("chat_history.json"), new Gson());

        assertTrue(store.load().isEmpty());
    }

    @Test
    void replaceThenLoadKeepsOrderAndFields() throws Exception {
        ChatSnapshotStore store = new ChatSnapshotStore(dir.resolve("chat_history.json"), new Gson());
        List<ChatRecord> chats = List.of(
                new ChatRecord("a", "First", 100L),
                new ChatRecord("b", "Second", 200L)
        );

        store.replace(chats);

        assertEquals(chats, store.load());
        String json = Files.readString(store.file(), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"chats\""));
    }

    @Test
    void replaceLeavesNoTempFiles() throws Exception {
        ChatSnapshotStore store = new ChatSnapshotStore(dir.resolve("chat_history.json"), new Gson());

        store.replace(List.of(new ChatRecord("a", "First", 1L)));
        store.replace(List.of());

        try (var files = Files.list(dir)) {
            assertEquals(List.of(store.file()), files.toList());
        }
        assertTrue(store.load().isEmpty());
    }

    @Test
    void invalidJsonIsRejected() throws Exception {
        Path file = dir.resolve("chat_history.json");
        Files.writeString(file, "{ chats: [", StandardCharsets.UTF_8);

        SnapshotIntegrityException e = assertThrows(SnapshotIntegrityException.class,
                () -> new ChatSnapshotStore(file, new Gson()).load());
        assertEquals(file, e.file());
    }

    @Test
    void missingChatsArrayIsRejected() throws Exception {
        Path file = dir.resolve("chat_history.json");
        Files.writeString(file, "{}", StandardCharsets.UTF_8);

        assertThrows(SnapshotIntegrityException.class, () -> new ChatSnapshotStore(file, new Gson()).load());
    }

    @Test
    void chatWithoutTimestampIsRejected() throws Exception {
        Path file = dir.resolve("chat_history.json");
        Files.writeString(file, "{\"chats\":[{\"id\":\"a\",\"title\":\"t\"}]}", StandardCharsets.UTF_8);

        assertThrows(SnapshotIntegrityException.class, () -> new ChatSnapshotStore(file, new Gson()).load());
    }

    @Test
    void duplicateIdsAreRejected() throws Exception {
        Path file = dir.resolve("chat_history.json");
        Files.writeString(file,
                "{\"chats\":[{\"id\":\"a\",\"title\":\"t\",\"timestamp\":1},{\"id\":\"a\",\"title\":\"u\",\"timestamp\":2}]}",
                StandardCharsets.UTF_8);

        SnapshotIntegrityException e = assertThrows(SnapshotIntegrityException.class,
                () -> new ChatSnapshotStore(file, new Gson()).load());
        assertFalse(e.getMessage().isEmpty());
    }
}

package com.docsearch.service.store;

import com.docsearch.chat.ChatRecord;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Flat chat snapshot: {@code {"chats":[{"id":..,"title":..,"timestamp":..}]}}.
 * Loaded once at start, rewritten in full after every chat mutation.
 */
public final class ChatSnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(ChatSnapshotStore.class);

    private final Path file;
    private final Gson gson;

    public ChatSnapshotStore(Path file, Gson gson) {
        this.file = file;
        this.gson = gson;
    }

    /**
     * @return the stored chats, empty when no snapshot exists yet
     * @throws SnapshotIntegrityException when the snapshot is malformed
     */
    public List<ChatRecord> load() throws IOException {
        Optional<String> raw = SnapshotFiles.read(file);
        if (raw.isEmpty()) {
            logger.info("No chat snapshot at {}, starting empty", file);
            return List.of();
        }

        RawSnapshot snapshot;
        try {
            snapshot = gson.fromJson(raw.get(), RawSnapshot.class);
        } catch (JsonParseException e) {
            throw new SnapshotIntegrityException(file, "invalid json", e);
        }
        if (snapshot == null || snapshot.chats == null) {
            throw new SnapshotIntegrityException(file, "missing chats array");
        }

        List<ChatRecord> chats = new ArrayList<>(snapshot.chats.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < snapshot.chats.size(); i++) {
            RawChat c = snapshot.chats.get(i);
            if (c == null || c.id == null || c.id.isBlank()) {
                throw new SnapshotIntegrityException(file, "chat #" + i + " has no id");
            }
            if (c.title == null) {
                throw new SnapshotIntegrityException(file, "chat " + c.id + " has no title");
            }
            if (c.timestamp == null) {
                throw new SnapshotIntegrityException(file, "chat " + c.id + " has no timestamp");
            }
            if (!seen.add(c.id)) {
                throw new SnapshotIntegrityException(file, "duplicate chat id " + c.id);
            }
            chats.add(new ChatRecord(c.id, c.title, c.timestamp));
        }

        logger.info("Loaded {} chats from {}", chats.size(), file);
        return chats;
    }

    public void replace(List<ChatRecord> chats) throws IOException {
        RawSnapshot snapshot = new RawSnapshot();
        snapshot.chats = new ArrayList<>(chats.size());
        for (ChatRecord c : chats) {
            RawChat rc = new RawChat();
            rc.id = c.id();
            rc.title = c.title();
            rc.timestamp = c.timestamp();
            snapshot.chats.add(rc);
        }
        SnapshotFiles.replace(file, gson.toJson(snapshot));
        logger.debug("Wrote {} chats to {}", chats.size(), file);
    }

    public Path file() {
        return file;
    }

    private static final class RawSnapshot {
        List<RawChat> chats;
    }

    private static final class RawChat {
        String id;
        String title;
        Long timestamp;
    }
}

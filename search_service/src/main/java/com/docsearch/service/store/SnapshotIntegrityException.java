package com.docsearch.service.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A snapshot file exists but cannot be trusted: it does not parse, or its
 * content breaks an invariant of the structure it describes.
 */
public final class SnapshotIntegrityException extends IOException {

    private final Path file;

    public SnapshotIntegrityException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public SnapshotIntegrityException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}

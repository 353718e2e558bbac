package com.nova.fm.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The tag document could not be written. The in-memory tags already hold the change.
 */
public class TagPersistException extends IOException {

    private final Path storagePath;

    public TagPersistException(Path storagePath, Throwable cause) {
        super("Failed to save tags to " + storagePath + ": " + cause.getMessage(), cause);
        this.storagePath = storagePath;
    }

    public Path getStoragePath() {
        return storagePath;
    }
}

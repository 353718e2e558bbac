package com.nova.fm.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The tag document exists but could not be parsed. The store starts empty instead.
 */
public class CorruptStoreException extends IOException {

    private final Path storagePath;

    public CorruptStoreException(Path storagePath, Throwable cause) {
        super("Tag document is corrupt: " + storagePath + " (" + cause.getMessage() + ")", cause);
        this.storagePath = storagePath;
    }

    public Path getStoragePath() {
        return storagePath;
    }
}

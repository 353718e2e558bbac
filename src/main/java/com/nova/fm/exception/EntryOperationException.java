package com.nova.fm.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An operation on a file-system entry failed for an OS-level reason.
 * The entry is left as it was before the attempt.
 */
public class EntryOperationException extends IOException {

    private final Path path;

    public EntryOperationException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public EntryOperationException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /** The path the operation was attempted on. */
    public Path getPath() {
        return path;
    }
}

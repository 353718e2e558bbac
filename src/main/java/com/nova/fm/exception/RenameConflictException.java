package com.nova.fm.exception;

import java.nio.file.Path;

/**
 * A rename target already exists next to the entry being renamed.
 */
public class RenameConflictException extends EntryOperationException {

    private final Path target;

    public RenameConflictException(Path path, Path target) {
        super(path, "target already exists: " + target.getFileName());
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}

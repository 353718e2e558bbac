package com.nova.fm.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Change reported by an EntrySource for one watched directory.
 * RENAMED -> previousPath holds the old path.
 */
public class EntryChangeEvent {

    public enum Kind {
        INSERTED,
        REMOVED,
        RENAMED
    }

    private final Kind kind;
    private final Path directory;
    private final Path path;
    private final Path previousPath;

    public EntryChangeEvent(Kind kind, Path directory, Path path, Path previousPath) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.path = Objects.requireNonNull(path, "path");
        this.previousPath = previousPath;
    }

    public static EntryChangeEvent inserted(Path directory, Path path) {
        return new EntryChangeEvent(Kind.INSERTED, directory, path, null);
    }

    public static EntryChangeEvent removed(Path directory, Path path) {
        return new EntryChangeEvent(Kind.REMOVED, directory, path, null);
    }

    public static EntryChangeEvent renamed(Path directory, Path from, Path to) {
        return new EntryChangeEvent(Kind.RENAMED, directory, to, from);
    }

    public Kind getKind() {
        return kind;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path getPath() {
        return path;
    }

    public Path getPreviousPath() {
        return previousPath;
    }

    @Override
    public String toString() {
        if (kind == Kind.RENAMED) {
            return kind + " " + previousPath + " -> " + path;
        }
        return kind + " " + path;
    }
}

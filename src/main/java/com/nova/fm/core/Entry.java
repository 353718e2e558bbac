package com.nova.fm.core;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * One file-system object as seen through a view pipeline.
 * Materialized on demand from its path by an EntrySource, never kept across a mutation.
 */
public class Entry {

    private final Path path;
    private final String rawName;
    private final boolean directory;
    private final long size;
    private final FileTime modifiedTime; // null when the entry vanished
    private final boolean exists;

    public Entry(Path path, boolean directory, long size, FileTime modifiedTime) {
        this(path, directory, size, modifiedTime, true);
    }

    private Entry(Path path, boolean directory, long size, FileTime modifiedTime, boolean exists) {
        this.path = Objects.requireNonNull(path, "path");
        Path fileName = path.getFileName();
        this.rawName = fileName != null ? fileName.toString() : path.toString();
        this.directory = directory;
        this.size = size;
        this.modifiedTime = modifiedTime;
        this.exists = exists;
    }

    /**
     * Entry for a path that was listed but whose attributes can no longer be read.
     */
    public static Entry missing(Path path) {
        return new Entry(path, false, 0L, null, false);
    }

    public Path getPath() {
        return path;
    }

    public String getRawName() {
        return rawName;
    }

    public String getEffectiveName() {
        return NameCodec.effectiveName(rawName);
    }

    public boolean isDisabled() {
        return NameCodec.isDisabled(rawName);
    }

    public boolean isDirectory() {
        return directory;
    }

    public long getSize() {
        return size;
    }

    public FileTime getModifiedTime() {
        return modifiedTime;
    }

    public boolean exists() {
        return exists;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry)) return false;
        return path.equals(((Entry) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return getEffectiveName();
    }
}

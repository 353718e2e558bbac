package com.nova.fm.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Position of an entry inside one generation of a watched directory's listing.
 * Only meaningful to the EntrySource that issued it; once the directory changes the
 * generation moves on and the handle no longer resolves.
 */
public final class EntryHandle {

    private final Path directory;
    private final long generation;
    private final int index;

    public EntryHandle(Path directory, long generation, int index) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.generation = generation;
        this.index = index;
    }

    public Path getDirectory() {
        return directory;
    }

    public long getGeneration() {
        return generation;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryHandle)) return false;
        EntryHandle other = (EntryHandle) o;
        return index == other.index && generation == other.generation && directory.equals(other.directory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(directory, generation, index);
    }

    @Override
    public String toString() {
        return directory + "@" + generation + "#" + index;
    }
}

package com.nova.fm.source;

import com.nova.fm.core.Entry;
import com.nova.fm.core.EntryHandle;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Live listing of directories. The only component that reads the file system for the view layers.
 */
public interface EntrySource {

    /**
     * Children of {@code directory}. The order is stable until the next change
     * event for that directory and carries no meaning otherwise.
     */
    List<Entry> children(Path directory);

    Optional<EntryHandle> index(Path path);

    /**
     * Path behind {@code handle}, or empty when the handle was issued for an earlier
     * generation of its directory's listing.
     */
    Optional<Path> filePath(EntryHandle handle);

    /**
     * Current listing generation of a watched directory. It changes whenever the
     * listing does; empty for directories that are not watched.
     */
    OptionalLong generation(Path directory);

    Optional<Entry> entry(Path path);

    /** Starts keeping a stable listing of {@code directory}; calls are counted. */
    void watch(Path directory);

    void unwatch(Path directory);

    /** Re-reads {@code directory} and reports what changed to the listeners. */
    void refresh(Path directory);

    void addChangeListener(EntryChangeListener listener);

    void removeChangeListener(EntryChangeListener listener);
}

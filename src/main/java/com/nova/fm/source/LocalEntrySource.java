package com.nova.fm.source;

import com.nova.fm.core.Entry;
import com.nova.fm.core.EntryChangeEvent;
import com.nova.fm.core.EntryHandle;
import com.nova.fm.util.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;

/**
 * EntrySource over the default file system.
 * <p>
 * Watched directories keep a snapshot of their listing so that indices stay stable
 * between change events. Every snapshot carries a generation; handles issued for an
 * older generation resolve to nothing. File-system notifications are only picked up by
 * {@link #pollChanges()}, which the caller runs on its own thread; nothing here
 * starts a thread.
 */
public class LocalEntrySource implements EntrySource, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalEntrySource.class);

    private final Map<Path, Snapshot> snapshots = new HashMap<>();
    private final Map<Path, Integer> watchCounts = new HashMap<>();
    private final Map<Path, WatchKey> dirKeys = new HashMap<>();
    private final Map<WatchKey, Path> keyDirs = new HashMap<>();
    private final List<EntryChangeListener> listeners = new ArrayList<>();
    private final WatchService watchService;
    private long nextGeneration;

    public LocalEntrySource() {
        WatchService ws = null;
        try {
            ws = FileSystems.getDefault().newWatchService();
        } catch (IOException | UnsupportedOperationException e) {
            LOGGER.warn("File watching unavailable, changes are only seen on refresh: {}", e.getMessage());
        }
        this.watchService = ws;
    }

    // ---------- Watching ----------

    @Override
    public void watch(Path directory) {
        Path dir = PathNormalizer.normalize(directory);
        int count = watchCounts.getOrDefault(dir, 0);
        watchCounts.put(dir, count + 1);
        if (count > 0) {
            return;
        }

        snapshots.put(dir, new Snapshot(nextGeneration++, list(dir)));
        if (watchService != null && Files.isDirectory(dir)) {
            try {
                WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE);
                dirKeys.put(dir, key);
                keyDirs.put(key, dir);
            } catch (IOException e) {
                LOGGER.warn("Cannot watch {}: {}", dir, e.getMessage());
            }
        }
        LOGGER.debug("Watching {}", dir);
    }

    @Override
    public void unwatch(Path directory) {
        Path dir = PathNormalizer.normalize(directory);
        Integer count = watchCounts.get(dir);
        if (count == null) {
            return;
        }
        if (count > 1) {
            watchCounts.put(dir, count - 1);
            return;
        }

        watchCounts.remove(dir);
        snapshots.remove(dir);
        WatchKey key = dirKeys.remove(dir);
        if (key != null) {
            keyDirs.remove(key);
            key.cancel();
        }
        LOGGER.debug("Stopped watching {}", dir);
    }

    public boolean isWatched(Path directory) {
        return snapshots.containsKey(PathNormalizer.normalize(directory));
    }

    /**
     * Drains pending file-system notifications without blocking and refreshes every
     * watched directory they concern.
     *
     * @return true if at least one directory was refreshed
     */
    public boolean pollChanges() {
        if (watchService == null) {
            return false;
        }

        Set<Path> dirty = new LinkedHashSet<>();
        WatchKey key;
        while ((key = watchService.poll()) != null) {
            key.pollEvents();
            Path dir = keyDirs.get(key);
            if (dir != null) {
                dirty.add(dir);
            }
            if (!key.reset() && dir != null) {
                LOGGER.info("Watched directory is no longer accessible: {}", dir);
                keyDirs.remove(key);
                dirKeys.remove(dir);
            }
        }

        for (Path dir : dirty) {
            refresh(dir);
        }
        return !dirty.isEmpty();
    }

    // ---------- EntrySource ----------

    @Override
    public List<Entry> children(Path directory) {
        Path dir = PathNormalizer.normalize(directory);
        Snapshot snapshot = snapshots.get(dir);
        List<Path> paths = snapshot != null ? snapshot.paths : list(dir);
        List<Entry> result = new ArrayList<>(paths.size());
        for (Path p : paths) {
            result.add(materialize(p));
        }
        return result;
    }

    @Override
    public Optional<EntryHandle> index(Path path) {
        Path p = PathNormalizer.normalize(path);
        Path dir = p.getParent();
        if (dir == null) return Optional.empty();

        Snapshot snapshot = snapshots.get(dir);
        if (snapshot == null) return Optional.empty();

        int i = snapshot.paths.indexOf(p);
        return i < 0 ? Optional.empty() : Optional.of(new EntryHandle(dir, snapshot.generation, i));
    }

    @Override
    public Optional<Path> filePath(EntryHandle handle) {
        Snapshot snapshot = snapshots.get(handle.getDirectory());
        if (snapshot == null || snapshot.generation != handle.getGeneration()) {
            return Optional.empty();
        }
        List<Path> paths = snapshot.paths;
        if (handle.getIndex() < 0 || handle.getIndex() >= paths.size()) {
            return Optional.empty();
        }
        return Optional.of(paths.get(handle.getIndex()));
    }

    @Override
    public OptionalLong generation(Path directory) {
        Snapshot snapshot = snapshots.get(PathNormalizer.normalize(directory));
        return snapshot == null ? OptionalLong.empty() : OptionalLong.of(snapshot.generation);
    }

    @Override
    public Optional<Entry> entry(Path path) {
        Path p = PathNormalizer.normalize(path);
        if (!Files.exists(p, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        return Optional.of(materialize(p));
    }

    @Override
    public void refresh(Path directory) {
        Path dir = PathNormalizer.normalize(directory);
        Snapshot current = snapshots.get(dir);
        if (current == null) {
            return;
        }
        List<Path> old = current.paths;

        List<Path> fresh = list(dir);
        Set<Path> freshSet = new HashSet<>(fresh);
        Set<Path> oldSet = new HashSet<>(old);

        List<Path> removed = old.stream().filter(p -> !freshSet.contains(p)).collect(Collectors.toList());
        List<Path> added = fresh.stream().filter(p -> !oldSet.contains(p)).collect(Collectors.toList());
        if (removed.isEmpty() && added.isEmpty()) {
            return;
        }

        // survivors keep their position, newcomers go to the end
        List<Path> next = new ArrayList<>(old.size() + added.size());
        for (Path p : old) {
            if (freshSet.contains(p)) next.add(p);
        }
        next.addAll(added);
        snapshots.put(dir, new Snapshot(nextGeneration++, next));

        List<EntryChangeEvent> events = new ArrayList<>();
        if (removed.size() == 1 && added.size() == 1) {
            events.add(EntryChangeEvent.renamed(dir, removed.get(0), added.get(0)));
        } else {
            for (Path p : removed) events.add(EntryChangeEvent.removed(dir, p));
            for (Path p : added) events.add(EntryChangeEvent.inserted(dir, p));
        }

        for (EntryChangeEvent event : events) {
            LOGGER.debug("{}", event);
            fire(event);
        }
    }

    @Override
    public void addChangeListener(EntryChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeChangeListener(EntryChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close watch service: {}", e.getMessage());
        }
    }

    // ---------- Internals ----------

    private void fire(EntryChangeEvent event) {
        for (EntryChangeListener l : List.copyOf(listeners)) {
            l.onEntryChange(event);
        }
    }

    private List<Path> list(Path dir) {
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.map(PathNormalizer::normalize)
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            LOGGER.warn("Failed to list {}: {}", dir, e.getMessage());
            return new ArrayList<>();
        }
    }

    private Entry materialize(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return new Entry(path, attrs.isDirectory(), attrs.size(), attrs.lastModifiedTime());
        } catch (IOException e) {
            LOGGER.debug("Entry vanished before it could be read: {}", path);
            return Entry.missing(path);
        }
    }

    private static final class Snapshot {
        final long generation;
        final List<Path> paths;

        Snapshot(long generation, List<Path> paths) {
            this.generation = generation;
            this.paths = paths;
        }
    }
}

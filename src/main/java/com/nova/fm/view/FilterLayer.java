package com.nova.fm.view;

import com.nova.fm.core.Entry;
import com.nova.fm.repo.TagRepository;
import com.nova.fm.util.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Rows of the layer beneath whose effective name or one of whose tags contains the
 * search text (case-insensitive). An empty search text keeps everything.
 * <p>
 * Entries outside the subtree of {@code rootPath} are not searched and always kept.
 * The mapping is dropped on every change and rebuilt on the next access.
 */
public class FilterLayer extends AbstractViewLayer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FilterLayer.class);

    private final ViewLayer source;
    private final RowResolver sourceEntries;
    private final TagRepository tags;
    private final Runnable sourceListener = this::invalidate;

    private String searchText = "";
    private Path rootPath;
    private int[] rows; // ascending source rows, null when stale

    public FilterLayer(ViewLayer source, RowResolver sourceEntries, TagRepository tags) {
        this.source = Objects.requireNonNull(source, "source");
        this.sourceEntries = Objects.requireNonNull(sourceEntries, "sourceEntries");
        this.tags = tags;
        source.addInvalidationListener(sourceListener);
    }

    public String getSearchText() {
        return searchText;
    }

    public void setSearchText(String text) {
        String next = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (next.equals(searchText)) {
            return;
        }
        searchText = next;
        invalidate();
    }

    public Path getRootPath() {
        return rootPath;
    }

    public void setRootPath(Path path) {
        rootPath = path == null ? null : PathNormalizer.normalize(path);
        invalidate();
    }

    public void invalidate() {
        rows = null;
        fireInvalidated();
    }

    @Override
    public int rowCount() {
        return mapping().length;
    }

    @Override
    public OptionalInt mapToSource(int row) {
        int[] m = mapping();
        return inRange(row, m.length) ? OptionalInt.of(m[row]) : OptionalInt.empty();
    }

    @Override
    public OptionalInt mapFromSource(int sourceRow) {
        int i = Arrays.binarySearch(mapping(), sourceRow);
        return i >= 0 ? OptionalInt.of(i) : OptionalInt.empty();
    }

    public void close() {
        source.removeInvalidationListener(sourceListener);
    }

    private int[] mapping() {
        if (rows == null) {
            rows = recompute();
        }
        return rows;
    }

    private int[] recompute() {
        int count = source.rowCount();
        int[] kept = new int[count];
        int n = 0;
        for (int r = 0; r < count; r++) {
            if (accepts(r)) {
                kept[n++] = r;
            }
        }
        if (!searchText.isEmpty()) {
            LOGGER.debug("Search '{}' keeps {} of {} rows", searchText, n, count);
        }
        return Arrays.copyOf(kept, n);
    }

    private boolean accepts(int sourceRow) {
        if (searchText.isEmpty()) {
            return true;
        }

        Optional<Entry> resolved = sourceEntries.entryAt(sourceRow);
        if (resolved.isEmpty()) {
            return true;
        }
        Entry entry = resolved.get();
        if (rootPath != null && !entry.getPath().startsWith(rootPath)) {
            return true;
        }

        if (entry.getEffectiveName().toLowerCase(Locale.ROOT).contains(searchText)) {
            return true;
        }
        if (tags != null) {
            for (String tag : tags.get(entry.getPath())) {
                if (tag.toLowerCase(Locale.ROOT).contains(searchText)) {
                    return true;
                }
            }
        }
        return false;
    }
}

package com.nova.fm.view;

import com.nova.fm.core.Entry;
import com.nova.fm.core.EntryChangeEvent;
import com.nova.fm.core.EntryHandle;
import com.nova.fm.source.EntryChangeListener;
import com.nova.fm.source.EntrySource;
import com.nova.fm.util.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Children of one directory, ordered by effective name (case-insensitive) with the raw
 * name as tie-break. The source index of a row is the entry's position in
 * {@link EntrySource#children(Path)}, valid for the listing generation the layer was
 * last sorted from. Handles of any other generation map to nothing.
 * <p>
 * Re-sorts as soon as the source reports a change in the observed directory.
 */
public class SortLayer extends AbstractViewLayer implements RootLayer, EntryChangeListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(SortLayer.class);

    public static final Comparator<Entry> ORDER =
            Comparator.comparing((Entry e) -> e.getEffectiveName().toLowerCase(Locale.ROOT))
                    .thenComparing(Entry::getRawName);

    private final EntrySource source;
    private Path directory;
    private int[] rowToSource = new int[0];
    private int[] sourceToRow = new int[0];
    private long generation = -1;

    public SortLayer(EntrySource source) {
        this.source = Objects.requireNonNull(source, "source");
        source.addChangeListener(this);
    }

    public Path getDirectory() {
        return directory;
    }

    public void setDirectory(Path dir) {
        Path next = PathNormalizer.normalize(dir);
        if (next.equals(directory)) {
            return;
        }
        if (directory != null) {
            source.unwatch(directory);
        }
        directory = next;
        source.watch(directory);
        resort();
    }

    @Override
    public void onEntryChange(EntryChangeEvent event) {
        if (directory != null && directory.equals(event.getDirectory())) {
            resort();
        }
    }

    /**
     * Rebuilds both mappings from the current listing and notifies the layers above.
     */
    public void resort() {
        if (directory == null) {
            rowToSource = new int[0];
            sourceToRow = new int[0];
            generation = -1;
            fireInvalidated();
            return;
        }

        generation = source.generation(directory).orElse(-1);
        List<Entry> children = source.children(directory);
        Integer[] order = new Integer[children.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> ORDER.compare(children.get(a), children.get(b)));

        int[] toSource = new int[order.length];
        int[] toRow = new int[order.length];
        for (int row = 0; row < order.length; row++) {
            toSource[row] = order[row];
            toRow[order[row]] = row;
        }
        rowToSource = toSource;
        sourceToRow = toRow;

        LOGGER.debug("Sorted {} entries of {}", order.length, directory);
        fireInvalidated();
    }

    @Override
    public int rowCount() {
        return rowToSource.length;
    }

    @Override
    public OptionalInt mapToSource(int row) {
        return inRange(row, rowToSource.length) ? OptionalInt.of(rowToSource[row]) : OptionalInt.empty();
    }

    @Override
    public OptionalInt mapFromSource(int sourceRow) {
        return inRange(sourceRow, sourceToRow.length) ? OptionalInt.of(sourceToRow[sourceRow]) : OptionalInt.empty();
    }

    /** Source handle behind {@code row}, stamped with the generation this layer sorted. */
    public Optional<EntryHandle> handleAt(int row) {
        OptionalInt index = mapToSource(row);
        if (index.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new EntryHandle(directory, generation, index.getAsInt()));
    }

    /**
     * Row of the entry behind {@code handle}; empty when the handle belongs to another
     * directory or to a listing generation other than the one this layer sorted.
     */
    public OptionalInt rowOf(EntryHandle handle) {
        if (directory == null
                || !directory.equals(handle.getDirectory())
                || generation != handle.getGeneration()) {
            return OptionalInt.empty();
        }
        return mapFromSource(handle.getIndex());
    }

    @Override
    public Optional<Entry> entryAt(int row) {
        return handleAt(row)
                .flatMap(source::filePath)
                .flatMap(source::entry);
    }

    @Override
    public OptionalInt rowOf(Path path) {
        if (directory == null) {
            return OptionalInt.empty();
        }
        Optional<EntryHandle> handle = source.index(path);
        return handle.isPresent() ? rowOf(handle.get()) : OptionalInt.empty();
    }

    /** Stops observing the source. */
    public void close() {
        source.removeChangeListener(this);
        if (directory != null) {
            source.unwatch(directory);
            directory = null;
        }
    }
}

package com.nova.fm.view;

import com.nova.fm.core.Entry;
import com.nova.fm.repo.TagRepository;
import com.nova.fm.source.EntrySource;

import java.nio.file.Path;
import java.util.*;

/**
 * Fixed chain of layers built once: a {@link SortLayer} at the bottom and, when a tag
 * repository is supplied, a {@link FilterLayer} on top of it.
 * <p>
 * Rows are resolved to entries by walking {@code mapToSource} down to the sort layer,
 * and paths are resolved to rows by walking {@code mapFromSource} back up. The change
 * callback passed to the builder runs after every invalidation of the top layer.
 */
public final class ViewPipeline {

    private final SortLayer root;
    private final FilterLayer filter;
    private final List<ViewLayer> layers;
    private final Runnable onChange;

    private ViewPipeline(Builder builder) {
        List<ViewLayer> chain = new ArrayList<>();
        this.root = new SortLayer(builder.source);
        chain.add(root);

        if (builder.tags != null) {
            this.filter = new FilterLayer(root, resolverFor(chain, 0), builder.tags);
            chain.add(filter);
        } else {
            this.filter = null;
        }

        this.layers = Collections.unmodifiableList(chain);
        this.onChange = builder.onChange;
        top().addInvalidationListener(onChange);

        if (builder.directory != null) {
            setDirectory(builder.directory);
        }
    }

    public static Builder builder(EntrySource source) {
        return new Builder(source);
    }

    public int rowCount() {
        return top().rowCount();
    }

    /** One step down from the top layer. */
    public OptionalInt mapToSource(int row) {
        return top().mapToSource(row);
    }

    /** Row of the sort layer that a visible row stands for. */
    public OptionalInt rootRow(int row) {
        return toRoot(layers, layers.size() - 1, row);
    }

    public Optional<Entry> entryAt(int row) {
        OptionalInt r = rootRow(row);
        return r.isPresent() ? root.entryAt(r.getAsInt()) : Optional.empty();
    }

    public Optional<Path> pathAt(int row) {
        return entryAt(row).map(Entry::getPath);
    }

    /**
     * Visible row of {@code path}, or empty when it is not in the directory or is
     * filtered out.
     */
    public OptionalInt rowOf(Path path) {
        OptionalInt row = root.rowOf(path);
        for (int i = 1; i < layers.size() && row.isPresent(); i++) {
            row = layers.get(i).mapFromSource(row.getAsInt());
        }
        return row;
    }

    /** Every visible entry in display order. */
    public List<Entry> entries() {
        int count = rowCount();
        List<Entry> result = new ArrayList<>(count);
        for (int row = 0; row < count; row++) {
            entryAt(row).ifPresent(result::add);
        }
        return result;
    }

    public Path getDirectory() {
        return root.getDirectory();
    }

    /** Moves to {@code directory}; any search text is cleared. */
    public void setDirectory(Path directory) {
        root.setDirectory(directory);
        if (filter != null) {
            filter.setSearchText("");
            filter.setRootPath(root.getDirectory());
        }
    }

    public boolean isSearchable() {
        return filter != null;
    }

    public String getSearchText() {
        return filter != null ? filter.getSearchText() : "";
    }

    public void setSearchText(String text) {
        if (filter == null) {
            throw new IllegalStateException("pipeline was built without a search layer");
        }
        filter.setSearchText(text);
    }

    /** Drops the search results; they are rebuilt on the next query. */
    public void invalidate() {
        if (filter != null) {
            filter.invalidate();
        } else {
            onChange.run();
        }
    }

    /** Re-reads the listing of the current directory. */
    public void resort() {
        root.resort();
    }

    /** Bottom-up, the sort layer first. */
    public List<ViewLayer> layers() {
        return layers;
    }

    public void close() {
        top().removeInvalidationListener(onChange);
        if (filter != null) {
            filter.close();
        }
        root.close();
    }

    private ViewLayer top() {
        return layers.get(layers.size() - 1);
    }

    private RowResolver resolverFor(List<ViewLayer> chain, int depth) {
        return row -> {
            OptionalInt r = toRoot(chain, depth, row);
            return r.isPresent() ? root.entryAt(r.getAsInt()) : Optional.empty();
        };
    }

    private static OptionalInt toRoot(List<ViewLayer> chain, int depth, int row) {
        OptionalInt current = OptionalInt.of(row);
        for (int i = depth; i > 0 && current.isPresent(); i--) {
            current = chain.get(i).mapToSource(current.getAsInt());
        }
        if (current.isPresent() && !AbstractViewLayer.inRange(current.getAsInt(), chain.get(0).rowCount())) {
            return OptionalInt.empty();
        }
        return current;
    }

    public static final class Builder {

        private final EntrySource source;
        private TagRepository tags;
        private Runnable onChange = () -> {
        };
        private Path directory;

        private Builder(EntrySource source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        /** Adds the search layer, matching names and the tags held by {@code tags}. */
        public Builder searchable(TagRepository tags) {
            this.tags = Objects.requireNonNull(tags, "tags");
            return this;
        }

        public Builder onChange(Runnable onChange) {
            this.onChange = Objects.requireNonNull(onChange, "onChange");
            return this;
        }

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public ViewPipeline build() {
            return new ViewPipeline(this);
        }
    }
}

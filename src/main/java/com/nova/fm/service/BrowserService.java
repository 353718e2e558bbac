package com.nova.fm.service;

import com.nova.fm.core.NameCodec;
import com.nova.fm.exception.EntryOperationException;
import com.nova.fm.exception.TagPersistException;
import com.nova.fm.repo.TagRepository;
import com.nova.fm.source.EntrySource;
import com.nova.fm.view.ViewPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes issued by the panes: enable/disable toggles and tag edits, always by path.
 * Every write lands below the view pipelines, which pick it up through the source's
 * change events or their own invalidation.
 */
public class BrowserService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BrowserService.class);

    private final EntrySource source;
    private final TagRepository tags;
    private final List<ViewPipeline> pipelines = new ArrayList<>();

    public BrowserService(EntrySource source, TagRepository tags) {
        this.source = Objects.requireNonNull(source, "source");
        this.tags = Objects.requireNonNull(tags, "tags");
    }

    /**
     * Builds a pipeline over the shared source. Pipelines opened here are told about
     * tag edits so their search results never go stale.
     */
    public ViewPipeline openPipeline(Path directory, boolean searchable, Runnable onChange) {
        ViewPipeline.Builder builder = ViewPipeline.builder(source)
                .directory(directory)
                .onChange(onChange);
        if (searchable) {
            builder.searchable(tags);
        }
        ViewPipeline pipeline = builder.build();
        pipelines.add(pipeline);
        return pipeline;
    }

    public void closePipeline(ViewPipeline pipeline) {
        if (pipelines.remove(pipeline)) {
            pipeline.close();
        }
    }

    // ---------- Enable / disable ----------

    /**
     * Flips the enabled state of the entry at {@code path} by renaming it.
     * Its tags follow it to the new path.
     *
     * @return the entry's new path
     * @throws TagPersistException after the rename and the listing refresh, when the
     *                             moved tags could not be saved; they stay moved in memory
     */
    public Path toggle(Path path) throws EntryOperationException, TagPersistException {
        Path target = NameCodec.toggle(path);
        TagPersistException persistFailure = null;
        try {
            tags.move(path, target);
        } catch (TagPersistException e) {
            LOGGER.warn("Tags of {} moved in memory only: {}", target, e.getMessage());
            persistFailure = e;
        }
        Path parent = target.getParent();
        if (parent != null) {
            source.refresh(parent);
        }
        LOGGER.info("{} {}", NameCodec.isDisabled(target.getFileName().toString()) ? "Disabled" : "Enabled", target);
        if (persistFailure != null) {
            throw persistFailure;
        }
        return target;
    }

    // ---------- Tags ----------

    public List<String> tagsOf(Path path) {
        return tags.get(path);
    }

    /** Adds {@code tag} after trimming it; blank tags are ignored. */
    public void addTag(Path path, String tag) throws TagPersistException {
        if (tag == null || tag.isBlank()) {
            return;
        }
        try {
            tags.add(path, tag.strip());
        } finally {
            tagsChanged();
        }
    }

    public void removeTag(Path path, String tag) throws TagPersistException {
        try {
            tags.remove(path, tag);
        } finally {
            tagsChanged();
        }
    }

    public void clearTags(Path path) throws TagPersistException {
        try {
            tags.set(path, List.of());
        } finally {
            tagsChanged();
        }
    }

    public EntrySource getSource() {
        return source;
    }

    // in-memory tags changed even when persisting failed
    private void tagsChanged() {
        for (ViewPipeline p : List.copyOf(pipelines)) {
            p.invalidate();
        }
    }
}

package com.nova.fm.view;

import com.nova.fm.core.Entry;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The bottom layer of a pipeline: the one that owns the EntrySource and can turn its
 * own rows into entries and back.
 */
public interface RootLayer extends ViewLayer {

    Optional<Entry> entryAt(int row);

    OptionalInt rowOf(Path path);
}

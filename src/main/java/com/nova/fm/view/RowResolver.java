package com.nova.fm.view;

import com.nova.fm.core.Entry;

import java.util.Optional;

/**
 * Resolves a row of some layer to the entry it shows.
 */
@FunctionalInterface
public interface RowResolver {

    Optional<Entry> entryAt(int row);
}

package com.nova.fm.view;

import java.util.OptionalInt;

/**
 * One transform in a view pipeline: a re-ordered or re-filtered sequence of rows over
 * the layer (or source) beneath it.
 * <p>
 * Row indices are local to a layer. An empty result from either mapping means the
 * row is not currently present on the other side; callers treat that as "not visible",
 * never as an error.
 */
public interface ViewLayer {

    int rowCount();

    /** Translates one of this layer's rows one step down. */
    OptionalInt mapToSource(int row);

    /** Translates a row of the layer beneath into this layer, if it is shown here. */
    OptionalInt mapFromSource(int sourceRow);

    /** Registers a callback run whenever this layer's row mapping changes. */
    void addInvalidationListener(Runnable listener);

    void removeInvalidationListener(Runnable listener);
}

package com.nova.fm.view;

import java.util.ArrayList;
import java.util.List;

abstract class AbstractViewLayer implements ViewLayer {

    private final List<Runnable> invalidationListeners = new ArrayList<>();

    @Override
    public void addInvalidationListener(Runnable listener) {
        invalidationListeners.add(listener);
    }

    @Override
    public void removeInvalidationListener(Runnable listener) {
        invalidationListeners.remove(listener);
    }

    protected void fireInvalidated() {
        for (Runnable l : List.copyOf(invalidationListeners)) {
            l.run();
        }
    }

    protected static boolean inRange(int row, int count) {
        return row >= 0 && row < count;
    }
}

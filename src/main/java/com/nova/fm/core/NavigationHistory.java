package com.nova.fm.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Visited directories of one pane, with a cursor for back/forward.
 */
public class NavigationHistory {

    private final List<Path> visited = new ArrayList<>();
    private int cursor = -1;

    /**
     * Records a visit. Forward entries past the cursor are dropped; a path equal
     * to the current one is not pushed twice.
     */
    public void push(Path path) {
        if (cursor < visited.size() - 1) {
            visited.subList(cursor + 1, visited.size()).clear();
        }
        if (!visited.isEmpty() && visited.get(visited.size() - 1).equals(path)) {
            return;
        }
        visited.add(path);
        cursor = visited.size() - 1;
    }

    public Optional<Path> back() {
        if (!canGoBack()) return Optional.empty();
        cursor--;
        return Optional.of(visited.get(cursor));
    }

    public Optional<Path> forward() {
        if (!canGoForward()) return Optional.empty();
        cursor++;
        return Optional.of(visited.get(cursor));
    }

    public Optional<Path> current() {
        if (cursor < 0) return Optional.empty();
        return Optional.of(visited.get(cursor));
    }

    public boolean canGoBack() {
        return cursor > 0;
    }

    public boolean canGoForward() {
        return cursor < visited.size() - 1;
    }

    public int size() {
        return visited.size();
    }
}

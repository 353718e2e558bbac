package com.nova.fm.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class NavigationHistoryTest {

    private final Path a = Path.of("a");
    private final Path b = Path.of("b");
    private final Path c = Path.of("c");

    @Test
    void backAndForward_moveTheCursor() {
        NavigationHistory history = new NavigationHistory();
        history.push(a);
        history.push(b);
        history.push(c);

        assertThat(history.back()).contains(b);
        assertThat(history.back()).contains(a);
        assertThat(history.back()).isEmpty();
        assertThat(history.current()).contains(a);
        assertThat(history.forward()).contains(b);
        assertThat(history.forward()).contains(c);
        assertThat(history.forward()).isEmpty();
    }

    @Test
    void push_truncatesForwardEntries() {
        NavigationHistory history = new NavigationHistory();
        history.push(a);
        history.push(b);
        history.push(c);
        history.back();
        history.back();

        history.push(c);

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.current()).contains(c);
        assertThat(history.canGoForward()).isFalse();
        assertThat(history.back()).contains(a);
    }

    @Test
    void push_ofCurrentPathIsSuppressed() {
        NavigationHistory history = new NavigationHistory();
        history.push(a);
        history.push(a);

        assertThat(history.size()).isEqualTo(1);
        assertThat(history.canGoBack()).isFalse();
    }

    @Test
    void current_isEmptyForNewHistory() {
        NavigationHistory history = new NavigationHistory();

        assertThat(history.current()).isEmpty();
        assertThat(history.back()).isEmpty();
        assertThat(history.forward()).isEmpty();
    }
}

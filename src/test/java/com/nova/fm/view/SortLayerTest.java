package com.nova.fm.view;

import com.nova.fm.core.Entry;
import com.nova.fm.core.EntryHandle;
import com.nova.fm.core.NameCodec;
import com.nova.fm.source.LocalEntrySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SortLayerTest {

    @TempDir
    Path dir;

    private LocalEntrySource source;
    private SortLayer layer;

    @BeforeEach
    void setUp() {
        source = new LocalEntrySource();
        layer = new SortLayer(source);
    }

    @AfterEach
    void tearDown() {
        layer.close();
        source.close();
    }

    private List<Entry> rows() {
        List<Entry> rows = new ArrayList<>();
        for (int r = 0; r < layer.rowCount(); r++) {
            rows.add(layer.entryAt(r).orElseThrow());
        }
        return rows;
    }

    private List<String> effectiveNames() {
        List<String> names = new ArrayList<>();
        for (Entry e : rows()) names.add(e.getEffectiveName());
        return names;
    }

    @Test
    void setDirectory_ordersByEffectiveNameIgnoringCase() throws IOException {
        Files.createFile(dir.resolve("Foo"));
        Files.createFile(dir.resolve("DISABLED_Bar"));
        Files.createFile(dir.resolve("baz"));

        layer.setDirectory(dir);

        assertThat(effectiveNames()).containsExactly("Bar", "baz", "Foo");
        assertThat(rows().get(0).isDisabled()).isTrue();
    }

    @Test
    void refresh_afterToggleKeepsOrderAndFlipsState() throws IOException {
        Files.createFile(dir.resolve("Foo"));
        Path bar = Files.createFile(dir.resolve("DISABLED_Bar"));
        Files.createFile(dir.resolve("baz"));
        layer.setDirectory(dir);

        NameCodec.toggle(bar);
        source.refresh(dir);

        assertThat(effectiveNames()).containsExactly("Bar", "baz", "Foo");
        assertThat(rows().get(0).getRawName()).isEqualTo("Bar");
        assertThat(rows().get(0).isDisabled()).isFalse();
    }

    @Test
    void order_fallsBackToRawNameOnTies() throws IOException {
        Files.createFile(dir.resolve("DISABLED_Bar"));
        Files.createFile(dir.resolve("bar"));
        Files.createFile(dir.resolve("Bar"));

        layer.setDirectory(dir);

        assertThat(rows()).extracting(Entry::getRawName).containsExactly("Bar", "DISABLED_Bar", "bar");
    }

    @Test
    void mapToSource_andMapFromSourceAreInverse() throws IOException {
        for (String name : new String[]{"delta", "Alpha", "charlie", "DISABLED_bravo", "_echo_"}) {
            Files.createFile(dir.resolve(name));
        }
        layer.setDirectory(dir);

        for (int row = 0; row < layer.rowCount(); row++) {
            int sourceIndex = layer.mapToSource(row).orElseThrow();
            assertThat(layer.mapFromSource(sourceIndex)).hasValue(row);
        }
        for (int index = 0; index < layer.rowCount(); index++) {
            int row = layer.mapFromSource(index).orElseThrow();
            assertThat(layer.mapToSource(row)).hasValue(index);
        }
    }

    @Test
    void mapToSource_outOfRangeIsNotFound() throws IOException {
        Files.createFile(dir.resolve("a"));
        layer.setDirectory(dir);

        assertThat(layer.mapToSource(-1)).isEmpty();
        assertThat(layer.mapToSource(1)).isEmpty();
        assertThat(layer.mapFromSource(5)).isEmpty();
        assertThat(layer.entryAt(3)).isEmpty();
    }

    @Test
    void refresh_removedRowBecomesNotFound() throws IOException {
        Files.createFile(dir.resolve("a"));
        Path b = Files.createFile(dir.resolve("b"));
        layer.setDirectory(dir);
        assertThat(layer.rowCount()).isEqualTo(2);

        Files.delete(b);
        source.refresh(dir);

        assertThat(layer.rowCount()).isEqualTo(1);
        assertThat(layer.mapToSource(1)).isEmpty();
        assertThat(layer.rowOf(b)).isEmpty();
    }

    @Test
    void rowOf_rejectsHandlesOfAnEarlierListing() throws IOException {
        Files.createFile(dir.resolve("a"));
        Path b = Files.createFile(dir.resolve("b"));
        Path c = Files.createFile(dir.resolve("c"));
        layer.setDirectory(dir);
        EntryHandle handleOfB = source.index(b).orElseThrow();
        EntryHandle rowOneBefore = layer.handleAt(1).orElseThrow();
        assertThat(layer.rowOf(handleOfB)).hasValue(1);

        Files.delete(b);
        source.refresh(dir);

        assertThat(layer.rowOf(handleOfB)).isEmpty();
        assertThat(source.filePath(rowOneBefore)).isEmpty();
        assertThat(layer.entryAt(1).map(Entry::getRawName)).contains("c");
        assertThat(layer.rowOf(source.index(c).orElseThrow())).hasValue(1);
    }

    @Test
    void rowOf_findsTheDisplayedRow() throws IOException {
        Path zed = Files.createFile(dir.resolve("zed"));
        Path alpha = Files.createFile(dir.resolve("alpha"));
        layer.setDirectory(dir);

        assertThat(layer.rowOf(alpha)).hasValue(0);
        assertThat(layer.rowOf(zed)).hasValue(1);
        assertThat(layer.rowOf(dir.resolve("other"))).isEmpty();
    }

    @Test
    void onEntryChange_ignoresOtherDirectories() throws IOException {
        Path other = Files.createDirectory(dir.resolve("other"));
        Path watched = Files.createDirectory(dir.resolve("watched"));
        Files.createFile(watched.resolve("x"));
        layer.setDirectory(watched);
        source.watch(other);
        AtomicInteger invalidations = new AtomicInteger();
        layer.addInvalidationListener(invalidations::incrementAndGet);

        Files.createFile(other.resolve("y"));
        source.refresh(other);

        assertThat(invalidations).hasValue(0);
        assertThat(layer.rowCount()).isEqualTo(1);
    }

    @Test
    void setDirectory_reSortsAndMovesTheWatch() throws IOException {
        Path one = Files.createDirectory(dir.resolve("one"));
        Path two = Files.createDirectory(dir.resolve("two"));
        Files.createFile(two.resolve("x"));
        Files.createFile(two.resolve("y"));
        layer.setDirectory(one);
        AtomicInteger invalidations = new AtomicInteger();
        layer.addInvalidationListener(invalidations::incrementAndGet);

        layer.setDirectory(two);

        assertThat(invalidations).hasValue(1);
        assertThat(layer.rowCount()).isEqualTo(2);
        assertThat(source.isWatched(one)).isFalse();
        assertThat(source.isWatched(two)).isTrue();
    }

    @Test
    void rowCount_isZeroWithoutDirectory() {
        assertThat(layer.rowCount()).isZero();
        assertThat(layer.rowOf(dir)).isEqualTo(OptionalInt.empty());
    }
}

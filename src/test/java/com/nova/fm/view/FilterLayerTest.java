package com.nova.fm.view;

import com.nova.fm.core.Entry;
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
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FilterLayerTest {

    @TempDir
    Path dir;

    private LocalEntrySource source;
    private SortLayer sort;
    private CountingTagRepository tags;
    private FilterLayer filter;

    @BeforeEach
    void setUp() {
        source = new LocalEntrySource();
        sort = new SortLayer(source);
        tags = new CountingTagRepository();
        filter = new FilterLayer(sort, sort::entryAt, tags);
    }

    @AfterEach
    void tearDown() {
        filter.close();
        sort.close();
        source.close();
    }

    private List<String> visible() {
        List<String> names = new ArrayList<>();
        for (int r = 0; r < filter.rowCount(); r++) {
            int sortRow = filter.mapToSource(r).orElseThrow();
            names.add(sort.entryAt(sortRow).map(Entry::getRawName).orElseThrow());
        }
        return names;
    }

    @Test
    void setSearchText_tagMatchKeepsOnlyTheTaggedEntry() throws IOException {
        Path x = Files.createFile(dir.resolve("x"));
        Files.createFile(dir.resolve("y"));
        Files.createFile(dir.resolve("z"));
        tags.add(x, "armor");
        sort.setDirectory(dir);

        filter.setSearchText("arm");

        assertThat(visible()).containsExactly("x");
    }

    @Test
    void setSearchText_matchesEffectiveNameIgnoringCase() throws IOException {
        Files.createFile(dir.resolve("DISABLED_Armor.zip"));
        Files.createFile(dir.resolve("helmet"));
        sort.setDirectory(dir);

        filter.setSearchText("ARM");
        assertThat(visible()).containsExactly("DISABLED_Armor.zip");

        filter.setSearchText("disabled");
        assertThat(visible()).isEmpty();
    }

    @Test
    void setSearchText_matchesTagsIgnoringCase() throws IOException {
        Path x = Files.createFile(dir.resolve("x"));
        Files.createFile(dir.resolve("y"));
        tags.add(x, "HeavyArmor");
        sort.setDirectory(dir);

        filter.setSearchText("vyarm");

        assertThat(visible()).containsExactly("x");
    }

    @Test
    void setSearchText_emptyKeepsEverythingWithoutTagLookups() throws IOException {
        Files.createFile(dir.resolve("a"));
        Files.createFile(dir.resolve("b"));
        sort.setDirectory(dir);

        filter.setSearchText("");

        assertThat(filter.rowCount()).isEqualTo(2);
        assertThat(tags.lookups).isZero();
    }

    @Test
    void setSearchText_refiningNeverAddsRows() throws IOException {
        for (String name : new String[]{"armor", "arms", "army", "boots", "charm", "DISABLED_armada"}) {
            Files.createFile(dir.resolve(name));
        }
        tags.add(dir.resolve("boots"), "armored");
        sort.setDirectory(dir);

        String query = "armore";
        int previous = Integer.MAX_VALUE;
        for (int len = 0; len <= query.length(); len++) {
            filter.setSearchText(query.substring(0, len));
            int count = filter.rowCount();
            assertThat(count).isLessThanOrEqualTo(previous);
            previous = count;
        }
        assertThat(visible()).containsExactly("boots");
    }

    @Test
    void mapFromSource_roundTripsThroughTheSortLayer() throws IOException {
        for (String name : new String[]{"b-arm", "a", "c-arm", "DISABLED_d-arm", "e"}) {
            Files.createFile(dir.resolve(name));
        }
        sort.setDirectory(dir);
        filter.setSearchText("arm");

        assertThat(filter.rowCount()).isEqualTo(3);
        for (int row = 0; row < filter.rowCount(); row++) {
            int sortRow = filter.mapToSource(row).orElseThrow();
            int sourceIndex = sort.mapToSource(sortRow).orElseThrow();
            int back = filter.mapFromSource(sort.mapFromSource(sourceIndex).orElseThrow()).orElseThrow();
            assertThat(back).isEqualTo(row);
        }
    }

    @Test
    void mapFromSource_excludedRowsAreNotFound() throws IOException {
        Files.createFile(dir.resolve("armor"));
        Files.createFile(dir.resolve("boots"));
        sort.setDirectory(dir);
        filter.setSearchText("arm");

        int bootsRow = sort.rowOf(dir.resolve("boots")).orElseThrow();

        assertThat(filter.mapFromSource(bootsRow)).isEmpty();
        assertThat(filter.mapToSource(1)).isEmpty();
    }

    @Test
    void setRootPath_entriesOutsideAreNotSearched() throws IOException {
        Path inside = Files.createDirectory(dir.resolve("inside"));
        Files.createFile(inside.resolve("armor"));
        Files.createFile(inside.resolve("boots"));
        sort.setDirectory(inside);
        filter.setSearchText("arm");

        filter.setRootPath(dir.resolve("elsewhere"));
        assertThat(visible()).containsExactly("armor", "boots");

        filter.setRootPath(dir);
        assertThat(visible()).containsExactly("armor");
    }

    @Test
    void invalidate_changesBelowRecomputeLazily() throws IOException {
        Files.createFile(dir.resolve("armor"));
        sort.setDirectory(dir);
        filter.setSearchText("arm");
        assertThat(filter.rowCount()).isEqualTo(1);
        AtomicInteger invalidations = new AtomicInteger();
        filter.addInvalidationListener(invalidations::incrementAndGet);
        int lookupsBefore = tags.lookups;

        Files.createFile(dir.resolve("armlet"));
        source.refresh(dir);

        assertThat(invalidations).hasValue(1);
        assertThat(tags.lookups).isEqualTo(lookupsBefore);
        assertThat(visible()).containsExactly("armlet", "armor");
    }

    @Test
    void invalidate_showsTagEdits() throws IOException {
        Path x = Files.createFile(dir.resolve("x"));
        sort.setDirectory(dir);
        filter.setSearchText("arm");
        assertThat(filter.rowCount()).isZero();

        tags.add(x, "armor");
        filter.invalidate();

        assertThat(visible()).containsExactly("x");
    }
}

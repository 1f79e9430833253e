package eu.virtualparadox.docingest.ingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PageRangeTest {

    @Test
    @DisplayName("Range spans the smallest and largest page regardless of order")
    void rangeFromUnorderedPages() {
        PageRange range = PageRange.of(Arrays.asList(5, 3, 4)).orElseThrow();
        assertEquals(new PageRange(3, 5), range);
        assertEquals("3-5", range.asString());
    }

    @Test
    @DisplayName("Single page is labelled with its number")
    void singlePageLabel() {
        assertEquals("Page 4", PageRange.labelOf(List.of(4)));
        assertEquals("Page 7", PageRange.labelOf(List.of(7, 7)));
    }

    @Test
    @DisplayName("No pages means no range and an empty label")
    void emptyPages() {
        assertThat(PageRange.of(List.of())).isEmpty();
        assertThat(PageRange.of(null)).isEmpty();
        assertEquals("", PageRange.labelOf(List.of()));
    }

    @Test
    @DisplayName("Invalid ranges are rejected")
    void invalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new PageRange(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new PageRange(5, 3));
    }
}

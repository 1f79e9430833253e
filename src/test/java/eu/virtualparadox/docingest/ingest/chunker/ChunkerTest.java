package eu.virtualparadox.docingest.ingest.chunker;

import eu.virtualparadox.docingest.ingest.model.ChunkRecord;
import eu.virtualparadox.docingest.ingest.model.PageRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ChunkerTest {

    private static final int SIZE = 200;
    private static final int OVERLAP = 40;

    private final Chunker chunker = new Chunker(SIZE, OVERLAP);

    // ---------- Helpers ----------

    /**
     * Paragraphs of random sentences separated by blank lines, seeded for reproducibility.
     */
    private static String buildParagraphs(int paragraphs, int sentencesPerParagraph) {
        Random rnd = new Random(42);
        StringBuilder sb = new StringBuilder();
        for (int p = 0; p < paragraphs; p++) {
            if (p > 0) {
                sb.append("\n\n");
            }
            for (int s = 0; s < sentencesPerParagraph; s++) {
                if (s > 0) {
                    sb.append(s % 4 == 0 ? "\n" : " ");
                }
                int words = 4 + rnd.nextInt(8);
                for (int w = 0; w < words; w++) {
                    if (w > 0) {
                        sb.append(' ');
                    }
                    sb.append(randomWord(rnd));
                }
                sb.append('.');
            }
        }
        return sb.toString();
    }

    private static String randomWord(Random rnd) {
        int len = 2 + rnd.nextInt(9);
        StringBuilder w = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            w.append((char) ('a' + rnd.nextInt(26)));
        }
        return w.toString();
    }

    /**
     * Joins page texts the way the extractor does and records their spans.
     */
    private static List<PageRecord> paginate(StringBuilder out, String... pageTexts) {
        List<PageRecord> pages = new ArrayList<>();
        for (int i = 0; i < pageTexts.length; i++) {
            if (i > 0) {
                out.append("\n\n");
            }
            int start = out.length();
            out.append(pageTexts[i]);
            pages.add(new PageRecord(i + 1, pageTexts[i], start, out.length(), false));
        }
        return pages;
    }

    private static List<Integer> overlappingPages(ChunkRecord chunk, List<PageRecord> pages) {
        Set<Integer> result = new TreeSet<>();
        for (PageRecord page : pages) {
            if (chunk.charStart() < page.charEnd() && chunk.charEnd() > page.charStart()) {
                result.add(page.pageNumber());
            }
        }
        return new ArrayList<>(result);
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Null text is rejected, blank text yields no chunks")
    void blankOrNull() {
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(null));
        assertTrue(chunker.chunk("").isEmpty());
        assertTrue(chunker.chunk("  \n\n  ").isEmpty());
    }

    @Test
    @DisplayName("Text of twenty characters or fewer is dropped as noise")
    void shortTextIsDropped() {
        assertTrue(chunker.chunk("Hello world.").isEmpty());
        assertTrue(chunker.chunkWithPages("   Page 12   ", List.of()).isEmpty());
    }

    @Test
    @DisplayName("Short text yields one chunk equal to the trimmed input")
    void shortTextSingleChunk() {
        List<String> chunks = chunker.chunk("  Alpha sentence. Bravo sentence.\n");
        assertEquals(List.of("Alpha sentence. Bravo sentence."), chunks);
    }

    @Test
    @DisplayName("Every chunk is the exact slice of the source, trimmed, longer than 20 and within size")
    void chunkInvariants() {
        String text = buildParagraphs(12, 9);
        List<ChunkRecord> chunks = chunker.chunkWithPages(text, List.of());

        assertThat(chunks).hasSizeGreaterThan(5);
        int previousStart = 0;
        for (ChunkRecord chunk : chunks) {
            assertEquals(chunk.text(), text.substring(chunk.charStart(), chunk.charEnd()));
            assertEquals(chunk.text().strip(), chunk.text());
            assertThat(chunk.text().length()).isGreaterThan(Chunker.MIN_CHUNK_CHARS).isLessThanOrEqualTo(SIZE);
            assertThat(chunk.charStart()).isGreaterThanOrEqualTo(previousStart);
            assertThat(chunk.pages()).isEmpty();
            previousStart = chunk.charStart();
        }
    }

    @Test
    @DisplayName("Same input and parameters produce identical chunks")
    void deterministic() {
        String text = buildParagraphs(6, 10);
        assertEquals(chunker.chunk(text), chunker.chunk(text));
        assertEquals(chunker.chunkWithPages(text, List.of()), chunker.chunkWithPages(text, List.of()));
        assertEquals(chunker.chunk(text, 120, 20), new Chunker(120, 20).chunk(text));
    }

    @Test
    @DisplayName("Consecutive chunks share at most overlap characters of leading context")
    void overlapBetweenChunks() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("word%02d", i));
        }
        String text = sb.toString();

        List<ChunkRecord> chunks = chunker.chunkWithPages(text, List.of(), 100, 30);

        assertThat(chunks).hasSizeGreaterThan(2);
        assertEquals("word00 word01 word02 word03 word04 word05 word06 word07 word08 word09 word10 word11 word12 word13",
                chunks.get(0).text());
        assertEquals(70, chunks.get(1).charStart());
        for (int i = 1; i < chunks.size(); i++) {
            int shared = chunks.get(i - 1).charEnd() - chunks.get(i).charStart();
            assertThat(shared).isPositive().isLessThanOrEqualTo(30);
        }
    }

    @Test
    @DisplayName("Zero overlap produces disjoint chunks")
    void zeroOverlap() {
        String text = buildParagraphs(10, 8);
        List<ChunkRecord> chunks = chunker.chunkWithPages(text, List.of(), 150, 0);
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(chunks.get(i).charStart()).isGreaterThanOrEqualTo(chunks.get(i - 1).charEnd());
        }
    }

    @Test
    @DisplayName("Repeated passages get their own offsets instead of the first occurrence")
    void repeatedTextKeepsExactOffsets() {
        String paragraph = "The same paragraph repeats here again.";
        String text = (paragraph + "\n\n").repeat(5);

        List<ChunkRecord> chunks = chunker.chunkWithPages(text, List.of(), 50, 0);

        assertEquals(5, chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            assertEquals(paragraph, chunks.get(i).text());
            assertEquals(i * 40, chunks.get(i).charStart());
            assertEquals(i * 40 + paragraph.length(), chunks.get(i).charEnd());
        }
    }

    @Test
    @DisplayName("Text without separators is split into character runs of at most size")
    void noSeparatorsFallsBackToCharacters() {
        String text = "x".repeat(250);
        List<String> chunks = chunker.chunk(text, 100, 0);
        assertEquals(List.of("x".repeat(100), "x".repeat(100), "x".repeat(50)), chunks);
    }

    @Test
    @DisplayName("Short header fragments are dropped while the paragraph after them is kept")
    void dropsShortFragments() {
        String paragraph = "This paragraph is long enough to keep.";
        String text = "12\n\n" + paragraph;

        List<ChunkRecord> chunks = chunker.chunkWithPages(text, List.of(), 40, 0);

        assertEquals(1, chunks.size());
        assertEquals(paragraph, chunks.get(0).text());
        assertEquals(4, chunks.get(0).charStart());
    }

    @Test
    @DisplayName("Chunk pages are exactly the pages whose spans overlap the chunk")
    void pageSpansAreComplete() {
        StringBuilder sb = new StringBuilder();
        List<PageRecord> pages = paginate(sb,
                buildParagraphs(2, 5),
                buildParagraphs(1, 3),
                "",
                buildParagraphs(3, 4));
        String text = sb.toString();

        List<ChunkRecord> chunks = chunker.chunkWithPages(text, pages);

        assertFalse(chunks.isEmpty());
        Set<Integer> seen = new TreeSet<>();
        for (ChunkRecord chunk : chunks) {
            assertEquals(overlappingPages(chunk, pages), chunk.pages());
            assertThat(chunk.pages()).isSorted().doesNotHaveDuplicates().isNotEmpty();
            seen.addAll(chunk.pages());
        }
        assertThat(seen).contains(1, 2, 4);
    }

    @Test
    @DisplayName("A chunk crossing a page break lists both pages")
    void chunkAcrossPageBreak() {
        StringBuilder sb = new StringBuilder();
        List<PageRecord> pages = paginate(sb,
                "Chapter one ends with a short closing remark.",
                "Chapter two starts right after the page break.");

        List<ChunkRecord> chunks = chunker.chunkWithPages(sb.toString(), pages, 800, 150);

        assertEquals(1, chunks.size());
        assertEquals(List.of(1, 2), chunks.get(0).pages());
        assertEquals("1-2", chunks.get(0).pageRangeLabel());
    }

    @Test
    @DisplayName("Character-level splitting never cuts a surrogate pair")
    void characterSplitKeepsSurrogatePairs() {
        String text = "\uD83D\uDE00".repeat(30);

        List<String> chunks = new Chunker(25, 0).chunk(text);

        assertFalse(chunks.isEmpty());
        for (String chunk : chunks) {
            assertThat(chunk.length()).isLessThanOrEqualTo(25);
            assertFalse(Character.isHighSurrogate(chunk.charAt(chunk.length() - 1)), chunk);
            assertFalse(Character.isLowSurrogate(chunk.charAt(0)), chunk);
            assertEquals(chunk.length() / 2, chunk.codePointCount(0, chunk.length()));
        }
    }

    @Test
    @DisplayName("Invalid size or overlap is rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Chunker(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(100, 100));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("text", 100, -1));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("text", 50, 80));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunkWithPages(null, List.of()));
    }
}

package eu.virtualparadox.docingest.ingest.chunker;

import eu.virtualparadox.docingest.application.config.IngestionProperties;
import eu.virtualparadox.docingest.ingest.model.ChunkRecord;
import eu.virtualparadox.docingest.ingest.model.PageRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Recursive, separator-aware text {@code Chunker} producing overlapping chunks for embedding.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Separator hierarchy:</strong> {@code "\n\n"}, {@code "\n"}, {@code ". "},
 *       {@code " "}, then single characters. A fragment is split on the first separator it
 *       contains; the separator stays at the start of the piece that follows it.</li>
 *   <li><strong>Packing:</strong> pieces shorter than {@code size} are merged greedily while the
 *       merged length stays within {@code size}. When a chunk is emitted, pieces are dropped from
 *       the front of the window until at most {@code overlap} characters remain; those form the
 *       leading context of the next chunk.</li>
 *   <li><strong>Recursion:</strong> a piece of {@code size} characters or more is split again
 *       with the separators that follow the current one.</li>
 *   <li><strong>Noise filter:</strong> chunks whose trimmed text is {@value #MIN_CHUNK_CHARS}
 *       characters or shorter (lone page numbers, running headers) are dropped.</li>
 *   <li><strong>Page spans:</strong> with page records, every chunk lists each page whose
 *       {@code [charStart, charEnd)} interval overlaps its own.</li>
 * </ul>
 *
 * <h2>Offsets</h2>
 * Every piece is a {@link TextSpan} into the source text from the first split to the emitted
 * chunk, so {@code text.substring(chunk.charStart(), chunk.charEnd())} is the chunk text even
 * when the same passage occurs several times in a document.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction and thus thread-safe. Output is a pure function of the inputs.
 */
@Slf4j
@Component
public class Chunker {

    /**
     * Chunks with this many trimmed characters or fewer are treated as extraction noise.
     */
    public static final int MIN_CHUNK_CHARS = 20;

    static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

    private final int defaultSize;
    private final int defaultOverlap;

    @Autowired
    public Chunker(final IngestionProperties properties) {
        this(properties.chunkSize(), properties.chunkOverlap());
    }

    /**
     * @param defaultSize    chunk size used by the overloads without explicit parameters
     * @param defaultOverlap overlap used by the overloads without explicit parameters
     * @throws IllegalArgumentException if {@code defaultSize <= 0} or the overlap is outside {@code [0, size)}
     */
    public Chunker(final int defaultSize, final int defaultOverlap) {
        validateParameters(defaultSize, defaultOverlap);
        this.defaultSize = defaultSize;
        this.defaultOverlap = defaultOverlap;
    }

    public List<String> chunk(final String text) {
        return chunk(text, defaultSize, defaultOverlap);
    }

    /**
     * Splits {@code text} into overlapping chunks of at most {@code size} characters.
     *
     * @param text    input text (non-null, may be blank)
     * @param size    maximum chunk length
     * @param overlap characters of context shared by consecutive chunks
     * @return chunk texts in document order
     */
    public List<String> chunk(final String text, final int size, final int overlap) {
        final List<String> result = new ArrayList<>();
        for (TextSpan span : chunkSpans(text, size, overlap)) {
            result.add(span.textOf(text));
        }
        return result;
    }

    public List<ChunkRecord> chunkWithPages(final String text, final List<PageRecord> pages) {
        return chunkWithPages(text, pages, defaultSize, defaultOverlap);
    }

    /**
     * Page-aware API. Chunks exactly as {@link #chunk(String, int, int)} and attaches each chunk's
     * character span and the pages it overlaps.
     *
     * @param text    full document text, in the coordinate space of {@code pages}
     * @param pages   page records; {@code null} or empty yields chunks without pages
     * @param size    maximum chunk length
     * @param overlap characters of context shared by consecutive chunks
     * @return chunk records in document order
     */
    public List<ChunkRecord> chunkWithPages(final String text,
                                            final List<PageRecord> pages,
                                            final int size,
                                            final int overlap) {
        final List<PageRecord> pageList = pages == null ? List.of() : pages;
        final List<ChunkRecord> result = new ArrayList<>();
        for (TextSpan span : chunkSpans(text, size, overlap)) {
            result.add(new ChunkRecord(span.textOf(text), pagesOf(span, pageList), span.start, span.end));
        }
        return result;
    }

    private List<TextSpan> chunkSpans(final String text, final int size, final int overlap) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        validateParameters(size, overlap);
        if (text.isBlank()) {
            return List.of();
        }

        final List<TextSpan> spans = split(text, new TextSpan(0, text.length()), SEPARATORS, size, overlap);

        final List<TextSpan> kept = new ArrayList<>(spans.size());
        int dropped = 0;
        for (TextSpan span : spans) {
            final TextSpan trimmed = span.trim(text);
            if (trimmed.length() > MIN_CHUNK_CHARS) {
                kept.add(trimmed);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} fragments of {} characters or fewer", dropped, MIN_CHUNK_CHARS);
        }
        return kept;
    }

    /**
     * Splits {@code fragment} on the first separator it contains, merging small pieces and
     * recursing into large ones.
     */
    private List<TextSpan> split(final String text,
                                 final TextSpan fragment,
                                 final List<String> separators,
                                 final int size,
                                 final int overlap) {
        String separator = separators.get(separators.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < separators.size(); i++) {
            final String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (indexOf(text, candidate, fragment.start, fragment.end) >= 0) {
                separator = candidate;
                finer = separators.subList(i + 1, separators.size());
                break;
            }
        }

        final List<TextSpan> result = new ArrayList<>();
        final List<TextSpan> small = new ArrayList<>();
        for (TextSpan piece : piecesOf(text, fragment, separator)) {
            if (piece.length() < size) {
                small.add(piece);
                continue;
            }
            if (!small.isEmpty()) {
                result.addAll(merge(text, small, size, overlap));
                small.clear();
            }
            if (finer.isEmpty()) {
                result.add(piece);
            } else {
                result.addAll(split(text, piece, finer, size, overlap));
            }
        }
        if (!small.isEmpty()) {
            result.addAll(merge(text, small, size, overlap));
        }
        return result;
    }

    /**
     * Cuts {@code fragment} before every occurrence of {@code separator}; an empty separator
     * yields single code points, so surrogate pairs are never cut. Empty pieces are skipped.
     */
    private static List<TextSpan> piecesOf(final String text, final TextSpan fragment, final String separator) {
        final List<TextSpan> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            int i = fragment.start;
            while (i < fragment.end) {
                final int next = Math.min(fragment.end, i + Character.charCount(text.codePointAt(i)));
                pieces.add(new TextSpan(i, next));
                i = next;
            }
            return pieces;
        }

        int pieceStart = fragment.start;
        int searchFrom = fragment.start;
        int at;
        while ((at = indexOf(text, separator, searchFrom, fragment.end)) >= 0) {
            if (at > pieceStart) {
                pieces.add(new TextSpan(pieceStart, at));
            }
            pieceStart = at;
            searchFrom = at + separator.length();
        }
        if (fragment.end > pieceStart) {
            pieces.add(new TextSpan(pieceStart, fragment.end));
        }
        return pieces;
    }

    /**
     * Greedily packs adjacent pieces into windows of at most {@code size} characters, keeping
     * up to {@code overlap} trailing characters of each emitted window as the start of the next.
     */
    private static List<TextSpan> merge(final String text,
                                        final List<TextSpan> pieces,
                                        final int size,
                                        final int overlap) {
        final List<TextSpan> chunks = new ArrayList<>();
        final Deque<TextSpan> window = new ArrayDeque<>();
        int total = 0;

        for (TextSpan piece : pieces) {
            final int length = piece.length();
            if (total + length > size && !window.isEmpty()) {
                emit(text, window, chunks);
                while (total > overlap || (total + length > size && total > 0)) {
                    total -= window.removeFirst().length();
                }
            }
            window.addLast(piece);
            total += length;
        }
        emit(text, window, chunks);
        return chunks;
    }

    // pieces in a window are contiguous, so the window is the span from first to last
    private static void emit(final String text, final Deque<TextSpan> window, final List<TextSpan> chunks) {
        if (window.isEmpty()) {
            return;
        }
        final TextSpan joined = new TextSpan(window.peekFirst().start, window.peekLast().end).trim(text);
        if (!joined.isEmpty()) {
            chunks.add(joined);
        }
    }

    private static List<Integer> pagesOf(final TextSpan span, final List<PageRecord> pages) {
        final SortedSet<Integer> hits = new TreeSet<>();
        for (PageRecord page : pages) {
            if (span.overlaps(page.charStart(), page.charEnd())) {
                hits.add(page.pageNumber());
            }
        }
        return new ArrayList<>(hits);
    }

    /**
     * Occurrence of {@code separator} lying entirely within {@code [from, to)}, or {@code -1}.
     */
    private static int indexOf(final String text, final String separator, final int from, final int to) {
        final int last = to - separator.length();
        for (int i = from; i <= last; i++) {
            if (text.startsWith(separator, i)) {
                return i;
            }
        }
        return -1;
    }

    private static void validateParameters(final int size, final int overlap) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (overlap < 0 || overlap >= size) {
            throw new IllegalArgumentException("overlap must be non-negative and less than size");
        }
    }
}

package eu.virtualparadox.docingest.ingest.model;

import java.util.List;

/**
 * A chunk of document text with its exact span in the full text.
 *
 * @param text      chunk text, equal to {@code fullText.substring(charStart, charEnd)}
 * @param pages     ascending page numbers the span overlaps; empty without page context
 * @param charStart inclusive offset into the full text
 * @param charEnd   exclusive offset into the full text
 */
public record ChunkRecord(String text, List<Integer> pages, int charStart, int charEnd) {

    public ChunkRecord {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text cannot be null or blank");
        }
        if (charStart < 0 || charStart >= charEnd) {
            throw new IllegalArgumentException("charStart must be non-negative and less than charEnd");
        }
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * Range label for citations, see {@link PageRange#labelOf(List)}.
     */
    public String pageRangeLabel() {
        return PageRange.labelOf(pages);
    }
}

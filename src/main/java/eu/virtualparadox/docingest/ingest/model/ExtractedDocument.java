package eu.virtualparadox.docingest.ingest.model;

import java.util.List;

/**
 * Full document text together with the page records that partition it.
 *
 * @param text  pages joined by {@link #PAGE_SEPARATOR}
 * @param pages page records in page order
 */
public record ExtractedDocument(String text, List<PageRecord> pages) {

    public static final String PAGE_SEPARATOR = "\n\n";

    public ExtractedDocument {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * Wraps non-paginated text into a single synthetic page spanning all of it.
     */
    public static ExtractedDocument singlePage(final String text) {
        return new ExtractedDocument(text, List.of(new PageRecord(1, text, 0, text.length(), false)));
    }

    public long ocrPageCount() {
        return pages.stream().filter(PageRecord::ocrUsed).count();
    }
}

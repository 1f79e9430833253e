package eu.virtualparadox.docingest.ingest.model;

import java.util.List;
import java.util.Optional;

/**
 * Inclusive range of pages a chunk came from.
 */
public record PageRange(int fromPage, int toPage) {

    public PageRange {
        if (fromPage < 1 || fromPage > toPage) {
            throw new IllegalArgumentException(
                    "Invalid range: fromPage (" + fromPage + ") must be positive and not greater than toPage (" + toPage + ")");
        }
    }

    /**
     * Range spanning the smallest and largest of {@code pages}.
     *
     * @param pages page numbers in any order; may be {@code null}
     * @return the range, or empty when there are no pages
     */
    public static Optional<PageRange> of(final List<Integer> pages) {
        if (pages == null || pages.isEmpty()) {
            return Optional.empty();
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int page : pages) {
            min = Math.min(min, page);
            max = Math.max(max, page);
        }
        return Optional.of(new PageRange(min, max));
    }

    /**
     * {@code "Page 4"} for a single page, {@code "3-5"} for several, {@code ""} for none.
     */
    public static String labelOf(final List<Integer> pages) {
        return of(pages).map(PageRange::asString).orElse("");
    }

    public String asString() {
        if (fromPage == toPage) {
            return "Page " + fromPage;
        }
        return fromPage + "-" + toPage;
    }
}

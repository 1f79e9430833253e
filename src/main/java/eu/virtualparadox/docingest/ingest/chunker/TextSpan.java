package eu.virtualparadox.docingest.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 * Used for separator pieces, merged windows and final chunks alike, so offsets never
 * have to be recovered by searching the text.
 */
final class TextSpan {
    /**
     * Inclusive start offset into the source text.
     */
    final int start;
    /**
     * Exclusive end offset into the source text.
     */
    final int end;

    TextSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }

    int length() {
        return end - start;
    }

    boolean isEmpty() {
        return start >= end;
    }

    /**
     * Shrinks the span until it neither starts nor ends with whitespace.
     *
     * @param source text the span points into
     * @return trimmed span, possibly empty
     */
    TextSpan trim(final String source) {
        int s = start;
        int e = end;
        while (s < e && Character.isWhitespace(source.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(source.charAt(e - 1))) {
            e--;
        }
        return s == start && e == end ? this : new TextSpan(s, e);
    }

    /**
     * Half-open interval overlap test.
     */
    boolean overlaps(final int otherStart, final int otherEnd) {
        return start < otherEnd && end > otherStart;
    }

    String textOf(final String source) {
        return source.substring(start, end);
    }
}

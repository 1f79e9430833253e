package eu.virtualparadox.docingest.ingest.lifecycle;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied book information, trimmed and validated.
 *
 * @param bookName    non-blank
 * @param publisher   non-blank
 * @param grade       may be {@code null}
 * @param fullName    {@code "<bookName> - <publisher>[ - <grade>]"}
 * @param productName display name, {@code fullName} unless the caller chose one
 */
public record TextbookDetails(String bookName, String publisher, String grade, String fullName, String productName) {

    /**
     * @throws IllegalArgumentException if {@code bookName} or {@code publisher} is blank
     */
    public static TextbookDetails of(final String bookName,
                                     final String publisher,
                                     final String grade,
                                     final String productName) {
        if (bookName == null || bookName.isBlank()) {
            throw new IllegalArgumentException("Book name is required");
        }
        if (publisher == null || publisher.isBlank()) {
            throw new IllegalArgumentException("Publisher is required");
        }
        final String name = bookName.strip();
        final String pub = publisher.strip();
        final String gradeLabel = grade == null || grade.isBlank() ? null : grade.strip();

        final String fullName = gradeLabel == null
                ? name + " - " + pub
                : name + " - " + pub + " - " + gradeLabel;
        final String product = productName == null || productName.isBlank() ? fullName : productName.strip();
        return new TextbookDetails(name, pub, gradeLabel, fullName, product);
    }

    /**
     * Per-chunk metadata entries. {@code grade} is present with a {@code null} value when not given.
     */
    public Map<String, Object> asMetadata() {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("product_name", productName);
        metadata.put("book_name", bookName);
        metadata.put("publisher", publisher);
        metadata.put("grade", grade);
        metadata.put("book_full_name", fullName);
        return metadata;
    }
}

package eu.virtualparadox.docingest.ingest.model;

/**
 * Text of one source page and its position in the document's concatenated text.
 *
 * @param pageNumber 1-based page number
 * @param text       page text as it appears in the full text
 * @param charStart  inclusive offset into the full text
 * @param charEnd    exclusive offset into the full text
 * @param ocrUsed    whether the native text layer was too sparse and OCR supplied the text
 */
public record PageRecord(int pageNumber, String text, int charStart, int charEnd, boolean ocrUsed) {

    public PageRecord {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be positive");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (charStart < 0 || charEnd - charStart != text.length()) {
            throw new IllegalArgumentException("Page " + pageNumber + " span [" + charStart + ", " + charEnd
                    + ") does not match text length " + text.length());
        }
    }
}

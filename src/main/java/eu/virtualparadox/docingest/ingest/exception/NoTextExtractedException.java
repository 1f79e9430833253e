package eu.virtualparadox.docingest.ingest.exception;

/**
 * Extraction and OCR completed but produced nothing but whitespace.
 * The input is unusable; nothing is broken.
 */
public class NoTextExtractedException extends DocumentIngestException {

    public NoTextExtractedException(final FileContext context) {
        super("No text could be extracted from the document", context, null);
    }
}

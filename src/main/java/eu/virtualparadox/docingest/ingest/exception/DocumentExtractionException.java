package eu.virtualparadox.docingest.ingest.exception;

/**
 * Decoding or structural parse failure, e.g. a malformed PDF or JSON document.
 */
public class DocumentExtractionException extends DocumentIngestException {

    public DocumentExtractionException(final String message, final Throwable cause) {
        super(message, null, cause);
    }

    public DocumentExtractionException(final String message, final FileContext context, final Throwable cause) {
        super(message, context, cause);
    }
}

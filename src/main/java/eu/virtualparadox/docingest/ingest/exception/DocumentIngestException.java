package eu.virtualparadox.docingest.ingest.exception;

/**
 * Root of the fatal ingestion failures. These are surfaced to the caller unchanged;
 * recoverable OCR failures never reach this hierarchy.
 */
public abstract class DocumentIngestException extends RuntimeException {

    private final transient FileContext context;

    protected DocumentIngestException(final String message, final FileContext context, final Throwable cause) {
        super(context == null ? message : message + " [" + context + "]", cause);
        this.context = context;
    }

    /**
     * @return the upload this failure belongs to, or {@code null} when raised below the service layer
     */
    public FileContext getContext() {
        return context;
    }
}

package eu.virtualparadox.docingest.ingest.exception;

public class UnsupportedFileTypeException extends DocumentIngestException {

    public UnsupportedFileTypeException(final FileContext context) {
        super("Unsupported file type: " + context.mimeType(), context, null);
    }
}

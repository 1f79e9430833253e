package eu.virtualparadox.docingest.ingest.lifecycle;

import eu.virtualparadox.docingest.ingest.exception.DocumentIngestException;

/**
 * Outcome of one upload in a batch: exactly one of {@code document} and {@code error} is set.
 */
public record BatchItemResult(String filename, ProcessedDocument document, DocumentIngestException error) {

    public BatchItemResult {
        if ((document == null) == (error == null)) {
            throw new IllegalArgumentException("Expected either a document or an error");
        }
    }

    public static BatchItemResult success(final ProcessedDocument document) {
        return new BatchItemResult(document.filename(), document, null);
    }

    public static BatchItemResult failure(final String filename, final DocumentIngestException error) {
        return new BatchItemResult(filename, null, error);
    }

    public boolean succeeded() {
        return document != null;
    }
}

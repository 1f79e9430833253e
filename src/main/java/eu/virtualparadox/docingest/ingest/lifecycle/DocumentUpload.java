package eu.virtualparadox.docingest.ingest.lifecycle;

import eu.virtualparadox.docingest.ingest.exception.FileContext;

/**
 * A generic upload.
 *
 * @param filename      original filename
 * @param mimeType      declared MIME type
 * @param content       raw bytes
 * @param extraMetadata caller metadata, ideally a JSON object; may be {@code null}
 */
public record DocumentUpload(String filename, String mimeType, byte[] content, String extraMetadata) {

    public DocumentUpload {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public static DocumentUpload of(final String filename, final String mimeType, final byte[] content) {
        return new DocumentUpload(filename, mimeType, content, null);
    }

    public FileContext context() {
        return new FileContext(filename, content.length, mimeType);
    }
}

package eu.virtualparadox.docingest.ingest.exception;

/**
 * Identifies the upload an ingestion failure belongs to.
 *
 * @param filename  original filename as supplied by the caller
 * @param sizeBytes content length in bytes
 * @param mimeType  declared MIME type
 */
public record FileContext(String filename, long sizeBytes, String mimeType) {

    public double sizeMb() {
        return sizeBytes / (1024.0 * 1024.0);
    }

    @Override
    public String toString() {
        return "file=" + filename + ", size=" + sizeBytes + " bytes, type=" + mimeType;
    }
}

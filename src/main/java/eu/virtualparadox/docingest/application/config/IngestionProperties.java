package eu.virtualparadox.docingest.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

/**
 * Immutable ingestion settings bound from the {@code docingest.*} properties.
 * <p>
 * One instance is created at startup and handed to every component constructor;
 * tests build their own instance instead of touching shared state.
 *
 * @param chunkSize          maximum characters per chunk
 * @param chunkOverlap       characters of leading context carried from the previous chunk
 * @param maxFileSizeMb      upload ceiling in megabytes
 * @param supportedFileTypes accepted MIME types
 * @param ocr                OCR settings
 * @param workers            worker pool settings
 */
@ConfigurationProperties(prefix = "docingest")
public record IngestionProperties(
        @DefaultValue("800") int chunkSize,
        @DefaultValue("150") int chunkOverlap,
        @DefaultValue("100") int maxFileSizeMb,
        @DefaultValue({"application/pdf", "text/plain", "text/markdown", "image/png", "image/jpeg",
                "image/jpg", "text/x-python", "application/json"}) List<String> supportedFileTypes,
        @DefaultValue Ocr ocr,
        @DefaultValue Workers workers) {

    public static final List<String> DEFAULT_FILE_TYPES = List.of(
            "application/pdf",
            "text/plain",
            "text/markdown",
            "image/png",
            "image/jpeg",
            "image/jpg",
            "text/x-python",
            "application/json"
    );

    public IngestionProperties {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be non-negative and less than chunkSize");
        }
        if (maxFileSizeMb <= 0) {
            throw new IllegalArgumentException("maxFileSizeMb must be positive");
        }
        supportedFileTypes = supportedFileTypes == null
                ? DEFAULT_FILE_TYPES
                : supportedFileTypes.stream().map(t -> t.trim().toLowerCase(Locale.ROOT)).toList();
        ocr = ocr == null ? new Ocr(true, null) : ocr;
        workers = workers == null ? new Workers(4, 32) : workers;
    }

    /**
     * Settings matching the shipped {@code application.properties}.
     */
    public static IngestionProperties defaults() {
        return new IngestionProperties(800, 150, 100, DEFAULT_FILE_TYPES, new Ocr(true, null), new Workers(4, 32));
    }

    /**
     * Copy of these settings with different chunking parameters.
     */
    public IngestionProperties withChunking(final int size, final int overlap) {
        return new IngestionProperties(size, overlap, maxFileSizeMb, supportedFileTypes, ocr, workers);
    }

    /**
     * Copy of these settings with a different upload ceiling.
     */
    public IngestionProperties withMaxFileSizeMb(final int megabytes) {
        return new IngestionProperties(chunkSize, chunkOverlap, megabytes, supportedFileTypes, ocr, workers);
    }

    public boolean isSupported(final String mimeType) {
        return mimeType != null && supportedFileTypes.contains(mimeType.trim().toLowerCase(Locale.ROOT));
    }

    public long maxFileSizeBytes() {
        return maxFileSizeMb * 1024L * 1024L;
    }

    /**
     * @param enhance      whether a poor first OCR pass is retried on a preprocessed image
     * @param tessdataPath Tesseract language data directory, {@code null} to use {@code TESSDATA_PREFIX}
     */
    public record Ocr(@DefaultValue("true") boolean enhance, String tessdataPath) {
    }

    /**
     * @param poolSize      fixed number of worker threads
     * @param queueCapacity submissions that may wait before new ones are rejected
     */
    public record Workers(@DefaultValue("4") int poolSize, @DefaultValue("32") int queueCapacity) {

        public Workers {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive");
            }
            if (queueCapacity < 0) {
                throw new IllegalArgumentException("queueCapacity must not be negative");
            }
        }
    }
}

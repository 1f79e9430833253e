package eu.virtualparadox.docingest.ingest.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * MIME types the extractor understands and how each one is turned into text.
 */
public enum DocumentType {
    PDF("application/pdf", Route.PAGINATED),
    PLAIN_TEXT("text/plain", Route.PLAIN_TEXT),
    MARKDOWN("text/markdown", Route.PLAIN_TEXT),
    PYTHON("text/x-python", Route.PLAIN_TEXT),
    JSON("application/json", Route.STRUCTURED_TEXT),
    PNG("image/png", Route.IMAGE),
    JPEG("image/jpeg", Route.IMAGE),
    JPG("image/jpg", Route.IMAGE);

    public enum Route {
        PAGINATED,
        PLAIN_TEXT,
        STRUCTURED_TEXT,
        IMAGE
    }

    private final String mimeType;
    private final Route route;

    DocumentType(final String mimeType, final Route route) {
        this.mimeType = mimeType;
        this.route = route;
    }

    public String mimeType() {
        return mimeType;
    }

    public Route route() {
        return route;
    }

    public boolean isPaginated() {
        return route == Route.PAGINATED;
    }

    /**
     * Resolves a declared MIME type, ignoring case and parameters such as {@code ;charset=utf-8}.
     */
    public static Optional<DocumentType> fromMimeType(final String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        final int params = mimeType.indexOf(';');
        final String bare = (params >= 0 ? mimeType.substring(0, params) : mimeType).trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.mimeType.equals(bare)).findFirst();
    }
}

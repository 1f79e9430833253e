package eu.virtualparadox.docingest.ingest.ocr;

import java.util.Locale;

/**
 * Recognition language sets, keyed by the hints callers pass around.
 */
public enum OcrLanguage {
    VIETNAMESE("vie"),
    LATIN("eng"),
    /** Both models at once; Tesseract picks per word. */
    AUTO("eng+vie");

    private final String tesseractCode;

    OcrLanguage(final String tesseractCode) {
        this.tesseractCode = tesseractCode;
    }

    public String tesseractCode() {
        return tesseractCode;
    }

    /**
     * Maps {@code "vi"} to Vietnamese, {@code "en"} and {@code "code"} to Latin, and everything
     * else (including {@code "auto"} and {@code null}) to {@link #AUTO}.
     */
    public static OcrLanguage fromHint(final String hint) {
        if (hint == null) {
            return AUTO;
        }
        switch (hint.trim().toLowerCase(Locale.ROOT)) {
            case "vi":
                return VIETNAMESE;
            case "en":
            case "code":
                return LATIN;
            default:
                return AUTO;
        }
    }
}

package eu.virtualparadox.docingest.ingest.ocr;

/**
 * Decides whether an OCR result is bad enough to retry on an enhanced image.
 */
public final class OcrQualityGate {

    static final int MIN_CHARS = 10;
    static final double MAX_SINGLE_CHAR_TOKEN_RATIO = 0.5;

    private OcrQualityGate() {
        // prevent instantiation
    }

    /**
     * A result is poor when its trimmed text is shorter than {@value #MIN_CHARS} characters,
     * or when more than half of its whitespace-separated tokens are single characters
     * (noise such as {@code "n a o t o e e"}).
     *
     * @param text OCR output, may be {@code null}
     * @return {@code true} if the result should be retried
     */
    public static boolean isPoor(final String text) {
        if (text == null) {
            return true;
        }
        final String trimmed = text.strip();
        if (trimmed.length() < MIN_CHARS) {
            return true;
        }
        final String[] tokens = trimmed.split("\\s+");
        int singleChars = 0;
        for (String token : tokens) {
            if (token.codePointCount(0, token.length()) == 1) {
                singleChars++;
            }
        }
        return (double) singleChars / tokens.length > MAX_SINGLE_CHAR_TOKEN_RATIO;
    }
}

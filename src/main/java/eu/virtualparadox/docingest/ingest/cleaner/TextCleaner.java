package eu.virtualparadox.docingest.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes extracted text without touching its line structure, which the chunker
 * relies on for paragraph and line boundaries.
 */
@Component
public class TextCleaner {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    // format chars (Cf) and control chars (Cc) except tab and newline
    private static final Pattern INVISIBLE = Pattern.compile("[\\p{Cf}&&[^\\u00AD]]|[\\p{Cc}&&[^\\t\\n]]");

    /**
     * Cleans native PDF text:
     * <ul>
     *   <li>NFC composition, so decomposed Vietnamese diacritics compare equal to typed text,</li>
     *   <li>{@code \r\n} and lone {@code \r} become {@code \n},</li>
     *   <li>non-breaking spaces become plain spaces,</li>
     *   <li>soft hyphens, zero-width characters and other invisible format or control
     *       characters are removed.</li>
     * </ul>
     * Newlines, tabs and all visible characters are kept as they are.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String normalize(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String text = Normalizer.normalize(input, Normalizer.Form.NFC);
        text = LINE_BREAKS.matcher(text).replaceAll("\n");
        text = text.replace('\u00A0', ' ');
        text = text.replace("\u00AD", "");
        text = ZERO_WIDTH.matcher(text).replaceAll("");
        return INVISIBLE.matcher(text).replaceAll("");
    }

    /**
     * Post-processes OCR output: every line is trimmed, blank lines are dropped and the rest
     * are rejoined with single newlines.
     *
     * @param ocrText raw OCR text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String cleanOcrText(final String ocrText) {
        if (ocrText == null || ocrText.isBlank()) {
            return "";
        }
        return Arrays.stream(normalize(ocrText).split("\n"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}

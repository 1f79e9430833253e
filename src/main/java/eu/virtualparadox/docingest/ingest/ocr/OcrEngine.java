package eu.virtualparadox.docingest.ingest.ocr;

import eu.virtualparadox.docingest.application.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Quality-adaptive OCR over a pluggable {@link TextRecognizer}.
 * <p>
 * The first pass runs on the unmodified raster. If {@link OcrQualityGate} judges the result poor
 * and enhancement is enabled, a second pass runs on the output of {@link ImageEnhancer} and the
 * longer of the two texts wins (ties keep the first pass).
 * <p>
 * OCR failure is a degraded result, not an error: anything that goes wrong while decoding or
 * recognizing a single image yields an empty string so that one bad page cannot fail a whole
 * document.
 */
@Slf4j
@Service
public class OcrEngine {

    private final TextRecognizer recognizer;
    private final ImageEnhancer enhancer;
    private final boolean enhance;

    @Autowired
    public OcrEngine(final TextRecognizer recognizer,
                     final ImageEnhancer enhancer,
                     final IngestionProperties properties) {
        this(recognizer, enhancer, properties.ocr().enhance());
    }

    public OcrEngine(final TextRecognizer recognizer, final ImageEnhancer enhancer, final boolean enhance) {
        this.recognizer = recognizer;
        this.enhancer = enhancer;
        this.enhance = enhance;
    }

    /**
     * Recognizes text in encoded image bytes (PNG, JPEG, ...).
     *
     * @param imageBytes encoded image
     * @param language   recognition language set
     * @return recognized, trimmed text; empty if the image cannot be read or recognition fails
     */
    public String recognize(final byte[] imageBytes, final OcrLanguage language) {
        final BufferedImage image;
        try {
            image = loadImage(imageBytes);
        } catch (IOException | RuntimeException e) {
            log.error("OCR skipped, image could not be loaded", e);
            return "";
        }
        return recognize(image, language);
    }

    /**
     * Recognizes text in a raster that is already in memory, e.g. a rendered PDF page.
     */
    public String recognize(final BufferedImage image, final OcrLanguage language) {
        final BufferedImage rgb = toRgb(image);

        String text = runPass(rgb, language);

        if (enhance && OcrQualityGate.isPoor(text)) {
            log.info("Poor OCR result ({} chars), retrying with enhancement", text.length());
            final String enhancedText = runPass(enhanceOrOriginal(rgb), language);
            if (enhancedText.length() > text.length()) {
                text = enhancedText;
            }
        }

        log.info("OCR extracted {} characters", text.length());
        return text;
    }

    private String runPass(final BufferedImage image, final OcrLanguage language) {
        try {
            final String raw = recognizer.recognize(image, language);
            return raw == null ? "" : raw.strip();
        } catch (RuntimeException | LinkageError e) {
            // LinkageError covers a missing native Tesseract library
            log.error("OCR pass failed for language {}", language.tesseractCode(), e);
            return "";
        }
    }

    private BufferedImage enhanceOrOriginal(final BufferedImage image) {
        try {
            return enhancer.enhance(image);
        } catch (RuntimeException e) {
            log.warn("Image enhancement failed, using original", e);
            return image;
        }
    }

    static BufferedImage loadImage(final byte[] imageBytes) throws IOException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IOException("Image content is empty");
        }
        final BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("No image reader understands the content");
        }
        log.debug("Image loaded: {}x{} type={}", image.getWidth(), image.getHeight(), image.getType());
        return image;
    }

    /**
     * Normalizes any colour model (palette, grayscale, alpha, CMYK-derived) to 3-channel RGB.
     * Transparent areas are flattened onto white.
     */
    static BufferedImage toRgb(final BufferedImage image) {
        final int type = image.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_3BYTE_BGR) {
            return image;
        }
        log.debug("Converting image of type {} to RGB", type);
        final BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}

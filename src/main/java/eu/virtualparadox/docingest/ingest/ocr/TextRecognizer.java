package eu.virtualparadox.docingest.ingest.ocr;

import java.awt.image.BufferedImage;

/**
 * A single OCR pass over a raster. Implementations are free to throw; the
 * {@link OcrEngine} turns every failure into an empty result.
 */
public interface TextRecognizer {

    /**
     * @param image    RGB raster
     * @param language recognition language set
     * @return raw recognized text
     * @throws OcrRecognitionException if the backend fails
     */
    String recognize(BufferedImage image, OcrLanguage language);
}

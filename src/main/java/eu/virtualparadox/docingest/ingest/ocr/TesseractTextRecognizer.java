package eu.virtualparadox.docingest.ingest.ocr;

import eu.virtualparadox.docingest.application.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Tess4J-backed recognizer.
 * <p>
 * {@link Tesseract} holds native handles and is not thread-safe, so a fresh instance is
 * configured for every call. Page segmentation mode 6 treats the image as one uniform
 * block of text, which suits book pages and code screenshots.
 */
@Slf4j
@Component
public class TesseractTextRecognizer implements TextRecognizer {

    static final int PSM_SINGLE_BLOCK = 6;
    static final int OEM_DEFAULT = 3;

    private final String dataPath;

    public TesseractTextRecognizer(final IngestionProperties properties) {
        this.dataPath = resolveDataPath(properties.ocr().tessdataPath());
        log.info("Tesseract data path: {}", dataPath == null ? "<library default>" : dataPath);
    }

    @Override
    public String recognize(final BufferedImage image, final OcrLanguage language) {
        final Tesseract tesseract = new Tesseract();
        if (dataPath != null) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(language.tesseractCode());
        tesseract.setPageSegMode(PSM_SINGLE_BLOCK);
        tesseract.setOcrEngineMode(OEM_DEFAULT);
        try {
            return tesseract.doOCR(image);
        } catch (TesseractException e) {
            throw new OcrRecognitionException("Tesseract failed for language " + language.tesseractCode(), e);
        }
    }

    private static String resolveDataPath(final String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        final String fromEnv = System.getenv("TESSDATA_PREFIX");
        return fromEnv == null || fromEnv.isBlank() ? null : fromEnv;
    }
}

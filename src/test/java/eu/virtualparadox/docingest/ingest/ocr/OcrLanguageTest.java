package eu.virtualparadox.docingest.ingest.ocr;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OcrLanguageTest {

    @Test
    void hintsMapToTesseractCodes() {
        assertEquals("vie", OcrLanguage.fromHint("vi").tesseractCode());
        assertEquals("eng", OcrLanguage.fromHint("en").tesseractCode());
        assertEquals("eng", OcrLanguage.fromHint("code").tesseractCode());
        assertEquals("eng+vie", OcrLanguage.fromHint("auto").tesseractCode());
        assertEquals("eng+vie", OcrLanguage.fromHint("fr").tesseractCode());
        assertEquals(OcrLanguage.AUTO, OcrLanguage.fromHint(null));
    }
}

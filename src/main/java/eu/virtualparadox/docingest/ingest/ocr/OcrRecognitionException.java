package eu.virtualparadox.docingest.ingest.ocr;

public class OcrRecognitionException extends RuntimeException {

    public OcrRecognitionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

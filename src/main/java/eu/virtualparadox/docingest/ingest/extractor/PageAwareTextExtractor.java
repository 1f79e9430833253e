package eu.virtualparadox.docingest.ingest.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.docingest.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docingest.ingest.exception.DocumentExtractionException;
import eu.virtualparadox.docingest.ingest.model.DocumentType;
import eu.virtualparadox.docingest.ingest.model.ExtractedDocument;
import eu.virtualparadox.docingest.ingest.model.PageRecord;
import eu.virtualparadox.docingest.ingest.ocr.OcrEngine;
import eu.virtualparadox.docingest.ingest.ocr.OcrLanguage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Turns uploaded bytes into text, keeping track of where every PDF page lands.
 * <p>
 * PDFs are read page by page with PDFBox. A page whose native text layer holds fewer than
 * {@value #MIN_NATIVE_CHARS} characters is treated as scanned: it is rendered at
 * {@value #RENDER_SCALE}&times; and handed to the {@link OcrEngine}. Pages are joined with
 * {@link ExtractedDocument#PAGE_SEPARATOR} and every {@link PageRecord} carries its exact
 * {@code [charStart, charEnd)} span in the joined text, so chunk offsets can be mapped back to
 * pages without any per-character bookkeeping.
 * <p>
 * Other types produce a single synthetic page covering the whole text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PageAwareTextExtractor implements TextExtractor {

    static final int MIN_NATIVE_CHARS = 50;
    static final float RENDER_SCALE = 2.0f;

    private final OcrEngine ocrEngine;
    private final TextCleaner textCleaner;
    private final ObjectMapper objectMapper;

    @Override
    public String extractText(final byte[] content, final DocumentType type) {
        switch (type.route()) {
            case PAGINATED:
                return extractPdf(content).text();
            case PLAIN_TEXT:
                return decodeUtf8(content);
            case STRUCTURED_TEXT:
                return prettyPrintJson(content);
            case IMAGE:
                return textCleaner.cleanOcrText(ocrEngine.recognize(content, OcrLanguage.AUTO));
            default:
                throw new IllegalArgumentException("No extraction route for " + type);
        }
    }

    @Override
    public ExtractedDocument extractWithPages(final byte[] content, final DocumentType type) {
        if (type.isPaginated()) {
            return extractPdf(content);
        }
        return ExtractedDocument.singlePage(extractText(content, type));
    }

    private ExtractedDocument extractPdf(final byte[] content) {
        try (PDDocument pdf = PDDocument.load(content)) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            final PDFRenderer renderer = new PDFRenderer(pdf);

            final StringBuilder fullText = new StringBuilder();
            final List<PageRecord> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("PDF extraction interrupted before page " + page + " of " + pageCount);
                }

                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = textCleaner.normalize(stripper.getText(pdf));

                final boolean scanned = pageText.strip().length() < MIN_NATIVE_CHARS;
                if (scanned) {
                    log.debug("Page {} has only {} native characters, running OCR", page, pageText.strip().length());
                    pageText = ocrPage(renderer, page);
                }

                if (page > 1) {
                    fullText.append(ExtractedDocument.PAGE_SEPARATOR);
                }
                final int start = fullText.length();
                fullText.append(pageText);
                pages.add(new PageRecord(page, pageText, start, fullText.length(), scanned));
            }

            final ExtractedDocument document = new ExtractedDocument(fullText.toString(), pages);
            final long scannedPages = document.ocrPageCount();
            log.info("Extracted {} pages ({} text, {} scanned), {} characters",
                    pageCount, pageCount - scannedPages, scannedPages, document.text().length());
            return document;
        } catch (CancellationException | DocumentExtractionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // PDFBox reports corrupt content streams with unchecked exceptions as well
            throw new DocumentExtractionException("Failed to read PDF", e);
        }
    }

    /**
     * OCR of one scanned page. A page that cannot be rendered or recognized yields {@code ""}
     * and the rest of the document is still extracted.
     */
    private String ocrPage(final PDFRenderer renderer, final int page) {
        final BufferedImage image;
        try {
            image = renderPage(renderer, page - 1);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to render page {} for OCR", page, e);
            return "";
        }
        try {
            return textCleaner.cleanOcrText(ocrEngine.recognize(image, OcrLanguage.AUTO));
        } catch (RuntimeException e) {
            log.error("OCR failed on page {}", page, e);
            return "";
        } finally {
            image.flush();
        }
    }

    BufferedImage renderPage(final PDFRenderer renderer, final int pageIndex) throws IOException {
        return renderer.renderImage(pageIndex, RENDER_SCALE, ImageType.RGB);
    }

    private static String decodeUtf8(final byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            // cannot happen with IGNORE
            throw new DocumentExtractionException("Failed to decode text as UTF-8", e);
        }
    }

    private String prettyPrintJson(final byte[] content) {
        try {
            final JsonNode node = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(new ByteArrayInputStream(content));
            if (node == null || node.isMissingNode()) {
                throw new DocumentExtractionException("JSON document is empty", null);
            }
            final DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                    .withObjectIndenter(new DefaultIndenter("  ", "\n"));
            return objectMapper.writer(printer).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new DocumentExtractionException("Failed to parse JSON", e);
        } catch (IOException e) {
            throw new DocumentExtractionException("Failed to read JSON", e);
        }
    }
}

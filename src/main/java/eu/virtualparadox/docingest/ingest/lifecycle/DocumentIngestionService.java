package eu.virtualparadox.docingest.ingest.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.docingest.application.config.IngestionProperties;
import eu.virtualparadox.docingest.application.executor.IngestionExecutor;
import eu.virtualparadox.docingest.ingest.chunker.Chunker;
import eu.virtualparadox.docingest.ingest.exception.DocumentExtractionException;
import eu.virtualparadox.docingest.ingest.exception.DocumentIngestException;
import eu.virtualparadox.docingest.ingest.exception.FileContext;
import eu.virtualparadox.docingest.ingest.exception.NoTextExtractedException;
import eu.virtualparadox.docingest.ingest.exception.SizeLimitExceededException;
import eu.virtualparadox.docingest.ingest.exception.UnsupportedFileTypeException;
import eu.virtualparadox.docingest.ingest.extractor.TextExtractor;
import eu.virtualparadox.docingest.ingest.metadata.BookMetadata;
import eu.virtualparadox.docingest.ingest.metadata.TextbookFilenameParser;
import eu.virtualparadox.docingest.ingest.model.ChunkMetadata;
import eu.virtualparadox.docingest.ingest.model.ChunkRecord;
import eu.virtualparadox.docingest.ingest.model.DocumentType;
import eu.virtualparadox.docingest.ingest.model.ExtractedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point of the ingestion pipeline:
 * <ol>
 *   <li>validate the declared type and the size of an upload,</li>
 *   <li>extract its text (OCR where needed),</li>
 *   <li>chunk it, with page spans for textbooks,</li>
 *   <li>attach per-chunk metadata.</li>
 * </ol>
 * Every operation is synchronous; the {@code *Async} variants run the same work on the
 * bounded {@link IngestionExecutor}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    static final String RAW_METADATA_KEY = "raw_metadata";

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final IngestionProperties properties;
    private final TextExtractor textExtractor;
    private final Chunker chunker;
    private final TextbookFilenameParser filenameParser;
    private final ObjectMapper objectMapper;
    private final IngestionExecutor ingestionExecutor;

    /**
     * Extracts the text of an upload without chunking it, e.g. to use it as chat context.
     *
     * @return extracted text, never blank
     * @throws DocumentIngestException if the upload is rejected or yields no text
     */
    public String extract(final byte[] content, final String filename, final String mimeType) {
        final FileContext context = new FileContext(filename, content.length, mimeType);
        return guarded(context, () -> {
            final DocumentType type = validate(context);
            log.info("Extracting {} ({}, {} bytes)", filename, mimeType, content.length);
            final String text = extractText(context, () -> textExtractor.extractText(content, type));
            log.info("Extracted {} characters from {}", text.length(), filename);
            return text;
        });
    }

    /**
     * Generic processing: extract, chunk without page context, and attach metadata.
     * The upload's extra metadata is merged into every chunk's metadata when it is a JSON
     * object and kept verbatim under {@value #RAW_METADATA_KEY} otherwise.
     */
    public ProcessedDocument process(final DocumentUpload upload) {
        final FileContext context = upload.context();
        return guarded(context, () -> {
            final DocumentType type = validate(context);
            log.info("Processing {} ({}, {} bytes)", upload.filename(), upload.mimeType(), context.sizeBytes());

            final String text = extractText(context, () -> textExtractor.extractText(upload.content(), type));
            final List<String> chunks = chunker.chunk(text);
            log.info("Created {} chunks from {} characters of {}", chunks.size(), text.length(), upload.filename());

            final String hash = DigestUtils.md5DigestAsHex(upload.content());
            final Map<String, Object> extra = parseExtraMetadata(upload.extraMetadata());
            final List<ChunkMetadata> metadata = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                metadata.add(ChunkMetadata.of(upload.filename(), upload.mimeType(), hash, i, chunks.size(), extra));
            }
            return new ProcessedDocument(upload.filename(), upload.mimeType(), text, chunks, metadata);
        });
    }

    /**
     * Textbook processing: chunks carry page spans, metadata carries page ranges and the
     * caller's book details. Non-PDF textbooks are treated as a single page.
     *
     * @throws IllegalArgumentException if the book name or publisher is blank
     */
    public ProcessedTextbook processTextbook(final TextbookUpload upload) {
        final TextbookDetails details = upload.details();
        final FileContext context = upload.context();
        return guarded(context, () -> {
            final DocumentType type = validate(context);
            log.info("Processing textbook {} ({}, {} bytes)", upload.filename(), upload.mimeType(), context.sizeBytes());
            if (!filenameParser.followsConvention(upload.filename())) {
                log.warn("Filename {} does not follow the textbook naming convention", upload.filename());
            }
            final BookMetadata bookMetadata = filenameParser.parse(upload.filename());

            final ExtractedDocument document = textExtractor.extractWithPages(upload.content(), type);
            requireText(context, document.text());
            final List<ChunkRecord> chunks = chunker.chunkWithPages(document.text(), document.pages());
            log.info("Created {} chunks from {} pages of {}", chunks.size(), document.pages().size(), upload.filename());

            final String hash = DigestUtils.md5DigestAsHex(upload.content());
            final Map<String, Object> extra = details.asMetadata();
            final List<ChunkMetadata> metadata = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                metadata.add(ChunkMetadata.ofChunk(upload.filename(), upload.mimeType(), hash, i, chunks.size(),
                        chunks.get(i), extra));
            }
            return new ProcessedTextbook(upload.filename(), upload.mimeType(), document.text(), document.pages(),
                    chunks, bookMetadata, details, metadata);
        });
    }

    /**
     * Generic processing of several uploads. A rejected or unreadable upload does not stop the
     * batch: its failure is recorded and the next upload is processed.
     *
     * @return one result per upload, in input order
     */
    public List<BatchItemResult> processBatch(final List<DocumentUpload> uploads) {
        final List<BatchItemResult> results = new ArrayList<>(uploads.size());
        int failed = 0;
        for (DocumentUpload upload : uploads) {
            try {
                results.add(BatchItemResult.success(process(upload)));
            } catch (DocumentIngestException e) {
                results.add(BatchItemResult.failure(upload.filename(), e));
                failed++;
            }
        }
        log.info("Batch finished: {} of {} uploads processed, {} failed", uploads.size() - failed, uploads.size(), failed);
        return results;
    }

    public CompletableFuture<String> extractAsync(final byte[] content, final String filename, final String mimeType) {
        return ingestionExecutor.supply(() -> extract(content, filename, mimeType));
    }

    public CompletableFuture<ProcessedDocument> processAsync(final DocumentUpload upload) {
        return ingestionExecutor.supply(() -> process(upload));
    }

    public CompletableFuture<List<BatchItemResult>> processBatchAsync(final List<DocumentUpload> uploads) {
        return ingestionExecutor.supply(() -> processBatch(uploads));
    }

    public CompletableFuture<ProcessedTextbook> processTextbookAsync(final TextbookUpload upload) {
        return ingestionExecutor.supply(() -> processTextbook(upload));
    }

    private DocumentType validate(final FileContext context) {
        if (!properties.isSupported(context.mimeType())) {
            throw new UnsupportedFileTypeException(context);
        }
        final DocumentType type = DocumentType.fromMimeType(context.mimeType())
                .orElseThrow(() -> new UnsupportedFileTypeException(context));
        if (context.sizeBytes() > properties.maxFileSizeBytes()) {
            throw new SizeLimitExceededException(context, properties.maxFileSizeMb());
        }
        return type;
    }

    private String extractText(final FileContext context, final Supplier<String> extraction) {
        final String text = extraction.get();
        requireText(context, text);
        return text;
    }

    private static void requireText(final FileContext context, final String text) {
        if (text == null || text.isBlank()) {
            throw new NoTextExtractedException(context);
        }
    }

    private Map<String, Object> parseExtraMetadata(final String extraMetadata) {
        if (extraMetadata == null || extraMetadata.isBlank()) {
            return Map.of();
        }
        try {
            final Map<String, Object> parsed = objectMapper.readValue(extraMetadata, JSON_OBJECT);
            return parsed == null ? Map.of(RAW_METADATA_KEY, extraMetadata) : parsed;
        } catch (JsonProcessingException e) {
            log.debug("Extra metadata is not a JSON object, storing it raw: {}", e.getOriginalMessage());
            return Map.of(RAW_METADATA_KEY, extraMetadata);
        }
    }

    /**
     * Runs {@code work}, attaching the upload's context to extraction failures and logging
     * every fatal failure once.
     */
    private <T> T guarded(final FileContext context, final Supplier<T> work) {
        try {
            return work.get();
        } catch (DocumentExtractionException e) {
            final DocumentExtractionException withContext = e.getContext() == null
                    ? new DocumentExtractionException(e.getMessage(), context, e.getCause())
                    : e;
            log.error("Ingestion failed: {}", withContext.getMessage(), withContext);
            throw withContext;
        } catch (DocumentIngestException e) {
            log.error("Ingestion failed: {}", e.getMessage());
            throw e;
        }
    }
}

package eu.virtualparadox.docingest.ingest.lifecycle;

import eu.virtualparadox.docingest.ingest.metadata.BookMetadata;
import eu.virtualparadox.docingest.ingest.model.ChunkMetadata;
import eu.virtualparadox.docingest.ingest.model.ChunkRecord;
import eu.virtualparadox.docingest.ingest.model.PageRecord;

import java.util.List;

/**
 * Output of textbook processing. Chunks carry their page spans, and the per-chunk metadata
 * carries both the page information and the caller's book details.
 *
 * @param bookMetadata labels decoded from the filename
 * @param details      book details supplied with the upload
 */
public record ProcessedTextbook(String filename,
                                String mimeType,
                                String fullText,
                                List<PageRecord> pages,
                                List<ChunkRecord> chunks,
                                BookMetadata bookMetadata,
                                TextbookDetails details,
                                List<ChunkMetadata> metadata) implements IndexableDocument {

    public ProcessedTextbook {
        pages = List.copyOf(pages);
        chunks = List.copyOf(chunks);
        metadata = List.copyOf(metadata);
        if (chunks.size() != metadata.size()) {
            throw new IllegalArgumentException("Expected one metadata entry per chunk");
        }
    }

    @Override
    public List<String> chunkTexts() {
        return chunks.stream().map(ChunkRecord::text).toList();
    }
}

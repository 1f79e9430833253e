package eu.virtualparadox.docingest.ingest.lifecycle;

import eu.virtualparadox.docingest.ingest.model.ChunkMetadata;

import java.util.List;

/**
 * Output of generic processing: chunk texts with one metadata entry each.
 */
public record ProcessedDocument(String filename,
                                String mimeType,
                                String fullText,
                                List<String> chunks,
                                List<ChunkMetadata> metadata) implements IndexableDocument {

    public ProcessedDocument {
        chunks = List.copyOf(chunks);
        metadata = List.copyOf(metadata);
        if (chunks.size() != metadata.size()) {
            throw new IllegalArgumentException("Expected one metadata entry per chunk");
        }
    }

    @Override
    public List<String> chunkTexts() {
        return chunks;
    }
}

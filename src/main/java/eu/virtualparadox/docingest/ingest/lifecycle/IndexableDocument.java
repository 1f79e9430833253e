package eu.virtualparadox.docingest.ingest.lifecycle;

import eu.virtualparadox.docingest.ingest.model.ChunkMetadata;

import java.util.List;

/**
 * Result of an ingestion run that can be handed to the embedding and storage side.
 * {@link #chunkTexts()} and {@link #metadata()} are aligned by index.
 */
public interface IndexableDocument {

    String filename();

    List<String> chunkTexts();

    List<ChunkMetadata> metadata();
}

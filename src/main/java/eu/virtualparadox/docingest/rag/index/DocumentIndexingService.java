package eu.virtualparadox.docingest.rag.index;

import eu.virtualparadox.docingest.ingest.lifecycle.IndexableDocument;
import eu.virtualparadox.docingest.ingest.model.ChunkMetadata;
import eu.virtualparadox.docingest.rag.embed.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Hands a processed document to the storage side:
 * <ol>
 *     <li>embed the chunk texts via {@link EmbeddingModel},</li>
 *     <li>upsert chunks, vectors and metadata payloads into the {@link ChunkIndex}.</li>
 * </ol>
 * Thin and stateless; one document per call. Both collaborators are supplied by the
 * embedding application, which is why this class is not a component itself.
 */
@Slf4j
@RequiredArgsConstructor
public class DocumentIndexingService {

    private final EmbeddingModel embeddingModel;
    private final ChunkIndex chunkIndex;

    /**
     * @param document output of the ingestion service
     * @return identifier assigned by the index
     * @throws IllegalArgumentException if the document has no chunks
     * @throws IllegalStateException    if the embedding model returns the wrong number or size of vectors
     */
    public String index(final IndexableDocument document) {
        final List<String> chunks = document.chunkTexts();
        if (chunks.isEmpty()) {
            throw new IllegalArgumentException("Document " + document.filename() + " has no chunks to index");
        }

        final List<float[]> vectors = embeddingModel.embed(chunks);
        validateVectors(document.filename(), chunks.size(), vectors);

        final List<Map<String, Object>> payloads = document.metadata().stream()
                .map(ChunkMetadata::toPayload)
                .toList();

        final String id = chunkIndex.upsert(chunks, vectors, payloads);
        log.info("Indexed {} chunks of {} as {}", chunks.size(), document.filename(), id);
        return id;
    }

    private void validateVectors(final String filename, final int expectedCount, final List<float[]> vectors) {
        if (vectors == null || vectors.size() != expectedCount) {
            throw new IllegalStateException("Expected " + expectedCount + " vectors for " + filename
                    + " but got " + (vectors == null ? 0 : vectors.size()));
        }
        final int dimension = embeddingModel.dimension();
        for (int i = 0; i < vectors.size(); i++) {
            final float[] vector = vectors.get(i);
            if (vector == null || vector.length != dimension) {
                throw new IllegalStateException("Vector " + i + " of " + filename + " has dimension "
                        + (vector == null ? 0 : vector.length) + ", expected " + dimension);
            }
        }
    }
}

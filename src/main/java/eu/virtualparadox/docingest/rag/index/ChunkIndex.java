package eu.virtualparadox.docingest.rag.index;

import java.util.List;
import java.util.Map;

/**
 * Storage for chunk vectors and their payloads.
 * <p>
 * The three lists passed to {@link #upsert(List, List, List)} are aligned by index and all
 * vectors have the same dimension.
 */
public interface ChunkIndex {

    /**
     * Stores every chunk with its vector and payload as one document.
     *
     * @return identifier of the stored document
     */
    String upsert(List<String> chunks, List<float[]> vectors, List<Map<String, Object>> payloads);
}

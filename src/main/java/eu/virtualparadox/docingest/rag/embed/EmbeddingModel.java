package eu.virtualparadox.docingest.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for chunk texts.
 */
public interface EmbeddingModel {

    /**
     * Embeds the given texts in batch.
     *
     * @param texts chunk texts
     * @return one vector per text, in the same order, each of length {@link #dimension()}
     */
    List<float[]> embed(List<String> texts);

    int dimension();
}

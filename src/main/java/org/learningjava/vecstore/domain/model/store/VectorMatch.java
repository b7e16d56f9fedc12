package org.learningjava.vecstore.domain.model.store;

import java.util.Map;

/**
 * One hit returned by {@code query}. The embedding is best effort (empty when the backend
 * does not return vectors); the score scale is whatever the backend uses.
 */
public record VectorMatch(
        String id,
        float[] embedding,
        Chunk chunk,
        double similarityScore,
        Map<String, Object> metadata
) {

    public VectorMatch {
        embedding = embedding == null ? new float[0] : embedding;
        chunk = chunk == null ? Chunk.empty() : chunk;
        metadata = metadata == null ? Map.of() : metadata;
    }
}

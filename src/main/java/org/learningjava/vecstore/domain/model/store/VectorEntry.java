package org.learningjava.vecstore.domain.model.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record submitted to {@code add}. The id must be convertible to the backend key type,
 * the embedding dimension must match the collection (checked by the backend, not here).
 */
public record VectorEntry(
        String id,
        float[] embedding,
        Chunk chunk,
        Map<String, Object> metadata
) {

    public VectorEntry {
        embedding = embedding == null ? null : embedding.clone();
        chunk = chunk == null ? Chunk.empty() : chunk;
        // LinkedHashMap keeps insertion order and, unlike Map.copyOf, tolerates null values
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public VectorEntry(String id, float[] embedding, Chunk chunk) {
        this(id, embedding, chunk, Map.of());
    }
}

package org.learningjava.vecstore.domain.model.store;

import org.learningjava.vecstore.domain.model.filter.MetadataFilterGroup;

/**
 * Search request. Either the embedding, the filters, or both must be present;
 * without an embedding the store runs a filter-only lookup. A null {@code topK} means the
 * store's configured default.
 */
public record VectorStoreQuery(
        float[] embedding,
        Integer topK,
        MetadataFilterGroup filters
) {

    public VectorStoreQuery {
        embedding = embedding == null ? null : embedding.clone();
    }

    public static VectorStoreQuery bySimilarity(float[] embedding, int topK) {
        return new VectorStoreQuery(embedding, topK, null);
    }

    public static VectorStoreQuery bySimilarity(float[] embedding) {
        return new VectorStoreQuery(embedding, null, null);
    }

    public static VectorStoreQuery byFilter(MetadataFilterGroup filters, int topK) {
        return new VectorStoreQuery(null, topK, filters);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public boolean hasFilters() {
        return filters != null;
    }
}

package org.learningjava.vecstore.domain.model.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collection schema and defaults of one store instance. Immutable; shared read-only by
 * every operation on the instance.
 *
 * @param collectionName      backend collection, required
 * @param primaryKeyField     primary key field name
 * @param keyType             native type of the primary key
 * @param vectorField         float vector field name
 * @param chunkFieldName      field holding the chunk content
 * @param additionalFields    extra fields projected on read, in order
 * @param fieldKinds          expected kind per additional field; absent means {@link FieldKind#STRING}
 * @param topK                default top-K
 * @param passThroughMetadata whether entry metadata is written as properties
 */
public record StoreConfiguration(
        String collectionName,
        String primaryKeyField,
        KeyType keyType,
        String vectorField,
        String chunkFieldName,
        List<String> additionalFields,
        Map<String, FieldKind> fieldKinds,
        int topK,
        boolean passThroughMetadata
) {

    public static final String TYPE_FIELD = "type";
    public static final String DEFAULT_PRIMARY_KEY_FIELD = "id";
    public static final String DEFAULT_VECTOR_FIELD = "vector";
    public static final String DEFAULT_CHUNK_FIELD = "content";
    public static final int DEFAULT_TOP_K = 5;

    public StoreConfiguration {
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("collectionName is required");
        }
        primaryKeyField = blankTo(primaryKeyField, DEFAULT_PRIMARY_KEY_FIELD);
        keyType = keyType == null ? KeyType.INT64 : keyType;
        vectorField = blankTo(vectorField, DEFAULT_VECTOR_FIELD);
        chunkFieldName = blankTo(chunkFieldName, DEFAULT_CHUNK_FIELD);
        additionalFields = additionalFields == null ? List.of() : List.copyOf(additionalFields);
        fieldKinds = fieldKinds == null ? Map.of() : Map.copyOf(fieldKinds);
        topK = topK > 0 ? topK : DEFAULT_TOP_K;
    }

    public FieldKind kindOf(String field) {
        return fieldKinds.getOrDefault(field, FieldKind.STRING);
    }

    public OutputSchema outputSchema() {
        return OutputSchema.of(this);
    }

    public static Builder builder(String collectionName) {
        return new Builder(collectionName);
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    public static final class Builder {
        private final String collectionName;
        private String primaryKeyField;
        private KeyType keyType;
        private String vectorField;
        private String chunkFieldName;
        private List<String> additionalFields = new ArrayList<>();
        private Map<String, FieldKind> fieldKinds = new LinkedHashMap<>();
        private int topK;
        private boolean passThroughMetadata = true;

        private Builder(String collectionName) {
            this.collectionName = collectionName;
        }

        public Builder primaryKeyField(String v) { this.primaryKeyField = v; return this; }
        public Builder keyType(KeyType v) { this.keyType = v; return this; }
        public Builder vectorField(String v) { this.vectorField = v; return this; }
        public Builder chunkFieldName(String v) { this.chunkFieldName = v; return this; }
        public Builder additionalFields(List<String> v) { this.additionalFields = new ArrayList<>(v); return this; }
        public Builder fieldKind(String field, FieldKind kind) { this.fieldKinds.put(field, kind); return this; }
        public Builder fieldKinds(Map<String, FieldKind> v) { this.fieldKinds = new LinkedHashMap<>(v); return this; }
        public Builder topK(int v) { this.topK = v; return this; }
        public Builder passThroughMetadata(boolean v) { this.passThroughMetadata = v; return this; }

        public StoreConfiguration build() {
            return new StoreConfiguration(collectionName, primaryKeyField, keyType, vectorField, chunkFieldName,
                    additionalFields, fieldKinds, topK, passThroughMetadata);
        }
    }
}

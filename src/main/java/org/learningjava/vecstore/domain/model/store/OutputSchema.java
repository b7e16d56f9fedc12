package org.learningjava.vecstore.domain.model.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields requested from the backend on read, each with its expected kind.
 * The chunk type, chunk content and vector fields are named so results can be put back
 * together; every other field is projected into the match metadata.
 */
public record OutputSchema(
        String typeField,
        String contentField,
        String vectorField,
        Map<String, FieldKind> fields
) {

    public OutputSchema {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static OutputSchema of(StoreConfiguration config) {
        Map<String, FieldKind> fields = new LinkedHashMap<>();
        fields.put(StoreConfiguration.TYPE_FIELD, FieldKind.STRING);
        fields.put(config.chunkFieldName(), FieldKind.STRING);
        fields.put(config.vectorField(), FieldKind.FLOAT_VECTOR);
        for (String f : config.additionalFields()) {
            fields.putIfAbsent(f, config.kindOf(f));
        }
        return new OutputSchema(StoreConfiguration.TYPE_FIELD, config.chunkFieldName(), config.vectorField(), fields);
    }

    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public boolean isChunkOrVector(String field) {
        return field.equals(typeField) || field.equals(contentField) || field.equals(vectorField);
    }
}

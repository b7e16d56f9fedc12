package org.learningjava.vecstore.domain.service.mapping;

import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.model.store.BackendRow;
import org.learningjava.vecstore.domain.model.store.Chunk;
import org.learningjava.vecstore.domain.model.store.FieldKind;
import org.learningjava.vecstore.domain.model.store.OutputSchema;
import org.learningjava.vecstore.domain.model.store.VectorMatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns backend result rows back into {@link VectorMatch}es.
 * <p>
 * Which fields come back depends on how the collection is indexed, so every requested
 * field is looked up explicitly and replaced by its kind's default when missing.
 * A missing score reads as 0.0.
 */
public class MatchBuilder {

    public VectorMatch fromBackendRow(BackendRow row, OutputSchema schema) {
        return fromBackendRow(row.id(), row.fields(), row.score(), schema);
    }

    public VectorMatch fromBackendRow(Object id, Map<String, Object> fields, Double score, OutputSchema schema) {
        Map<String, Object> source = fields == null ? Map.of() : fields;

        String type = (String) field(source, schema.typeField(), FieldKind.STRING);
        String content = (String) field(source, schema.contentField(), FieldKind.STRING);
        float[] embedding = (float[]) field(source, schema.vectorField(), FieldKind.FLOAT_VECTOR);

        Map<String, Object> metadata = new LinkedHashMap<>();
        schema.fields().forEach((name, kind) -> {
            if (!schema.isChunkOrVector(name)) {
                metadata.put(name, field(source, name, kind));
            }
        });

        return new VectorMatch(
                id == null ? "" : String.valueOf(id),
                embedding,
                new Chunk(type, content),
                score == null ? 0.0 : score,
                Collections.unmodifiableMap(metadata)
        );
    }

    private Object field(Map<String, Object> fields, String name, FieldKind kind) {
        Object raw = fields.get(name);
        if (raw == null) {
            return kind.defaultValue();
        }
        try {
            return coerce(raw, kind);
        } catch (RuntimeException e) {
            throw new ConversionException("Field '" + name + "' cannot be read as " + kind + ": " + raw, e);
        }
    }

    static Object coerce(Object raw, FieldKind kind) {
        switch (kind) {
            case STRING:
                return raw instanceof String s ? s : String.valueOf(raw);
            case FLOAT_VECTOR:
                return toFloatArray(raw);
            case NUMBER:
                if (raw instanceof Number n) return n;
                return Double.parseDouble(raw.toString().trim());
            case BOOLEAN:
                if (raw instanceof Boolean b) return b;
                String text = raw.toString().trim();
                if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) return Boolean.valueOf(text);
                throw new IllegalArgumentException("not a boolean");
            case ARRAY:
                return toList(raw);
            case JSON:
                if (raw instanceof Map<?, ?> m) return m;
                throw new IllegalArgumentException("not an object");
            default:
                throw new IllegalArgumentException("unknown kind " + kind);
        }
    }

    private static float[] toFloatArray(Object raw) {
        if (raw instanceof float[] f) return f.clone();
        List<Object> items = toList(raw);
        float[] out = new float[items.size()];
        for (int i = 0; i < out.length; i++) {
            Object x = items.get(i);
            if (!(x instanceof Number n)) {
                throw new IllegalArgumentException("non-numeric vector component: " + x);
            }
            out[i] = n.floatValue();
        }
        return out;
    }

    private static List<Object> toList(Object raw) {
        if (raw instanceof Collection<?> c) {
            return Collections.unmodifiableList(new ArrayList<>(c));
        }
        if (raw instanceof Object[] arr) {
            return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(arr)));
        }
        throw new IllegalArgumentException("not an array");
    }
}

package org.learningjava.vecstore.domain.service.mapping;

import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.model.TimestampUtil;
import org.learningjava.vecstore.domain.model.store.BackendRecord;
import org.learningjava.vecstore.domain.model.store.Chunk;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.learningjava.vecstore.domain.model.store.VectorEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a generic {@link VectorEntry} onto the backend write schema.
 * Pure: the caller performs the write.
 */
public class EntryMapper {

    public BackendRecord toBackendRecord(VectorEntry entry, StoreConfiguration config) {
        Object key = toBackendKey(entry.id(), config);

        if (entry.embedding() == null) {
            throw new ConversionException("Entry '" + entry.id() + "' has no embedding");
        }

        Map<String, Object> props = new LinkedHashMap<>();
        if (config.passThroughMetadata()) {
            entry.metadata().forEach((k, v) -> props.put(k, coerce(k, v)));
        }

        // chunk-derived fields win over same-named metadata
        Chunk chunk = entry.chunk();
        props.put(StoreConfiguration.TYPE_FIELD, orEmpty(chunk.type()));
        props.put(config.chunkFieldName(), orEmpty(chunk.content()));

        return new BackendRecord(key, entry.embedding(), props);
    }

    /**
     * Converts a caller id to the native primary key: a {@link Long} for {@code INT64}
     * collections, the string itself for {@code VARCHAR}.
     *
     * @throws ConversionException if the id cannot be converted
     */
    public Object toBackendKey(String id, StoreConfiguration config) {
        if (id == null) {
            throw new ConversionException("Entry id must not be null");
        }
        switch (config.keyType()) {
            case INT64:
                try {
                    return Long.parseLong(id);
                } catch (NumberFormatException e) {
                    throw new ConversionException("Cannot convert id '" + id + "' to an int64 primary key", e);
                }
            case VARCHAR:
                if (id.isBlank()) {
                    throw new ConversionException("Entry id must not be blank");
                }
                return id;
            default:
                throw new ConversionException("Unsupported key type: " + config.keyType());
        }
    }

    /**
     * Brings a metadata value into a JSON-shaped form: scalars pass through, timestamps become
     * ISO-8601 text at any depth, arrays and collections become lists, maps keep string keys.
     *
     * @throws ConversionException for any other value type
     */
    static Object coerce(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (TimestampUtil.isTimestamp(value)) return TimestampUtil.format(value);
        if (value instanceof Character c) return String.valueOf(c);
        if (value instanceof Enum<?> e) return e.name();
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            m.forEach((k, v) -> out.put(String.valueOf(k), coerce(key, v)));
            return out;
        }
        if (value instanceof Collection<?> c) {
            List<Object> out = new ArrayList<>(c.size());
            for (Object o : c) out.add(coerce(key, o));
            return out;
        }
        if (value instanceof Object[] a) {
            List<Object> out = new ArrayList<>(a.length);
            for (Object o : a) out.add(coerce(key, o));
            return out;
        }
        if (value instanceof float[] f) {
            List<Object> out = new ArrayList<>(f.length);
            for (float x : f) out.add(x);
            return out;
        }
        throw new ConversionException("Metadata '" + key + "' has unsupported value type " + value.getClass().getName());
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}

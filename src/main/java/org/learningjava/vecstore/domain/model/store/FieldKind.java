package org.learningjava.vecstore.domain.model.store;

import java.util.List;
import java.util.Map;

/**
 * Expected kind of a projected output field, with the value used when the backend
 * omits the field from a result row.
 */
public enum FieldKind {
    STRING,
    FLOAT_VECTOR,
    NUMBER,
    BOOLEAN,
    ARRAY,
    JSON;

    public Object defaultValue() {
        return switch (this) {
            case STRING -> "";
            case FLOAT_VECTOR -> new float[0];
            case NUMBER -> 0L;
            case BOOLEAN -> Boolean.FALSE;
            case ARRAY -> List.of();
            case JSON -> Map.of();
        };
    }
}

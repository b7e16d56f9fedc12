package org.learningjava.vecstore.domain.model.store;

import java.util.Map;

/**
 * One row as returned by the backend. {@code score} is null for filter-only lookups.
 */
public record BackendRow(
        Object id,
        Map<String, Object> fields,
        Double score
) {

    public BackendRow {
        fields = fields == null ? Map.of() : fields;
    }
}

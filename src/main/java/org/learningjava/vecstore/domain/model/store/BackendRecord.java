package org.learningjava.vecstore.domain.model.store;

import java.util.Map;

/**
 * Row in the backend write schema: primary key ({@link Long} or {@link String}),
 * vector field and flattened properties.
 */
public record BackendRecord(
        Object primaryKey,
        float[] vector,
        Map<String, Object> properties
) {
}

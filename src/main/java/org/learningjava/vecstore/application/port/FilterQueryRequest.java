package org.learningjava.vecstore.application.port;

import java.util.List;

// filter-only lookup, no ranking
public record FilterQueryRequest(
        String collection,
        String primaryKeyField,
        String filter,
        int limit,
        List<String> outputFields
) {
}

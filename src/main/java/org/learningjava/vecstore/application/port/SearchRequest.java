package org.learningjava.vecstore.application.port;

import java.util.List;

// ranked similarity search against one collection
public record SearchRequest(
        String collection,
        String primaryKeyField,
        String vectorField,
        float[] vector,
        String filter,
        int topK,
        List<String> outputFields
) {
}

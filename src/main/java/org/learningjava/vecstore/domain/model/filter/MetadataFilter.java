package org.learningjava.vecstore.domain.model.filter;

import org.learningjava.vecstore.domain.exception.ValidationException;

import java.util.Objects;
import java.util.regex.Pattern;

// Leaf comparison: key operator value
public record MetadataFilter(
        String key,
        FilterOperator operator,
        FilterValue value
) implements FilterNode {

    // field name, optionally with a JSON path such as meta["source"]
    private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\[\\]\"]*");

    public MetadataFilter {
        Objects.requireNonNull(key, "key");
        if (!KEY.matcher(key).matches()) {
            throw new ValidationException("Invalid filter key: " + key);
        }
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public MetadataFilter(String key, FilterOperator operator, Object value) {
        this(key, operator, FilterValue.of(value));
    }
}

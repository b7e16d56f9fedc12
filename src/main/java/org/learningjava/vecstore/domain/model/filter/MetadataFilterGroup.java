package org.learningjava.vecstore.domain.model.filter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Children joined by one condition. Nesting depth is unbounded; a group without children
 * means "no filter", not "match nothing".
 */
public record MetadataFilterGroup(
        FilterCondition condition,
        List<FilterNode> filters
) implements FilterNode {

    public MetadataFilterGroup {
        Objects.requireNonNull(condition, "condition");
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static MetadataFilterGroup and(FilterNode... filters) {
        return new MetadataFilterGroup(FilterCondition.AND, Arrays.asList(filters));
    }

    public static MetadataFilterGroup or(FilterNode... filters) {
        return new MetadataFilterGroup(FilterCondition.OR, Arrays.asList(filters));
    }
}

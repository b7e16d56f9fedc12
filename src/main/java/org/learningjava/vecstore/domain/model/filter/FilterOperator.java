package org.learningjava.vecstore.domain.model.filter;

/**
 * Comparison operators a {@link MetadataFilter} can use, each with the symbol the backend
 * filter grammar expects.
 */
public enum FilterOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    IN("in"),
    NOT_IN("not in"),
    LIKE("like");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Accepts either the enum name ({@code GREATER_THAN_OR_EQUAL}) or the symbol ({@code >=}),
     * case-insensitive.
     */
    public static FilterOperator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Filter operator must not be blank");
        }
        String s = raw.trim();
        for (FilterOperator op : values()) {
            if (op.name().equalsIgnoreCase(s) || op.symbol.equalsIgnoreCase(s)) return op;
        }
        throw new IllegalArgumentException("Unknown filter operator: " + raw);
    }
}

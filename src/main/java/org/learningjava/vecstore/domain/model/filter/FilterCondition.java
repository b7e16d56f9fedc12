package org.learningjava.vecstore.domain.model.filter;

import java.util.Locale;

public enum FilterCondition {
    AND,
    OR;

    public static FilterCondition parse(String raw) {
        if (raw == null || raw.isBlank()) return AND;
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

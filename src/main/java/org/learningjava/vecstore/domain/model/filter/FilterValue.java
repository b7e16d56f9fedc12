package org.learningjava.vecstore.domain.model.filter;

import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.model.TimestampUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Literal kinds legal on the right-hand side of a filter comparison.
 */
public sealed interface FilterValue
        permits FilterValue.Text, FilterValue.Numeric, FilterValue.Bool, FilterValue.Array {

    record Text(String value) implements FilterValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    record Numeric(Number value) implements FilterValue {
        public Numeric {
            Objects.requireNonNull(value, "value");
            if ((value instanceof Double d && !Double.isFinite(d))
                    || (value instanceof Float f && !Float.isFinite(f))) {
                throw new ConversionException("Non-finite number is not a valid filter value: " + value);
            }
        }
    }

    record Bool(boolean value) implements FilterValue {
    }

    record Array(List<FilterValue> elements) implements FilterValue {
        public Array {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    static FilterValue text(String value) {
        return new Text(value);
    }

    static FilterValue number(Number value) {
        return new Numeric(value);
    }

    static FilterValue bool(boolean value) {
        return new Bool(value);
    }

    static FilterValue array(Object... values) {
        List<FilterValue> out = new ArrayList<>(values.length);
        for (Object v : values) out.add(of(v));
        return new Array(out);
    }

    /**
     * Lifts a plain Java value (string, number, boolean, timestamp, collection or array of
     * those) into a filter literal.
     *
     * @throws ConversionException for null or any other type
     */
    static FilterValue of(Object raw) {
        if (raw == null) {
            throw new ConversionException("Filter value must not be null");
        }
        if (raw instanceof FilterValue v) return v;
        if (raw instanceof String s) return new Text(s);
        if (raw instanceof Character c) return new Text(String.valueOf(c));
        if (raw instanceof Number n) return new Numeric(n);
        if (raw instanceof Boolean b) return new Bool(b);
        if (TimestampUtil.isTimestamp(raw)) return new Text(TimestampUtil.format(raw));
        if (raw instanceof Collection<?> col) {
            List<FilterValue> out = new ArrayList<>(col.size());
            for (Object o : col) out.add(of(o));
            return new Array(out);
        }
        if (raw instanceof Object[] arr) {
            return of(Arrays.asList(arr));
        }
        throw new ConversionException("Unsupported filter value type: " + raw.getClass().getName());
    }
}

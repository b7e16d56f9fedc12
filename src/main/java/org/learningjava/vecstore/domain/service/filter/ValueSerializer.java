package org.learningjava.vecstore.domain.service.filter;

import org.learningjava.vecstore.domain.model.filter.FilterValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.StringJoiner;

/**
 * Renders a filter literal in the backend filter grammar: strings double-quoted,
 * arrays bracketed, numbers and booleans bare.
 */
public class ValueSerializer {

    public String serialize(FilterValue value) {
        if (value instanceof FilterValue.Text t) {
            return '"' + escape(t.value()) + '"';
        }
        if (value instanceof FilterValue.Array a) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (FilterValue element : a.elements()) {
                joiner.add(serialize(element));
            }
            return joiner.toString();
        }
        if (value instanceof FilterValue.Numeric n) {
            return number(n.value());
        }
        if (value instanceof FilterValue.Bool b) {
            return Boolean.toString(b.value());
        }
        throw new IllegalArgumentException("Filter value must not be null");
    }

    // a quote inside the literal would otherwise end it and open the filter to injection
    static String escape(String s) {
        if (s.indexOf('"') < 0 && s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    static String number(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger) {
            return n.toString();
        }
        if (n instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        if (n instanceof Float f) {
            return new BigDecimal(Float.toString(f)).stripTrailingZeros().toPlainString();
        }
        double d = n.doubleValue();
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}

package org.learningjava.vecstore.domain.service.filter;

import org.learningjava.vecstore.domain.model.filter.FilterNode;
import org.learningjava.vecstore.domain.model.filter.MetadataFilter;
import org.learningjava.vecstore.domain.model.filter.MetadataFilterGroup;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a metadata filter tree into one backend filter expression.
 * <p>
 * The backend grammar has no precedence table of its own, so grouping is carried entirely
 * by parentheses: every group with two or more non-empty children is wrapped exactly once,
 * a group with one child is returned as that child, and empty groups vanish.
 */
public class FilterCompiler {

    private final ValueSerializer values;

    public FilterCompiler() {
        this(new ValueSerializer());
    }

    public FilterCompiler(ValueSerializer values) {
        this.values = values;
    }

    /**
     * @return the filter expression, or an empty string meaning "no filter"
     */
    public String compile(FilterNode node) {
        if (node == null) {
            return "";
        }
        if (node instanceof MetadataFilter leaf) {
            return " " + leaf.key() + " " + leaf.operator().symbol() + " " + values.serialize(leaf.value()) + " ";
        }
        MetadataFilterGroup group = (MetadataFilterGroup) node;

        List<String> parts = new ArrayList<>(group.filters().size());
        for (FilterNode child : group.filters()) {
            String compiled = compile(child);
            if (!compiled.isEmpty()) parts.add(compiled);
        }
        if (parts.isEmpty()) return "";
        if (parts.size() == 1) return parts.get(0);

        return "( " + String.join("  " + group.condition().name() + " ", parts) + ")";
    }
}

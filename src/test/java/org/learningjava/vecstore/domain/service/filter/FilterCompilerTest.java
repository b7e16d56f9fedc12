package org.learningjava.vecstore.domain.service.filter;

import org.junit.jupiter.api.Test;
import org.learningjava.vecstore.domain.model.filter.FilterCondition;
import org.learningjava.vecstore.domain.model.filter.FilterOperator;
import org.learningjava.vecstore.domain.model.filter.MetadataFilter;
import org.learningjava.vecstore.domain.model.filter.MetadataFilterGroup;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.vecstore.domain.model.filter.FilterOperator.*;

class FilterCompilerTest {

    private final FilterCompiler compiler = new FilterCompiler();

    private static MetadataFilter eq(String key, Object value) {
        return new MetadataFilter(key, EQUAL, value);
    }

    @Test
    void leaf_renders_key_symbol_and_literal() {
        assertEquals(" age >= 18 ", compiler.compile(new MetadataFilter("age", GREATER_THAN_OR_EQUAL, 18)));
        assertEquals(" tag in [\"x\", \"y\"] ", compiler.compile(new MetadataFilter("tag", IN, List.of("x", "y"))));
        assertEquals(" tag not in [1] ", compiler.compile(new MetadataFilter("tag", NOT_IN, List.of(1))));
        assertEquals(" name != \"bob\" ", compiler.compile(new MetadataFilter("name", NOT_EQUAL, "bob")));
    }

    @Test
    void and_of_two_leaves_matches_documented_form() {
        var group = new MetadataFilterGroup(FilterCondition.AND, List.of(
                eq("fileName", "test.txt"),
                eq("createdAt", "2024-05-01T10:15:30Z")
        ));

        assertEquals("(  fileName == \"test.txt\"   AND  createdAt == \"2024-05-01T10:15:30Z\" )",
                compiler.compile(group));
    }

    @Test
    void empty_group_compiles_to_empty_string() {
        assertEquals("", compiler.compile(MetadataFilterGroup.and()));
        assertEquals("", compiler.compile(MetadataFilterGroup.or(MetadataFilterGroup.and(), MetadataFilterGroup.or())));
        assertEquals("", compiler.compile(null));
    }

    @Test
    void single_child_is_returned_without_parentheses() {
        var leaf = eq("a", 1);
        assertEquals(compiler.compile(leaf), compiler.compile(MetadataFilterGroup.and(leaf)));
        assertEquals(compiler.compile(leaf), compiler.compile(MetadataFilterGroup.or(MetadataFilterGroup.and(MetadataFilterGroup.or(leaf)))));
    }

    @Test
    void empty_sibling_does_not_change_the_other_children() {
        var a = eq("a", 1);
        var b = eq("b", 2);

        assertEquals(compiler.compile(a), compiler.compile(MetadataFilterGroup.and(a, MetadataFilterGroup.or())));
        assertEquals(compiler.compile(MetadataFilterGroup.and(a, b)),
                compiler.compile(MetadataFilterGroup.and(a, MetadataFilterGroup.and(), b)));
    }

    @Test
    void two_or_more_children_get_exactly_one_pair_of_parentheses() {
        String out = compiler.compile(MetadataFilterGroup.or(eq("a", 1), eq("b", 2), eq("c", 3)));

        assertEquals("(  a == 1   OR  b == 2   OR  c == 3 )", out);
        assertEquals(1, out.chars().filter(ch -> ch == '(').count());
        assertEquals(1, out.chars().filter(ch -> ch == ')').count());
    }

    @Test
    void or_of_ands_keeps_written_grouping() {
        var tree = MetadataFilterGroup.or(
                MetadataFilterGroup.and(eq("a", 1), eq("b", 2)),
                MetadataFilterGroup.and(eq("c", 3), eq("d", 4))
        );

        assertEquals("( (  a == 1   AND  b == 2 )  OR (  c == 3   AND  d == 4 ))", compiler.compile(tree));
    }

    @Test
    void every_operator_uses_the_same_two_sided_template() {
        for (FilterOperator op : FilterOperator.values()) {
            assertEquals(" k " + op.symbol() + " 1 ", compiler.compile(new MetadataFilter("k", op, 1)));
        }
    }
}

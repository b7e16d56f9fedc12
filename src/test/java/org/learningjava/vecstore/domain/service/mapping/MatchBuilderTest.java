package org.learningjava.vecstore.domain.service.mapping;

import org.junit.jupiter.api.Test;
import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.model.store.BackendRow;
import org.learningjava.vecstore.domain.model.store.FieldKind;
import org.learningjava.vecstore.domain.model.store.OutputSchema;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.learningjava.vecstore.domain.model.store.VectorMatch;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MatchBuilderTest {

    private final MatchBuilder builder = new MatchBuilder();

    private final OutputSchema schema = StoreConfiguration.builder("docs")
            .additionalFields(List.of("fileName", "pages", "tags", "draft", "extra"))
            .fieldKind("pages", FieldKind.NUMBER)
            .fieldKind("tags", FieldKind.ARRAY)
            .fieldKind("draft", FieldKind.BOOLEAN)
            .fieldKind("extra", FieldKind.JSON)
            .build()
            .outputSchema();

    @Test
    void missing_fields_get_their_kind_default() {
        VectorMatch m = builder.fromBackendRow(7L, Map.of(), null, schema);

        assertEquals("7", m.id());
        assertEquals("", m.chunk().type());
        assertEquals("", m.chunk().content());
        assertEquals(0, m.embedding().length);
        assertEquals(0.0, m.similarityScore());
        assertEquals("", m.metadata().get("fileName"));
        assertEquals(0L, m.metadata().get("pages"));
        assertEquals(List.of(), m.metadata().get("tags"));
        assertEquals(false, m.metadata().get("draft"));
        assertEquals(Map.of(), m.metadata().get("extra"));
    }

    @Test
    void present_fields_are_coerced_to_their_kind() {
        Map<String, Object> fields = Map.of(
                "type", "text",
                "content", "hello",
                "vector", List.of(0.5, 0.25),
                "fileName", 99,
                "pages", "12",
                "tags", List.of("a"),
                "draft", "true",
                "extra", Map.of("k", "v")
        );

        VectorMatch m = builder.fromBackendRow("abc", fields, 0.87, schema);

        assertEquals("abc", m.id());
        assertEquals("text", m.chunk().type());
        assertEquals("hello", m.chunk().content());
        assertArrayEquals(new float[]{0.5f, 0.25f}, m.embedding());
        assertEquals(0.87, m.similarityScore());
        assertEquals("99", m.metadata().get("fileName"));
        assertEquals(12.0, m.metadata().get("pages"));
        assertEquals(List.of("a"), m.metadata().get("tags"));
        assertEquals(true, m.metadata().get("draft"));
        assertEquals(Map.of("k", "v"), m.metadata().get("extra"));
    }

    @Test
    void metadata_only_holds_additional_fields() {
        VectorMatch m = builder.fromBackendRow(new BackendRow(1, Map.of("content", "c", "unrequested", "x"), 1.5), schema);

        assertFalse(m.metadata().containsKey("content"));
        assertFalse(m.metadata().containsKey("vector"));
        assertFalse(m.metadata().containsKey("unrequested"));
        assertEquals(List.of("fileName", "pages", "tags", "draft", "extra"), List.copyOf(m.metadata().keySet()));
        assertEquals(1.5, m.similarityScore());
    }

    @Test
    void score_is_passed_through_verbatim() {
        assertEquals(-3.25, builder.fromBackendRow(1, Map.of(), -3.25, schema).similarityScore());
        assertEquals(1234.5, builder.fromBackendRow(1, Map.of(), 1234.5, schema).similarityScore());
    }

    @Test
    void malformed_present_value_is_a_conversion_error() {
        assertThrows(ConversionException.class,
                () -> builder.fromBackendRow(1, Map.of("vector", "not a vector"), null, schema));
        assertThrows(ConversionException.class,
                () -> builder.fromBackendRow(1, Map.of("vector", List.of("x")), null, schema));
    }

    @Test
    void arrays_are_read_from_lists_object_arrays_and_float_vectors() {
        VectorMatch m = builder.fromBackendRow(1, Map.of(
                "vector", new float[]{0.5f},
                "tags", new String[]{"a", "b"}), null, schema);

        assertArrayEquals(new float[]{0.5f}, m.embedding());
        assertEquals(List.of("a", "b"), m.metadata().get("tags"));
        assertThrows(ConversionException.class,
                () -> builder.fromBackendRow(1, Map.of("tags", new int[]{1, 2}), null, schema));
    }
}

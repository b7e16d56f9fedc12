package org.learningjava.vecstore.domain.service.mapping;

import org.junit.jupiter.api.Test;
import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.model.store.BackendRecord;
import org.learningjava.vecstore.domain.model.store.Chunk;
import org.learningjava.vecstore.domain.model.store.KeyType;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.learningjava.vecstore.domain.model.store.VectorEntry;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntryMapperTest {

    private final EntryMapper mapper = new EntryMapper();
    private final StoreConfiguration config = StoreConfiguration.builder("docs").build();

    @Test
    void maps_numeric_id_vector_and_chunk() {
        var entry = new VectorEntry("42", new float[]{0.1f, 0.2f}, new Chunk("text", "hello"));

        BackendRecord rec = mapper.toBackendRecord(entry, config);

        assertEquals(42L, rec.primaryKey());
        assertArrayEquals(new float[]{0.1f, 0.2f}, rec.vector());
        assertEquals(Map.of("type", "text", "content", "hello"), rec.properties());
    }

    @Test
    void non_numeric_id_is_a_conversion_error_for_int64_keys() {
        var entry = new VectorEntry("abc", new float[]{1f}, new Chunk("text", "x"));

        ConversionException ex = assertThrows(ConversionException.class, () -> mapper.toBackendRecord(entry, config));
        assertTrue(ex.getMessage().contains("abc"));
        assertInstanceOf(NumberFormatException.class, ex.getCause());
    }

    @Test
    void varchar_keys_pass_through() {
        var varchar = StoreConfiguration.builder("docs").keyType(KeyType.VARCHAR).build();

        assertEquals("abc", mapper.toBackendKey("abc", varchar));
        assertThrows(ConversionException.class, () -> mapper.toBackendKey(" ", varchar));
        assertThrows(ConversionException.class, () -> mapper.toBackendKey(null, varchar));
    }

    @Test
    void metadata_passes_through_with_timestamps_as_iso_text() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fileName", "test.txt");
        metadata.put("createdAt", Instant.parse("2024-05-01T10:15:30Z"));
        metadata.put("updatedAt", OffsetDateTime.of(2024, 5, 2, 8, 0, 0, 0, ZoneOffset.ofHours(2)));
        metadata.put("day", LocalDate.of(2024, 5, 3));
        metadata.put("pages", 12);
        metadata.put("tags", List.of("a", "b"));

        var entry = new VectorEntry("1", new float[]{1f}, new Chunk("text", "body"), metadata);
        Map<String, Object> props = mapper.toBackendRecord(entry, config).properties();

        assertEquals("test.txt", props.get("fileName"));
        assertEquals("2024-05-01T10:15:30Z", props.get("createdAt"));
        assertEquals("2024-05-02T08:00:00+02:00", props.get("updatedAt"));
        assertEquals("2024-05-03", props.get("day"));
        assertEquals(12, props.get("pages"));
        assertEquals(List.of("a", "b"), props.get("tags"));
    }

    @Test
    void nested_timestamps_are_converted_at_any_depth() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reviewedAt", List.of(Instant.parse("2024-05-01T10:15:30Z")));
        metadata.put("audit", Map.of("on", LocalDate.of(2024, 5, 3), "by", List.of("ann")));
        metadata.put("scores", new Object[]{1, Instant.parse("2024-01-01T00:00:00Z")});

        var entry = new VectorEntry("1", new float[]{1f}, new Chunk("text", "body"), metadata);
        Map<String, Object> props = mapper.toBackendRecord(entry, config).properties();

        assertEquals(List.of("2024-05-01T10:15:30Z"), props.get("reviewedAt"));
        assertEquals(Map.of("on", "2024-05-03", "by", List.of("ann")), props.get("audit"));
        assertEquals(List.of(1, "2024-01-01T00:00:00Z"), props.get("scores"));
    }

    @Test
    void unsupported_metadata_value_is_a_conversion_error() {
        var entry = new VectorEntry("1", new float[]{1f}, new Chunk("text", "body"),
                Map.of("owner", List.of(new Object())));

        ConversionException ex = assertThrows(ConversionException.class, () -> mapper.toBackendRecord(entry, config));
        assertTrue(ex.getMessage().contains("owner"));
    }

    @Test
    void chunk_fields_override_same_named_metadata() {
        var cfg = StoreConfiguration.builder("docs").chunkFieldName("text").build();
        var entry = new VectorEntry("1", new float[]{1f}, new Chunk("pdf", "from chunk"),
                Map.of("type", "from metadata", "text", "also metadata"));

        Map<String, Object> props = mapper.toBackendRecord(entry, cfg).properties();

        assertEquals("pdf", props.get("type"));
        assertEquals("from chunk", props.get("text"));
    }

    @Test
    void metadata_is_dropped_when_pass_through_is_off() {
        var cfg = StoreConfiguration.builder("docs").passThroughMetadata(false).build();
        var entry = new VectorEntry("1", new float[]{1f}, new Chunk(null, null), Map.of("fileName", "a.txt"));

        assertEquals(Map.of("type", "", "content", ""), mapper.toBackendRecord(entry, cfg).properties());
    }

    @Test
    void missing_embedding_is_a_conversion_error() {
        var entry = new VectorEntry("1", null, new Chunk("text", "x"));
        assertThrows(ConversionException.class, () -> mapper.toBackendRecord(entry, config));
    }
}

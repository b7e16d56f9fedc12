package org.learningjava.vecstore.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.vecstore.application.port.VectorStorePort;
import org.learningjava.vecstore.domain.model.filter.FilterCondition;
import org.learningjava.vecstore.domain.model.filter.FilterNode;
import org.learningjava.vecstore.domain.model.filter.FilterOperator;
import org.learningjava.vecstore.domain.model.filter.MetadataFilter;
import org.learningjava.vecstore.domain.model.filter.MetadataFilterGroup;
import org.learningjava.vecstore.domain.model.store.Chunk;
import org.learningjava.vecstore.domain.model.store.VectorEntry;
import org.learningjava.vecstore.domain.model.store.VectorMatch;
import org.learningjava.vecstore.domain.model.store.VectorStoreQuery;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/vectors")
public class VectorStoreController {

    private final VectorStorePort store;

    public VectorStoreController(VectorStorePort store) {
        this.store = store;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void add(@Valid @RequestBody AddRequest req) {
        List<VectorEntry> entries = req.entries() == null ? List.of()
                : req.entries().stream().map(EntryDTO::toEntry).toList();
        store.add(entries);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        store.delete(id);
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAll(@RequestBody DeleteRequest req) {
        store.delete(req.ids() == null ? List.of() : req.ids());
    }

    @PostMapping("/query")
    public List<MatchDTO> query(@RequestBody QueryRequest req) {
        // a missing topK is resolved by the store from its own configuration
        MetadataFilterGroup filters = req.filters() == null ? null : req.filters().toGroup();

        List<VectorMatch> matches = store.query(new VectorStoreQuery(req.embedding(), req.topK(), filters));
        return matches.stream().map(MatchDTO::from).toList();
    }

    // ---------- DTOs ----------
    public record AddRequest(List<@Valid EntryDTO> entries) {
    }

    public record EntryDTO(
            @NotBlank String id,
            float[] embedding,
            String type,
            String content,
            Map<String, Object> metadata
    ) {
        VectorEntry toEntry() {
            return new VectorEntry(id, embedding, new Chunk(type, content), metadata);
        }
    }

    public record DeleteRequest(List<String> ids) {
    }

    public record QueryRequest(float[] embedding, Integer topK, FilterDTO filters) {
    }

    /**
     * Either a leaf ({@code key}, {@code operator}, {@code value}) or a group
     * ({@code condition}, {@code filters}); a node with a key is read as a leaf.
     */
    public record FilterDTO(
            String key,
            String operator,
            Object value,
            String condition,
            List<FilterDTO> filters
    ) {
        FilterNode toNode() {
            if (key != null) {
                return new MetadataFilter(key, FilterOperator.parse(operator), value);
            }
            return toGroup();
        }

        MetadataFilterGroup toGroup() {
            if (key != null) {
                return MetadataFilterGroup.and(toNode());
            }
            List<FilterNode> children = new ArrayList<>();
            if (filters != null) {
                for (FilterDTO f : filters) children.add(f.toNode());
            }
            return new MetadataFilterGroup(FilterCondition.parse(condition), children);
        }
    }

    public record MatchDTO(
            String id,
            float[] embedding,
            String type,
            String content,
            double score,
            Map<String, Object> metadata
    ) {
        static MatchDTO from(VectorMatch m) {
            return new MatchDTO(
                    m.id(),
                    m.embedding(),
                    m.chunk().type(),
                    m.chunk().content(),
                    m.similarityScore(),
                    m.metadata()
            );
        }
    }
}

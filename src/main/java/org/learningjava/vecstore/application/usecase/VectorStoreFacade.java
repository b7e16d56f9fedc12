package org.learningjava.vecstore.application.usecase;

import org.learningjava.vecstore.application.port.FilterQueryRequest;
import org.learningjava.vecstore.application.port.SearchRequest;
import org.learningjava.vecstore.application.port.VectorDbClientPort;
import org.learningjava.vecstore.application.port.VectorStorePort;
import org.learningjava.vecstore.domain.exception.BackendException;
import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.exception.ValidationException;
import org.learningjava.vecstore.domain.model.store.BackendRecord;
import org.learningjava.vecstore.domain.model.store.BackendRow;
import org.learningjava.vecstore.domain.model.store.OutputSchema;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.learningjava.vecstore.domain.model.store.VectorEntry;
import org.learningjava.vecstore.domain.model.store.VectorMatch;
import org.learningjava.vecstore.domain.model.store.VectorStoreQuery;
import org.learningjava.vecstore.domain.service.filter.FilterCompiler;
import org.learningjava.vecstore.domain.service.mapping.EntryMapper;
import org.learningjava.vecstore.domain.service.mapping.MatchBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Vector store backed by a schema-specific database client.
 * <p>
 * Each public operation runs as one synchronous unit under a per-instance lock; concurrent
 * callers wait instead of interleaving. Batches are written one entry at a time and the
 * first failure aborts the rest. Entries already written stay written.
 */
public class VectorStoreFacade implements VectorStorePort {
    private static final Logger log = LoggerFactory.getLogger(VectorStoreFacade.class);

    static final String ADD_FAILED = "failed to add vector entries";
    static final String DELETE_FAILED = "failed to delete vector entries";
    static final String QUERY_FAILED = "failed to query vector entries";

    private final VectorDbClientPort client;
    private final StoreConfiguration config;
    private final OutputSchema schema;
    private final EntryMapper entryMapper;
    private final MatchBuilder matchBuilder;
    private final FilterCompiler filterCompiler;
    private final ReentrantLock lock = new ReentrantLock();

    public VectorStoreFacade(VectorDbClientPort client, StoreConfiguration config) {
        this(client, config, new EntryMapper(), new MatchBuilder(), new FilterCompiler());
    }

    public VectorStoreFacade(VectorDbClientPort client,
                             StoreConfiguration config,
                             EntryMapper entryMapper,
                             MatchBuilder matchBuilder,
                             FilterCompiler filterCompiler) {
        this.client = client;
        this.config = config;
        this.schema = config.outputSchema();
        this.entryMapper = entryMapper;
        this.matchBuilder = matchBuilder;
        this.filterCompiler = filterCompiler;
    }

    public StoreConfiguration configuration() {
        return config;
    }

    @Override
    public void add(List<VectorEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            log.debug("No vector entries to add for '{}'", config.collectionName());
            return;
        }
        lock.lock();
        try {
            int written = 0;
            for (VectorEntry entry : entries) {
                BackendRecord record;
                try {
                    record = entryMapper.toBackendRecord(entry, config);
                } catch (ConversionException e) {
                    throw new ConversionException(ADD_FAILED + ": " + e.getMessage(), e);
                }
                try {
                    client.upsert(config.collectionName(), config.primaryKeyField(), config.vectorField(), record);
                } catch (RuntimeException e) {
                    log.warn("Upsert of entry '{}' into '{}' failed after {} of {} entries: {}",
                            entry.id(), config.collectionName(), written, entries.size(), e.toString());
                    throw new BackendException(ADD_FAILED, e);
                }
                written++;
            }
            log.debug("Added {} vector entries to '{}'", written, config.collectionName());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String id) {
        delete(Collections.singletonList(id));
    }

    @Override
    public void delete(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (String id : ids) {
                Object key;
                try {
                    key = entryMapper.toBackendKey(id, config);
                } catch (ConversionException e) {
                    throw new ConversionException(DELETE_FAILED + ": " + e.getMessage(), e);
                }
                try {
                    client.delete(config.collectionName(), config.primaryKeyField(), key);
                } catch (RuntimeException e) {
                    log.warn("Delete of '{}' from '{}' failed: {}", id, config.collectionName(), e.toString());
                    throw new BackendException(DELETE_FAILED, e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<VectorMatch> query(VectorStoreQuery query) {
        if (query == null) {
            throw new ValidationException("query must not be null");
        }
        int topK = query.topK() != null ? query.topK() : config.topK();
        if (topK <= 0) {
            throw new ValidationException("topK must be positive, got " + topK);
        }
        if (!query.hasEmbedding() && !query.hasFilters()) {
            throw new ValidationException("empty embedding or filters not allowed simultaneously");
        }

        lock.lock();
        try {
            String filter = filterCompiler.compile(query.filters());
            if (log.isDebugEnabled()) {
                log.debug("Querying '{}' topK={} embedding={} filter='{}'",
                        config.collectionName(), topK, query.hasEmbedding(), filter);
            }

            List<BackendRow> rows;
            try {
                client.loadCollection(config.collectionName());
                rows = query.hasEmbedding()
                        ? client.search(new SearchRequest(config.collectionName(), config.primaryKeyField(),
                                config.vectorField(), query.embedding(), filter, topK, schema.fieldNames()))
                        : client.query(new FilterQueryRequest(config.collectionName(), config.primaryKeyField(),
                                filter, topK, schema.fieldNames()));
            } catch (RuntimeException e) {
                log.warn("Query against '{}' failed: {}", config.collectionName(), e.toString());
                throw new BackendException(QUERY_FAILED, e);
            }

            if (rows == null) {
                return List.of();
            }
            List<VectorMatch> out = new ArrayList<>(rows.size());
            for (BackendRow row : rows) {
                try {
                    out.add(matchBuilder.fromBackendRow(row, schema));
                } catch (ConversionException e) {
                    // the backend returned the bad value, not the caller
                    log.warn("Unreadable row {} from '{}': {}", row.id(), config.collectionName(), e.getMessage());
                    throw new BackendException(QUERY_FAILED, e);
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }
}

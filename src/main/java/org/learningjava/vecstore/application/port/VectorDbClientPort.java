package org.learningjava.vecstore.application.port;

import org.learningjava.vecstore.domain.model.store.BackendRecord;
import org.learningjava.vecstore.domain.model.store.BackendRow;

import java.util.List;

/**
 * Backend vector database client. Implementations own transport, auth and timeouts
 * and report failures as unchecked exceptions.
 */
public interface VectorDbClientPort {

    // idempotent
    void loadCollection(String collection);

    void upsert(String collection, String primaryKeyField, String vectorField, BackendRecord record);

    void delete(String collection, String primaryKeyField, Object key);

    /**
     * Ranked similarity search; rows carry the backend score.
     */
    List<BackendRow> search(SearchRequest request);

    /**
     * Filter-only lookup without ranking; rows carry no score.
     */
    List<BackendRow> query(FilterQueryRequest request);
}

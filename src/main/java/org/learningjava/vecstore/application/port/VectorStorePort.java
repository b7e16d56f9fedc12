package org.learningjava.vecstore.application.port;

import org.learningjava.vecstore.domain.model.store.VectorEntry;
import org.learningjava.vecstore.domain.model.store.VectorMatch;
import org.learningjava.vecstore.domain.model.store.VectorStoreQuery;

import java.util.List;

/**
 * Generic vector store: add, delete and query embedding + payload records.
 */
public interface VectorStorePort {

    void add(List<VectorEntry> entries);

    void delete(String id);

    void delete(List<String> ids);

    List<VectorMatch> query(VectorStoreQuery query);
}

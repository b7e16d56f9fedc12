package org.learningjava.vecstore.infrastructure.adapter.out.milvus;

import org.junit.jupiter.api.Test;
import org.learningjava.vecstore.application.usecase.VectorStoreFacade;
import org.learningjava.vecstore.domain.exception.InitializationException;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MilvusVectorStoreFactoryTest {

    private final StoreConfiguration config = StoreConfiguration.builder("docs").build();

    @Test
    void creates_store_for_valid_settings() {
        var opts = new TransportOptions(Duration.ofSeconds(2), Duration.ofSeconds(5), Duration.ofSeconds(5), "default");

        VectorStoreFacade store = MilvusVectorStoreFactory.create("http://localhost:19530", "tok", config, opts);

        assertSame(config, store.configuration());
    }

    @Test
    void transport_options_are_optional() {
        assertNotNull(MilvusVectorStoreFactory.create("http://localhost:19530", null, config, null));
    }

    @Test
    void rejects_missing_or_invalid_url() {
        assertThrows(InitializationException.class, () -> MilvusVectorStoreFactory.create(" ", null, config, null));
        assertThrows(InitializationException.class, () -> MilvusVectorStoreFactory.create(null, null, config, null));
        assertThrows(InitializationException.class,
                () -> MilvusVectorStoreFactory.create("not a url", null, config, null));
    }

    @Test
    void rejects_missing_configuration_and_bad_timeouts() {
        assertThrows(InitializationException.class,
                () -> MilvusVectorStoreFactory.create("http://localhost:19530", null, null, null));
        var negative = new TransportOptions(Duration.ofSeconds(-1), null, null, null);
        assertThrows(InitializationException.class,
                () -> MilvusVectorStoreFactory.create("http://localhost:19530", null, config, negative));
    }
}

package org.learningjava.vecstore.config;

import org.learningjava.vecstore.application.port.VectorStorePort;
import org.learningjava.vecstore.domain.exception.InitializationException;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.learningjava.vecstore.infrastructure.adapter.out.milvus.MilvusVectorStoreFactory;
import org.learningjava.vecstore.infrastructure.adapter.out.milvus.TransportOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    //objects with external dependencies
    @Bean
    VectorStorePort vectorStore(VecStoreProperties props) {
        StoreConfiguration config;
        try {
            config = props.toStoreConfiguration();
        } catch (IllegalArgumentException e) {
            throw new InitializationException("Invalid vecstore configuration: " + e.getMessage(), e);
        }
        TransportOptions transport = new TransportOptions(
                props.getConnectTimeout(),
                props.getReadTimeout(),
                props.getWriteTimeout(),
                props.getDatabase()
        );
        return MilvusVectorStoreFactory.create(props.getUrl(), props.getApiKey(), config, transport);
    }
}

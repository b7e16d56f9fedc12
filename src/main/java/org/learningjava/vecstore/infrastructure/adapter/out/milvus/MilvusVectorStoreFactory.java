package org.learningjava.vecstore.infrastructure.adapter.out.milvus;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.learningjava.vecstore.application.usecase.VectorStoreFacade;
import org.learningjava.vecstore.domain.exception.InitializationException;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a Milvus-backed vector store: validates the connection settings, builds the
 * HTTP client and wires it into a {@link VectorStoreFacade}.
 */
public final class MilvusVectorStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(MilvusVectorStoreFactory.class);

    private MilvusVectorStoreFactory() {
    }

    /**
     * @throws InitializationException if the url or configuration is unusable
     */
    public static VectorStoreFacade create(String serviceUrl,
                                           String apiKey,
                                           StoreConfiguration config,
                                           TransportOptions transport) {
        if (serviceUrl == null || serviceUrl.isBlank()) {
            throw new InitializationException("Milvus service url is required");
        }
        if (HttpUrl.parse(serviceUrl.trim()) == null) {
            throw new InitializationException("Invalid Milvus service url: " + serviceUrl);
        }
        if (config == null) {
            throw new InitializationException("Store configuration is required");
        }
        TransportOptions opts = transport != null ? transport : TransportOptions.defaults();

        OkHttpClient http;
        try {
            OkHttpClient.Builder b = new OkHttpClient.Builder();
            if (opts.connectTimeout() != null) b.connectTimeout(opts.connectTimeout());
            if (opts.readTimeout() != null) b.readTimeout(opts.readTimeout());
            if (opts.writeTimeout() != null) b.writeTimeout(opts.writeTimeout());
            http = b.build();
        } catch (IllegalArgumentException e) {
            throw new InitializationException("Invalid Milvus transport options: " + e.getMessage(), e);
        }

        var client = new MilvusRestClientAdapter(http, serviceUrl.trim(), apiKey, opts.database());
        log.info("Milvus vector store ready: url={}, collection={}, keyType={}, auth={}",
                serviceUrl.trim(), config.collectionName(), config.keyType(),
                apiKey != null && !apiKey.isBlank() ? "configured" : "none");
        return new VectorStoreFacade(client, config);
    }
}

package org.learningjava.vecstore.infrastructure.adapter.out.milvus;

import java.time.Duration;

/**
 * HTTP transport settings for the Milvus client. Null durations fall back to OkHttp defaults.
 */
public record TransportOptions(
        Duration connectTimeout,
        Duration readTimeout,
        Duration writeTimeout,
        String database
) {

    public static TransportOptions defaults() {
        return new TransportOptions(null, null, null, null);
    }
}

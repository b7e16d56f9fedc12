package org.learningjava.vecstore.config;

import org.learningjava.vecstore.domain.model.store.FieldKind;
import org.learningjava.vecstore.domain.model.store.KeyType;
import org.learningjava.vecstore.domain.model.store.StoreConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "vecstore")
public class VecStoreProperties {
    // connection
    private String url = "http://localhost:19530";
    private String apiKey = "";
    private String database = "";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
    private Duration writeTimeout = Duration.ofSeconds(30);

    // collection schema
    private String collectionName;
    private String primaryKeyField = StoreConfiguration.DEFAULT_PRIMARY_KEY_FIELD;
    private KeyType keyType = KeyType.INT64;
    private String vectorField = StoreConfiguration.DEFAULT_VECTOR_FIELD;
    private String chunkFieldName = StoreConfiguration.DEFAULT_CHUNK_FIELD;
    private List<String> additionalFields = new ArrayList<>();
    private Map<String, FieldKind> fieldKinds = new LinkedHashMap<>();
    private int topK = StoreConfiguration.DEFAULT_TOP_K;
    private boolean passThroughMetadata = true;

    public StoreConfiguration toStoreConfiguration() {
        return StoreConfiguration.builder(collectionName)
                .primaryKeyField(primaryKeyField)
                .keyType(keyType)
                .vectorField(vectorField)
                .chunkFieldName(chunkFieldName)
                .additionalFields(additionalFields)
                .fieldKinds(fieldKinds)
                .topK(topK)
                .passThroughMetadata(passThroughMetadata)
                .build();
    }

    public String getUrl() { return url; }
    public void setUrl(String v) { this.url = v; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String v) { this.apiKey = v; }
    public String getDatabase() { return database; }
    public void setDatabase(String v) { this.database = v; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration v) { this.connectTimeout = v; }
    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration v) { this.readTimeout = v; }
    public Duration getWriteTimeout() { return writeTimeout; }
    public void setWriteTimeout(Duration v) { this.writeTimeout = v; }
    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String v) { this.collectionName = v; }
    public String getPrimaryKeyField() { return primaryKeyField; }
    public void setPrimaryKeyField(String v) { this.primaryKeyField = v; }
    public KeyType getKeyType() { return keyType; }
    public void setKeyType(KeyType v) { this.keyType = v; }
    public String getVectorField() { return vectorField; }
    public void setVectorField(String v) { this.vectorField = v; }
    public String getChunkFieldName() { return chunkFieldName; }
    public void setChunkFieldName(String v) { this.chunkFieldName = v; }
    public List<String> getAdditionalFields() { return additionalFields; }
    public void setAdditionalFields(List<String> v) { this.additionalFields = v; }
    public Map<String, FieldKind> getFieldKinds() { return fieldKinds; }
    public void setFieldKinds(Map<String, FieldKind> v) { this.fieldKinds = v; }
    public int getTopK() { return topK; }
    public void setTopK(int v) { this.topK = v; }
    public boolean isPassThroughMetadata() { return passThroughMetadata; }
    public void setPassThroughMetadata(boolean v) { this.passThroughMetadata = v; }
}

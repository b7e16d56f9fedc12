package org.learningjava.vecstore.infrastructure.adapter.out.milvus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.vecstore.application.port.FilterQueryRequest;
import org.learningjava.vecstore.application.port.SearchRequest;
import org.learningjava.vecstore.application.port.VectorDbClientPort;
import org.learningjava.vecstore.domain.model.filter.FilterValue;
import org.learningjava.vecstore.domain.model.store.BackendRecord;
import org.learningjava.vecstore.domain.model.store.BackendRow;
import org.learningjava.vecstore.domain.service.filter.ValueSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorDbClientPort} over the Milvus RESTful API (v2).
 */
public class MilvusRestClientAdapter implements VectorDbClientPort {

    private static final Logger log = LoggerFactory.getLogger(MilvusRestClientAdapter.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    static final String LOAD_PATH = "/v2/vectordb/collections/load";
    static final String UPSERT_PATH = "/v2/vectordb/entities/upsert";
    static final String DELETE_PATH = "/v2/vectordb/entities/delete";
    static final String SEARCH_PATH = "/v2/vectordb/entities/search";
    static final String QUERY_PATH = "/v2/vectordb/entities/query";
    static final String DISTANCE_FIELD = "distance";

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final ValueSerializer values = new ValueSerializer();

    private final String baseUrl;   // e.g. http://localhost:19530
    private final String apiKey;    // token or user:password, optional
    private final String database;  // optional, Milvus uses "default"

    public MilvusRestClientAdapter(String baseUrl, String apiKey, String database) {
        this(new OkHttpClient(), baseUrl, apiKey, database);
    }

    public MilvusRestClientAdapter(OkHttpClient http, String baseUrl, String apiKey, String database) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.database = database;
    }

    // ---------- PORT IMPLEMENTATION ----------

    @Override
    public void loadCollection(String collection) {
        request(LOAD_PATH, collectionBody(collection));
        log.debug("Milvus collection '{}' loaded", collection);
    }

    @Override
    public void upsert(String collection, String primaryKeyField, String vectorField, BackendRecord record) {
        ObjectNode row = om.valueToTree(record.properties());
        if (record.primaryKey() instanceof Long id) {
            row.put(primaryKeyField, id);
        } else {
            row.put(primaryKeyField, String.valueOf(record.primaryKey()));
        }
        row.set(vectorField, floatArray(record.vector()));

        ObjectNode body = collectionBody(collection);
        body.set("data", om.createArrayNode().add(row));
        request(UPSERT_PATH, body);
    }

    @Override
    public void delete(String collection, String primaryKeyField, Object key) {
        ObjectNode body = collectionBody(collection);
        body.put("filter", primaryKeyField + " in " + values.serialize(FilterValue.array(key)));
        request(DELETE_PATH, body);
    }

    @Override
    public List<BackendRow> search(SearchRequest req) {
        ObjectNode body = collectionBody(req.collection());
        body.set("data", om.createArrayNode().add(floatArray(req.vector())));
        body.put("annsField", req.vectorField());
        putFilter(body, req.filter());
        body.put("limit", req.topK());
        body.set("outputFields", stringArray(req.outputFields()));

        JsonNode resp = request(SEARCH_PATH, body);
        return readRows(resp.path("data"), req.primaryKeyField(), true);
    }

    @Override
    public List<BackendRow> query(FilterQueryRequest req) {
        ObjectNode body = collectionBody(req.collection());
        putFilter(body, req.filter());
        body.put("limit", req.limit());
        body.set("outputFields", stringArray(req.outputFields()));

        JsonNode resp = request(QUERY_PATH, body);
        return readRows(resp.path("data"), req.primaryKeyField(), false);
    }

    // ---------- INTERNALS ----------

    private ObjectNode collectionBody(String collection) {
        ObjectNode body = om.createObjectNode();
        if (database != null && !database.isBlank()) {
            body.put("dbName", database);
        }
        body.put("collectionName", collection);
        return body;
    }

    private void putFilter(ObjectNode body, String filter) {
        if (filter != null && !filter.isBlank()) {
            body.put("filter", filter);
        }
    }

    private List<BackendRow> readRows(JsonNode data, String primaryKeyField, boolean scored) {
        List<BackendRow> out = new ArrayList<>();
        if (!data.isArray()) {
            return out;
        }
        for (JsonNode node : data) {
            Map<String, Object> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                fields.put(e.getKey(), om.convertValue(e.getValue(), Object.class));
            }
            Object id = fields.remove(primaryKeyField);
            Double score = null;
            if (scored && node.has(DISTANCE_FIELD)) {
                fields.remove(DISTANCE_FIELD);
                score = node.get(DISTANCE_FIELD).asDouble();
            }
            out.add(new BackendRow(id, fields, score));
        }
        return out;
    }

    private ArrayNode floatArray(float[] v) {
        ArrayNode a = om.createArrayNode();
        for (float f : v) a.add(f);
        return a;
    }

    private ArrayNode stringArray(List<String> items) {
        ArrayNode a = om.createArrayNode();
        if (items != null) items.forEach(a::add);
        return a;
    }

    private JsonNode request(String path, ObjectNode body) {
        try {
            Request.Builder b = new Request.Builder().url(baseUrl + path);
            if (apiKey != null && !apiKey.isBlank()) {
                b.addHeader("Authorization", "Bearer " + apiKey);
            }
            b.post(RequestBody.create(om.writeValueAsBytes(body), JSON));
            if (log.isDebugEnabled()) log.debug("Milvus POST {} collection={}", path, body.path("collectionName").asText());

            try (Response resp = http.newCall(b.build()).execute()) {
                String respBody = resp.body() != null ? resp.body().string() : "";
                if (!resp.isSuccessful()) {
                    throw new IOException("Milvus POST " + path + " failed: " + resp.code() + " body=" + respBody);
                }
                JsonNode json = respBody.isEmpty() ? om.createObjectNode() : om.readTree(respBody);
                int code = json.path("code").asInt(0);
                if (code != 0) {
                    throw new IOException("Milvus POST " + path + " failed: code=" + code
                            + " message=" + json.path("message").asText(""));
                }
                return json;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.ragpipe.index;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragpipe.document.Chunk;
import com.ragpipe.document.ChunkMetadata;
import com.ragpipe.document.SnakeCaseJson;
import com.ragpipe.embedding.EmbeddingBatcher;
import com.ragpipe.embedding.EmbeddingInput;
import com.ragpipe.runtime.AppConfig;
import com.ragpipe.runtime.RetryPolicy;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Store backed by a Milvus collection, driven through the RESTful v2 API. Chunk records are
 * mirrored locally so that id lookups and stats do not need a round trip.
 */
public class MilvusVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(MilvusVectorStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int QUERY_PAGE_SIZE = 1000;
    private static final int CONTENT_MAX_LENGTH = 65535;

    private final OkHttpClient httpClient;
    private final AppConfig.MilvusConfig config;
    private final EmbeddingBatcher batcher;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ChunkRegistry registry = new ChunkRegistry();
    private boolean collectionReady;

    public MilvusVectorStore(OkHttpClient httpClient, AppConfig.MilvusConfig config, EmbeddingBatcher batcher) {
        this.httpClient = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        this.config = config;
        this.batcher = batcher;
        this.retryPolicy = new RetryPolicy(config.getMaxRetries(), config.getRetryDelayMs());
    }

    @Override
    public AddResult add(List<Chunk> chunks) throws IOException {
        ChunkRegistry.AddPlan plan = registry.plan(chunks);
        if (plan.fresh().isEmpty()) {
            log.info("index.add store=milvus added=0 duplicates={}", plan.duplicates());
            return new AddResult(0, plan.duplicates());
        }

        List<EmbeddingInput> inputs = plan.fresh().stream()
                .map(chunk -> new EmbeddingInput(chunk.content(), chunk.image()))
                .toList();
        List<float[]> embedded = batcher.embed(inputs);
        int width = registry.requireDimension(embedded);
        ensureCollection(width);

        List<Chunk> assigned = registry.assignIds(plan.fresh());
        List<Map<String, Object>> rows = new ArrayList<>(assigned.size());
        for (int i = 0; i < assigned.size(); i++) {
            Chunk chunk = assigned.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("chunk_id", chunk.chunkId());
            row.put("embedding", embedded.get(i));
            row.put("content", truncate(chunk.content()));
            row.put("metadata", SnakeCaseJson.mapper().writeValueAsString(chunk.metadata()));
            rows.add(row);
        }
        Map<String, Object> body = collectionBody();
        body.put("data", rows);
        call("entities/insert", body);

        registry.register(assigned, width);
        log.info("index.add store=milvus collection={} added={} duplicates={} total={}",
                config.getCollectionName(), assigned.size(), plan.duplicates(), registry.size());
        return new AddResult(assigned.size(), plan.duplicates());
    }

    @Override
    public List<SearchResult> search(String query, int topK) throws IOException {
        if (topK <= 0 || registry.size() == 0) {
            return List.of();
        }
        float[] queryVector = batcher.embeddingService().embedQuery(query);
        if (queryVector.length != registry.dimension()) {
            throw new DimensionMismatchException(registry.dimension(), queryVector.length);
        }

        Map<String, Object> body = collectionBody();
        body.put("data", List.of(queryVector));
        body.put("annsField", "embedding");
        body.put("limit", topK);
        body.put("outputFields", List.of("chunk_id"));
        body.put("searchParams", Map.of(
                "metricType", config.getMetricType(),
                "params", Map.of("nprobe", 10)));
        JsonNode data = call("entities/search", body).path("data");

        List<SearchResult> results = new ArrayList<>();
        for (JsonNode hit : data) {
            long id = hit.has("chunk_id") ? hit.path("chunk_id").asLong(-1) : hit.path("id").asLong(-1);
            Chunk chunk = id < 0 ? null : registry.get(id);
            if (chunk == null) {
                continue;
            }
            results.add(new SearchResult(chunk, normalize(hit.path("distance").floatValue())));
        }
        return results;
    }

    float normalize(float distance) {
        String metric = config.getMetricType().toUpperCase(Locale.ROOT);
        if ("IP".equals(metric) || "COSINE".equals(metric)) {
            return distance;
        }
        return 1f / (1f + distance);
    }

    @Override
    public void save() throws IOException {
        if (!hasCollection()) {
            return;
        }
        call("collections/flush", collectionBody());
        log.info("index.save store=milvus collection={} chunks={}", config.getCollectionName(), registry.size());
    }

    @Override
    public boolean load() throws IOException {
        if (!hasCollection()) {
            return false;
        }
        int dimension = describeDimension();
        call("collections/load", collectionBody());
        collectionReady = true;
        long rowCount = call("collections/get_stats", collectionBody()).path("data").path("rowCount").asLong(0);

        List<Chunk> restored = new ArrayList<>();
        for (long lower = 0; restored.size() < rowCount && lower < rowCount + QUERY_PAGE_SIZE; lower += QUERY_PAGE_SIZE) {
            Map<String, Object> body = collectionBody();
            body.put("filter", "chunk_id >= " + lower + " and chunk_id < " + (lower + QUERY_PAGE_SIZE));
            body.put("outputFields", List.of("chunk_id", "content", "metadata"));
            body.put("limit", QUERY_PAGE_SIZE);
            for (JsonNode row : call("entities/query", body).path("data")) {
                ChunkMetadata metadata = SnakeCaseJson.mapper().readValue(row.path("metadata").asText("{}"), ChunkMetadata.class);
                restored.add(new Chunk(row.path("content").asText(), metadata, row.path("chunk_id").asLong(), null));
            }
        }
        restored.sort((a, b) -> Long.compare(a.chunkId(), b.chunkId()));
        registry.restore(restored, dimension);
        log.info("index.load store=milvus collection={} chunks={} dimension={}", config.getCollectionName(), registry.size(), dimension);
        return true;
    }

    @Override
    public void clear() throws IOException {
        if (hasCollection()) {
            call("collections/drop", collectionBody());
        }
        collectionReady = false;
        registry.clear();
        log.info("index.clear store=milvus collection={}", config.getCollectionName());
    }

    @Override
    public IndexStats stats() {
        return new IndexStats(registry.size(), registry.dimension(), registry.size(), registry.sources(), "milvus");
    }

    @Override
    public int size() {
        return registry.size();
    }

    private void ensureCollection(int dimension) throws IOException {
        if (collectionReady) {
            return;
        }
        if (hasCollection()) {
            int existing = describeDimension();
            if (existing != dimension) {
                throw new DimensionMismatchException(existing, dimension);
            }
        } else {
            createCollection(dimension);
        }
        call("collections/load", collectionBody());
        collectionReady = true;
    }

    private void createCollection(int dimension) throws IOException {
        List<Map<String, Object>> fields = List.of(
                Map.of("fieldName", "chunk_id", "dataType", "Int64", "isPrimary", true),
                Map.of("fieldName", "embedding", "dataType", "FloatVector",
                        "elementTypeParams", Map.of("dim", String.valueOf(dimension))),
                Map.of("fieldName", "content", "dataType", "VarChar",
                        "elementTypeParams", Map.of("max_length", String.valueOf(CONTENT_MAX_LENGTH))),
                Map.of("fieldName", "metadata", "dataType", "VarChar",
                        "elementTypeParams", Map.of("max_length", String.valueOf(CONTENT_MAX_LENGTH))));
        Map<String, Object> body = collectionBody();
        body.put("schema", Map.of("autoId", false, "enableDynamicField", false, "fields", fields));
        body.put("indexParams", List.of(Map.of(
                "fieldName", "embedding",
                "indexName", "embedding_index",
                "metricType", config.getMetricType(),
                "params", Map.of("index_type", config.getIndexType(), "nlist", 128))));
        call("collections/create", body);
        log.info("milvus.collection.created collection={} dimension={} indexType={} metric={}",
                config.getCollectionName(), dimension, config.getIndexType(), config.getMetricType());
    }

    private boolean hasCollection() throws IOException {
        return call("collections/has", collectionBody()).path("data").path("has").asBoolean(false);
    }

    private int describeDimension() throws IOException {
        JsonNode fields = call("collections/describe", collectionBody()).path("data").path("fields");
        for (JsonNode field : fields) {
            if (!"embedding".equals(field.path("name").asText())) {
                continue;
            }
            for (JsonNode param : field.path("params")) {
                if ("dim".equals(param.path("key").asText())) {
                    return Integer.parseInt(param.path("value").asText());
                }
            }
        }
        throw new IOException("Collection " + config.getCollectionName() + " has no embedding dimension");
    }

    private Map<String, Object> collectionBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dbName", config.getDbName());
        body.put("collectionName", config.getCollectionName());
        return body;
    }

    private JsonNode call(String endpoint, Map<String, Object> body) throws IOException {
        String payload = mapper.writeValueAsString(body);
        return retryPolicy.execute("milvus " + endpoint, () -> post(endpoint, payload));
    }

    private JsonNode post(String endpoint, String payload) throws IOException {
        Request.Builder requestBuilder = new Request.Builder()
                .url(config.baseUrl() + "/v2/vectordb/" + endpoint)
                .post(RequestBody.create(payload, JSON));
        if (!config.getUser().isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + config.getUser() + ":" + config.getPassword());
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Milvus " + endpoint + " returned HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(response.body().string());
            int code = root.path("code").asInt(0);
            if (code != 0) {
                throw new IOException("Milvus " + endpoint + " failed code=" + code + " message=" + root.path("message").asText());
            }
            return root;
        }
    }

    private static String truncate(String content) {
        return content.length() > CONTENT_MAX_LENGTH ? content.substring(0, CONTENT_MAX_LENGTH) : content;
    }
}

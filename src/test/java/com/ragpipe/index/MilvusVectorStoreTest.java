package com.ragpipe.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ragpipe.ScriptedHttp;
import com.ragpipe.document.Chunk;
import com.ragpipe.document.ChunkMetadata;
import com.ragpipe.embedding.EmbeddingBatcher;
import com.ragpipe.embedding.HashingEmbeddingService;
import com.ragpipe.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MilvusVectorStoreTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FakeMilvus milvus = new FakeMilvus();
    private final ScriptedHttp http = new ScriptedHttp(milvus::handle);

    @Test
    void shouldCreateCollectionAndSearchInsertedChunks() throws IOException {
        MilvusVectorStore store = store(config());

        AddResult result = store.add(List.of(
                chunk("a.txt", "milvus stores vectors remotely"),
                chunk("b.txt", "bread baking at home")));
        List<SearchResult> hits = store.search("vectors stored remotely in milvus", 5);

        assertEquals(new AddResult(2, 0), result);
        assertEquals(64, milvus.dimension);
        assertEquals(2, hits.size());
        assertEquals("a.txt", hits.get(0).chunk().source());
        assertTrue(hits.get(0).score() >= hits.get(1).score());
        assertEquals("milvus", store.stats().storeType());
        assertTrue(http.exchanges().stream().anyMatch(exchange -> exchange.path().equals("/v2/vectordb/collections/create")));
    }

    @Test
    void shouldRestoreChunksFromExistingCollection() throws IOException {
        MilvusVectorStore writer = store(config());
        writer.add(List.of(chunk("a.txt", "first"), chunk("b.txt", "second"), chunk("c.txt", "third")));
        writer.save();

        MilvusVectorStore reader = store(config());

        assertTrue(reader.load());
        assertEquals(3, reader.size());
        assertEquals(64, reader.stats().dimension());
        assertEquals(List.of("a.txt", "b.txt", "c.txt"), reader.stats().sources());
        assertEquals(new AddResult(0, 1), reader.add(List.of(chunk("z.txt", "second"))));
        assertEquals(new AddResult(1, 0), reader.add(List.of(chunk("d.txt", "fourth"))));
        assertEquals(4, milvus.rows.size());
        assertTrue(milvus.rows.containsKey(3L));
    }

    @Test
    void shouldReportNothingToLoadWithoutCollection() throws IOException {
        assertFalse(store(config()).load());
    }

    @Test
    void shouldDropCollectionOnClear() throws IOException {
        MilvusVectorStore store = store(config());
        store.add(List.of(chunk("a.txt", "gone soon")));

        store.clear();
        store.clear();

        assertEquals(0, store.size());
        assertFalse(milvus.exists);
        assertFalse(store(config()).load());
    }

    @Test
    void shouldRejectCollectionOfDifferentDimension() throws IOException {
        store(config()).add(List.of(chunk("a.txt", "sixty four wide")));

        MilvusVectorStore narrower = new MilvusVectorStore(http.client(), config(),
                new EmbeddingBatcher(new HashingEmbeddingService(8), 4, 1));

        assertThrows(DimensionMismatchException.class, () -> narrower.add(List.of(chunk("b.txt", "eight wide"))));
        assertEquals(0, narrower.size());
    }

    @Test
    void shouldSurfaceErrorCodesAfterRetries() {
        ScriptedHttp failing = ScriptedHttp.always(200, "{\"code\": 1100, \"message\": \"collection not loaded\"}");
        AppConfig.MilvusConfig config = config();
        config.setMaxRetries(1);
        MilvusVectorStore store = new MilvusVectorStore(failing.client(), config,
                new EmbeddingBatcher(new HashingEmbeddingService(8), 4, 1));

        IOException error = assertThrows(IOException.class, () -> store.load());

        assertTrue(error.getMessage().contains("collection not loaded"), error.getMessage());
        assertEquals(2, failing.exchanges().size());
    }

    @Test
    void shouldSendCredentialsWhenUserIsConfigured() throws IOException {
        AppConfig.MilvusConfig config = config();
        config.setUser("root");
        config.setPassword("Milvus");

        store(config).load();

        assertEquals("Bearer root:Milvus", http.exchanges().get(0).authorization());
    }

    @Test
    void shouldConvertDistancesByMetric() {
        AppConfig.MilvusConfig l2 = config();
        AppConfig.MilvusConfig ip = config();
        ip.setMetricType("IP");

        assertEquals(0.5f, store(l2).normalize(1f), 1e-6);
        assertEquals(0.8f, store(ip).normalize(0.8f), 1e-6);
    }

    private MilvusVectorStore store(AppConfig.MilvusConfig config) {
        return new MilvusVectorStore(http.client(), config, new EmbeddingBatcher(new HashingEmbeddingService(64), 8, 1));
    }

    private static AppConfig.MilvusConfig config() {
        AppConfig.MilvusConfig config = new AppConfig.MilvusConfig();
        config.setMaxRetries(0);
        config.setRetryDelayMs(0);
        return config;
    }

    private static Chunk chunk(String source, String content) {
        return new Chunk(content, ChunkMetadata.forText(source, content));
    }

    /** Single-collection stand-in for the Milvus RESTful v2 API. */
    private static class FakeMilvus {
        private static final Pattern RANGE = Pattern.compile("chunk_id >= (\\d+) and chunk_id < (\\d+)");

        private boolean exists;
        private int dimension;
        private final Map<Long, JsonNode> rows = new TreeMap<>();

        synchronized ScriptedHttp.Reply handle(ScriptedHttp.Exchange exchange) {
            try {
                JsonNode body = MAPPER.readTree(exchange.body());
                String endpoint = exchange.path().substring("/v2/vectordb/".length());
                ObjectNode reply = MAPPER.createObjectNode().put("code", 0);
                switch (endpoint) {
                    case "collections/has" -> reply.putObject("data").put("has", exists);
                    case "collections/create" -> {
                        exists = true;
                        dimension = Integer.parseInt(body.at("/schema/fields/1/elementTypeParams/dim").asText());
                    }
                    case "collections/describe" -> {
                        ArrayNode fields = reply.putObject("data").putArray("fields");
                        fields.addObject().put("name", "chunk_id");
                        ObjectNode embedding = fields.addObject().put("name", "embedding");
                        embedding.putArray("params").addObject().put("key", "dim").put("value", String.valueOf(dimension));
                    }
                    case "collections/load", "collections/flush" -> {
                    }
                    case "collections/drop" -> {
                        exists = false;
                        rows.clear();
                    }
                    case "collections/get_stats" -> reply.putObject("data").put("rowCount", rows.size());
                    case "entities/insert" -> {
                        for (JsonNode row : body.path("data")) {
                            rows.put(row.path("chunk_id").asLong(), row);
                        }
                        reply.putObject("data").put("insertCount", body.path("data").size());
                    }
                    case "entities/search" -> reply.set("data", search(body));
                    case "entities/query" -> reply.set("data", query(body));
                    default -> {
                        return ScriptedHttp.Reply.ok("{\"code\": 404, \"message\": \"unknown endpoint\"}");
                    }
                }
                return ScriptedHttp.Reply.ok(MAPPER.writeValueAsString(reply));
            } catch (IOException e) {
                return new ScriptedHttp.Reply(500, e.getMessage());
            }
        }

        private ArrayNode search(JsonNode body) {
            JsonNode queryVector = body.path("data").get(0);
            Map<Long, Double> distances = new TreeMap<>();
            for (Map.Entry<Long, JsonNode> entry : rows.entrySet()) {
                JsonNode vector = entry.getValue().path("embedding");
                double sum = 0;
                for (int i = 0; i < vector.size(); i++) {
                    double diff = vector.get(i).asDouble() - queryVector.get(i).asDouble();
                    sum += diff * diff;
                }
                distances.put(entry.getKey(), sum);
            }
            List<Long> order = new ArrayList<>(distances.keySet());
            order.sort(Comparator.comparingDouble(distances::get));
            ArrayNode hits = MAPPER.createArrayNode();
            for (Long id : order.subList(0, Math.min(order.size(), body.path("limit").asInt()))) {
                hits.addObject().put("chunk_id", id).put("distance", distances.get(id));
            }
            return hits;
        }

        private ArrayNode query(JsonNode body) {
            Matcher matcher = RANGE.matcher(body.path("filter").asText());
            ArrayNode result = MAPPER.createArrayNode();
            if (!matcher.matches()) {
                return result;
            }
            long lower = Long.parseLong(matcher.group(1));
            long upper = Long.parseLong(matcher.group(2));
            for (Map.Entry<Long, JsonNode> entry : rows.entrySet()) {
                if (entry.getKey() >= lower && entry.getKey() < upper) {
                    JsonNode row = entry.getValue();
                    result.addObject()
                            .put("chunk_id", entry.getKey())
                            .put("content", row.path("content").asText())
                            .put("metadata", row.path("metadata").asText());
                }
            }
            return result;
        }
    }
}

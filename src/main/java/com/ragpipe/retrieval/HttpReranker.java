package com.ragpipe.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragpipe.runtime.AppConfig;
import com.ragpipe.runtime.RetryPolicy;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class HttpReranker implements Reranker {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final RetryPolicy retryPolicy;

    public HttpReranker(OkHttpClient httpClient, String endpoint, String model, RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.retryPolicy = retryPolicy;
    }

    public static HttpReranker fromConfig(OkHttpClient baseClient, AppConfig.RerankerConfig config) {
        OkHttpClient client = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new HttpReranker(client, config.getApiUrl(), config.getModel(),
                new RetryPolicy(config.getMaxRetries(), config.getRetryDelayMs()));
    }

    @Override
    public List<RerankScore> rerank(String query, List<String> documents, int topN) throws RerankException {
        if (documents.isEmpty()) {
            return List.of();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("query", query);
        payload.put("documents", documents);
        payload.put("top_n", topN);

        String body;
        try {
            String json = mapper.writeValueAsString(payload);
            body = retryPolicy.execute("rerank", () -> post(json));
        } catch (IOException e) {
            throw new RerankException("Rerank request to " + endpoint + " failed: " + e.getMessage(), e);
        }
        return parse(body, documents.size());
    }

    private String post(String json) throws IOException {
        Request request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(json, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " from reranker");
            }
            return response.body().string();
        }
    }

    List<RerankScore> parse(String body, int documentCount) throws RerankException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new RerankException("Rerank response is not valid JSON", e);
        }
        JsonNode results = root.has("results") ? root.path("results") : root.path("data");
        if (!results.isArray()) {
            throw new RerankException("Rerank response has neither results nor data");
        }
        List<RerankScore> scores = new ArrayList<>(results.size());
        for (JsonNode item : results) {
            JsonNode index = item.path("index");
            JsonNode score = item.path("relevance_score");
            if (!index.canConvertToInt() || !score.isNumber()) {
                throw new RerankException("Rerank result is missing index or relevance_score: " + item);
            }
            if (index.asInt() < 0 || index.asInt() >= documentCount) {
                throw new RerankException("Rerank index " + index.asInt() + " is outside 0.." + (documentCount - 1));
            }
            scores.add(new RerankScore(index.asInt(), score.floatValue()));
        }
        return scores;
    }
}

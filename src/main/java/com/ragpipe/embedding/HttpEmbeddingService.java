package com.ragpipe.embedding;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragpipe.runtime.AppConfig;
import com.ragpipe.runtime.RetryPolicy;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Client for OpenAI-style embedding endpoints. Batches that contain at least one image are sent
 * as {@code {"text", "image"}} objects, text-only batches as plain strings.
 */
public class HttpEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final String modelVersion;
    private final RetryPolicy retryPolicy;

    public HttpEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String apiKey,
            String model,
            String modelVersion,
            RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model == null ? "" : model;
        this.modelVersion = modelVersion == null ? "" : modelVersion;
        this.retryPolicy = retryPolicy;
    }

    public static HttpEmbeddingService fromConfig(OkHttpClient baseClient, AppConfig.EmbeddingConfig config) {
        OkHttpClient client = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new HttpEmbeddingService(
                client,
                config.getApiUrl(),
                config.getApiKey(),
                config.getModel(),
                config.getModelVersion(),
                new RetryPolicy(config.getMaxRetries(), config.getRetryDelayMs()));
    }

    @Override
    public List<float[]> embed(List<EmbeddingInput> inputs) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        String payload = buildPayload(inputs);
        try {
            String body = retryPolicy.execute("embedding", () -> post(payload));
            return parse(body, inputs.size());
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String version() {
        if (!modelVersion.isBlank()) {
            return modelVersion;
        }
        return model.isBlank() ? "remote" : model;
    }

    private String post(String payload) throws IOException {
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " from embedding endpoint");
            }
            return response.body().string();
        }
    }

    private String buildPayload(List<EmbeddingInput> inputs) {
        boolean multimodal = inputs.stream().anyMatch(EmbeddingInput::hasImage);
        List<Object> items = new ArrayList<>(inputs.size());
        for (EmbeddingInput input : inputs) {
            if (!multimodal) {
                items.add(input.text());
                continue;
            }
            Map<String, String> item = new LinkedHashMap<>();
            item.put("text", input.text());
            if (input.hasImage()) {
                item.put("image", "data:image/png;base64," + Base64.getEncoder().encodeToString(input.image()));
            }
            items.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        if (!model.isBlank()) {
            payload.put("model", model);
        }
        payload.put("input", items);
        try {
            return mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new EmbeddingException("Unable to serialize embedding request", e);
        }
    }

    List<float[]> parse(String body, int expected) {
        JsonNode data;
        try {
            data = mapper.readTree(body).path("data");
        } catch (IOException e) {
            throw new EmbeddingException("Embedding response is not valid JSON", e);
        }
        if (!data.isArray()) {
            throw new EmbeddingException("Embedding response has no data array");
        }
        if (data.size() != expected) {
            throw new EmbeddingException("Embedding response has " + data.size() + " vectors for " + expected + " inputs");
        }
        float[][] ordered = new float[expected][];
        for (JsonNode item : data) {
            JsonNode indexNode = item.path("index");
            JsonNode vectorNode = item.path("embedding");
            if (!indexNode.canConvertToInt() || !vectorNode.isArray()) {
                throw new EmbeddingException("Embedding response item is missing index or embedding");
            }
            int index = indexNode.asInt();
            if (index < 0 || index >= expected || ordered[index] != null) {
                throw new EmbeddingException("Embedding response has invalid or repeated index " + index);
            }
            if (vectorNode.isEmpty()) {
                throw new EmbeddingException("Embedding response has an empty vector at index " + index);
            }
            float[] vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            ordered[index] = vector;
        }
        log.debug("embedding.batch size={} dimension={}", expected, ordered[0].length);
        return List.of(ordered);
    }
}

package com.ragpipe.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

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
 * Scores documents one at a time through a text-completion endpoint (llama.cpp style) for
 * servers that have no rerank route. The model is asked for a relevance between 0 and 1.
 * A document whose call fails is given {@link #NEUTRAL_SCORE}; if every call fails the
 * whole rerank fails.
 */
public class CompletionReranker implements Reranker {
    private static final Logger log = LoggerFactory.getLogger(CompletionReranker.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final float NEUTRAL_SCORE = 0.5f;
    private static final Pattern DECIMAL = Pattern.compile("\\b[01]?\\.\\d+\\b");
    private static final Pattern WHOLE = Pattern.compile("\\b[01]\\b");
    private static final List<String> STOP = List.of("\n", "Query:", "Document:");
    private static final int MAX_TOKENS = 10;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final RetryPolicy retryPolicy;

    public CompletionReranker(OkHttpClient httpClient, String endpoint, String model, RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.retryPolicy = retryPolicy;
    }

    public static CompletionReranker fromConfig(OkHttpClient baseClient, AppConfig.RerankerConfig config) {
        OkHttpClient client = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new CompletionReranker(client, completionsEndpoint(config.getApiUrl()), config.getModel(),
                new RetryPolicy(config.getMaxRetries(), config.getRetryDelayMs()));
    }

    /**
     * Accepts a server base URL or a {@code /v1/rerank} URL and points it at {@code /v1/completions}.
     */
    static String completionsEndpoint(String apiUrl) {
        String base = apiUrl.trim().replace("/v1/rerank", "");
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.endsWith("/v1/completions")) {
            return base;
        }
        return base + "/v1/completions";
    }

    @Override
    public List<RerankScore> rerank(String query, List<String> documents, int topN) throws RerankException {
        List<RerankScore> scores = new ArrayList<>(documents.size());
        int failures = 0;
        IOException lastFailure = null;
        for (int i = 0; i < documents.size(); i++) {
            float score;
            try {
                String json = mapper.writeValueAsString(payload(query, documents.get(i)));
                score = parseCompletion(retryPolicy.execute("rerank.completion", () -> post(json)));
            } catch (IOException e) {
                failures++;
                lastFailure = e;
                score = NEUTRAL_SCORE;
                log.warn("rerank.completion.document.failed index={} reason={}", i, e.getMessage());
            }
            scores.add(new RerankScore(i, score));
        }
        if (!documents.isEmpty() && failures == documents.size()) {
            throw new RerankException("Every completion call to " + endpoint + " failed: " + lastFailure.getMessage(), lastFailure);
        }
        return scores;
    }

    private Map<String, Object> payload(String query, String document) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        payload.put("prompt", prompt(query, document));
        payload.put("temperature", 0.0);
        payload.put("max_tokens", MAX_TOKENS);
        payload.put("stop", STOP);
        payload.put("echo", false);
        return payload;
    }

    static String prompt(String query, String document) {
        return "Query: " + query + "\n"
                + "Document: " + document + "\n\n"
                + "Rate the relevance of the document to the query on a scale from 0 to 1, where:\n"
                + "- 0 = completely irrelevant\n"
                + "- 1 = perfectly relevant\n\n"
                + "Relevance score:";
    }

    private String post(String json) throws IOException {
        Request request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(json, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " from completion endpoint");
            }
            return response.body().string();
        }
    }

    float parseCompletion(String body) throws IOException {
        JsonNode choices = mapper.readTree(body).path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        return extractScore(choices.get(0).path("text").asText(""));
    }

    /**
     * Reads the first decimal in 0..1, then a bare 0 or 1, then the whole text as a number.
     * Anything else is neutral.
     */
    static float extractScore(String completion) {
        String text = completion.strip();
        Matcher decimal = DECIMAL.matcher(text);
        if (decimal.find()) {
            return clamp(Float.parseFloat(decimal.group()));
        }
        Matcher whole = WHOLE.matcher(text);
        if (whole.find()) {
            return Float.parseFloat(whole.group());
        }
        try {
            return clamp(Float.parseFloat(text));
        } catch (NumberFormatException e) {
            return NEUTRAL_SCORE;
        }
    }

    private static float clamp(float score) {
        if (Float.isNaN(score)) {
            return NEUTRAL_SCORE;
        }
        return Math.min(1f, Math.max(0f, score));
    }
}

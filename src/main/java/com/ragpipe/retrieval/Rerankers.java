package com.ragpipe.retrieval;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragpipe.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class Rerankers {
    private static final Logger log = LoggerFactory.getLogger(Rerankers.class);

    private Rerankers() {
    }

    /**
     * {@code rerank} posts to a rerank route; {@code completion} scores each document through
     * a completion route.
     */
    public static Reranker fromConfig(OkHttpClient httpClient, AppConfig.RerankerConfig config) {
        String backend = config.getBackend().trim().toLowerCase(Locale.ROOT);
        log.info("reranker.backend type={} endpoint={} model={}", backend, config.getApiUrl(), config.getModel());
        return switch (backend) {
            case "rerank" -> HttpReranker.fromConfig(httpClient, config);
            case "completion" -> CompletionReranker.fromConfig(httpClient, config);
            default -> throw new IllegalArgumentException("Unknown reranker backend: " + config.getBackend());
        };
    }
}

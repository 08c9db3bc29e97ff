package com.ragpipe.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragpipe.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingServices.class);

    private EmbeddingServices() {
    }

    public static EmbeddingService fromConfig(OkHttpClient httpClient, AppConfig.EmbeddingConfig config) {
        String endpoint = config.getApiUrl();
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("embedding.offline reason=no-api-url dimension={}", config.getOfflineDimension());
            return new HashingEmbeddingService(config.getOfflineDimension());
        }
        log.info("embedding.remote endpoint={} model={}", endpoint, config.getModel().isBlank() ? "default" : config.getModel());
        return HttpEmbeddingService.fromConfig(httpClient, config);
    }
}

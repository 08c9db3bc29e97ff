package com.ragpipe.index;

import java.nio.file.Path;
import java.util.Locale;

import com.ragpipe.embedding.EmbeddingBatcher;
import com.ragpipe.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class VectorStores {
    private VectorStores() {
    }

    public static VectorStore create(AppConfig config, EmbeddingBatcher batcher, OkHttpClient httpClient) {
        AppConfig.VectorStoreConfig storeConfig = config.getVectorStore();
        String type = storeConfig.getType().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "local", "faiss" -> new LocalVectorStore(Path.of(storeConfig.getPath()), batcher);
            case "milvus" -> new MilvusVectorStore(httpClient, storeConfig.getMilvus(), batcher);
            default -> throw new IllegalArgumentException("Unknown vector store type: " + storeConfig.getType()
                    + " (expected local or milvus)");
        };
    }
}

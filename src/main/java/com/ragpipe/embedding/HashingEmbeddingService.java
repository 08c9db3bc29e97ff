package com.ragpipe.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline embedder used when no embedding endpoint is configured. Tokens are hashed into a
 * fixed number of buckets and the result is L2-normalized.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<EmbeddingInput> inputs) {
        List<float[]> vectors = new ArrayList<>(inputs.size());
        for (EmbeddingInput input : inputs) {
            vectors.add(embedText(input.text()));
        }
        return vectors;
    }

    @Override
    public String version() {
        return "hashing-" + dimension;
    }

    public int dimension() {
        return dimension;
    }

    private float[] embedText(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            int index = Math.floorMod(token.hashCode(), dimension);
            vector[index] += 1f;
        }

        float norm = 0f;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }
}

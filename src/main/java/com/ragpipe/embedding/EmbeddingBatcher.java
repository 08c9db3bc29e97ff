package com.ragpipe.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits inputs into fixed-size batches and embeds them either one after another or with at
 * most {@code maxConcurrentRequests} batches in flight. Output order always matches input order.
 */
public class EmbeddingBatcher {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingBatcher.class);
    private static final int MAX_POOL_THREADS = 16;

    private final EmbeddingService embeddingService;
    private final int batchSize;
    private final int maxConcurrentRequests;

    public EmbeddingBatcher(EmbeddingService embeddingService, int batchSize, int maxConcurrentRequests) {
        this.embeddingService = embeddingService;
        this.batchSize = Math.max(1, batchSize);
        this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
    }

    public EmbeddingService embeddingService() {
        return embeddingService;
    }

    public List<float[]> embed(List<EmbeddingInput> inputs) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        List<List<EmbeddingInput>> batches = new ArrayList<>();
        for (int start = 0; start < inputs.size(); start += batchSize) {
            batches.add(inputs.subList(start, Math.min(inputs.size(), start + batchSize)));
        }
        List<float[]> vectors = maxConcurrentRequests == 1 || batches.size() == 1
                ? embedSequentially(batches)
                : embedConcurrently(batches);
        if (vectors.size() != inputs.size()) {
            throw new EmbeddingException("Expected " + inputs.size() + " embeddings but received " + vectors.size());
        }
        return vectors;
    }

    private List<float[]> embedSequentially(List<List<EmbeddingInput>> batches) {
        List<float[]> vectors = new ArrayList<>();
        for (List<EmbeddingInput> batch : batches) {
            vectors.addAll(embedBatch(batch));
        }
        return vectors;
    }

    private List<float[]> embedConcurrently(List<List<EmbeddingInput>> batches) {
        Semaphore permits = new Semaphore(maxConcurrentRequests);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(batches.size(), MAX_POOL_THREADS));
        List<Future<List<float[]>>> futures = new ArrayList<>(batches.size());
        try {
            for (List<EmbeddingInput> batch : batches) {
                futures.add(executor.submit(() -> {
                    permits.acquire();
                    try {
                        return embedBatch(batch);
                    } finally {
                        permits.release();
                    }
                }));
            }
            List<float[]> vectors = new ArrayList<>();
            for (Future<List<float[]>> future : futures) {
                vectors.addAll(future.get());
            }
            log.debug("embedding.concurrent batches={} maxConcurrent={}", batches.size(), maxConcurrentRequests);
            return vectors;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embeddings", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingException embeddingException) {
                throw embeddingException;
            }
            throw new EmbeddingException("Embedding batch failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new EmbeddingException("Embedding batch cancelled", e);
        } finally {
            futures.forEach(future -> future.cancel(true));
            executor.shutdownNow();
        }
    }

    private List<float[]> embedBatch(List<EmbeddingInput> batch) {
        List<float[]> vectors = embeddingService.embed(batch);
        if (vectors.size() != batch.size()) {
            throw new EmbeddingException("Embedding service returned " + vectors.size() + " vectors for " + batch.size() + " inputs");
        }
        return vectors;
    }
}

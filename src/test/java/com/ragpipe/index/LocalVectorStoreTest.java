package com.ragpipe.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragpipe.chunking.ChunkingEngine;
import com.ragpipe.document.Chunk;
import com.ragpipe.document.ChunkMetadata;
import com.ragpipe.document.Document;
import com.ragpipe.document.DocumentMetadata;
import com.ragpipe.embedding.EmbeddingBatcher;
import com.ragpipe.embedding.EmbeddingException;
import com.ragpipe.embedding.EmbeddingService;
import com.ragpipe.embedding.HashingEmbeddingService;
import com.ragpipe.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalVectorStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipChunksOfIdenticalContentFromAnotherSource() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(16));
        ChunkingEngine engine = ChunkingEngine.fromConfig(new AppConfig(), "hashing-16");
        String content = "Vector stores keep embeddings. They answer nearest neighbour queries.";

        AddResult first = store.add(engine.chunk(Document.of(content, DocumentMetadata.ofSource("a.txt", "a.txt", "text"))));
        AddResult second = store.add(engine.chunk(Document.of(content, DocumentMetadata.ofSource("b.txt", "b.txt", "text"))));

        assertTrue(first.added() > 0);
        assertEquals(0, second.added());
        assertEquals(first.added(), second.duplicates());
        assertEquals(first.added(), store.stats().numChunks());
        assertEquals(List.of("a.txt"), store.stats().sources());
    }

    @Test
    void shouldReturnEveryChunkBestFirstWhenTopKExceedsSize() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(256));
        store.add(List.of(
                chunk("alpha.txt", "apples and oranges"),
                chunk("beta.txt", "the query about vector search"),
                chunk("gamma.txt", "completely unrelated words")));

        List<SearchResult> results = store.search("vector search query", 5);

        assertEquals(3, results.size());
        assertEquals("beta.txt", results.get(0).chunk().source());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).score() >= results.get(i).score());
        }
        results.forEach(result -> assertTrue(result.score() > 0f && result.score() <= 1f));
    }

    @Test
    void shouldAssignDenseIdsAndIgnoreRepeatedAdds() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(8));
        List<Chunk> chunks = List.of(chunk("a.txt", "one"), chunk("a.txt", "two"), chunk("a.txt", "one"));

        AddResult first = store.add(chunks);
        AddResult again = store.add(chunks);

        assertEquals(new AddResult(2, 1), first);
        assertEquals(new AddResult(0, 3), again);
        assertEquals(2, store.size());
        List<SearchResult> results = store.search("one", 2);
        assertEquals(0L, results.get(0).chunk().chunkId());
    }

    @Test
    void shouldSearchIdenticallyAfterSaveAndLoad() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(16));
        store.add(List.of(
                chunk("a.txt", "saving indexes to disk"),
                chunk("b.txt", "loading indexes from disk"),
                chunk("c.txt", "unrelated cooking recipe")));
        store.save();

        LocalVectorStore reloaded = store(new HashingEmbeddingService(16));
        assertTrue(reloaded.load());

        List<SearchResult> before = store.search("disk indexes", 3);
        List<SearchResult> after = reloaded.search("disk indexes", 3);
        assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++) {
            assertEquals(before.get(i).chunk().chunkId(), after.get(i).chunk().chunkId());
            assertEquals(before.get(i).score(), after.get(i).score(), 1e-6);
            assertEquals(before.get(i).chunk().metadata(), after.get(i).chunk().metadata());
        }
        assertEquals(store.stats().dimension(), reloaded.stats().dimension());
    }

    @Test
    void shouldKeepDeduplicatingAfterReload() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(8));
        store.add(List.of(chunk("a.txt", "persisted text")));
        store.save();

        LocalVectorStore reloaded = store(new HashingEmbeddingService(8));
        reloaded.load();

        assertEquals(new AddResult(0, 1), reloaded.add(List.of(chunk("b.txt", "persisted text"))));
    }

    @Test
    void shouldReportNothingToLoadForFreshDirectory() throws IOException {
        assertFalse(store(new HashingEmbeddingService(8)).load());
    }

    @Test
    void shouldRejectQueryOfDifferentDimension() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(8));
        store.add(List.of(chunk("a.txt", "eight wide")));
        store.save();

        LocalVectorStore narrower = store(new HashingEmbeddingService(4));
        narrower.load();

        assertThrows(DimensionMismatchException.class, () -> narrower.search("eight", 1));
        assertThrows(DimensionMismatchException.class, () -> narrower.add(List.of(chunk("b.txt", "four wide"))));
        assertEquals(1, narrower.size());
    }

    @Test
    void shouldLeaveStoreUnchangedWhenEmbeddingFails() throws IOException {
        AtomicBoolean failing = new AtomicBoolean(true);
        HashingEmbeddingService delegate = new HashingEmbeddingService(8);
        EmbeddingService flaky = inputs -> {
            if (failing.get()) {
                throw new EmbeddingException("endpoint down");
            }
            return delegate.embed(inputs);
        };
        LocalVectorStore store = store(flaky);
        List<Chunk> chunks = List.of(chunk("a.txt", "first"), chunk("a.txt", "second"));

        assertThrows(EmbeddingException.class, () -> store.add(chunks));
        assertEquals(0, store.size());

        failing.set(false);
        assertEquals(new AddResult(2, 0), store.add(chunks));
    }

    @Test
    void shouldRejectEmptyVectorsAndKeepDimensionUnset() throws IOException {
        AtomicBoolean empty = new AtomicBoolean(true);
        HashingEmbeddingService delegate = new HashingEmbeddingService(3);
        EmbeddingService service = inputs -> empty.get()
                ? inputs.stream().map(input -> new float[0]).toList()
                : delegate.embed(inputs);
        LocalVectorStore store = store(service);

        assertThrows(IllegalStateException.class, () -> store.add(List.of(chunk("a.txt", "zero wide"))));
        assertEquals(0, store.size());
        assertEquals(0, store.stats().dimension());

        empty.set(false);
        assertEquals(new AddResult(1, 0), store.add(List.of(chunk("b.txt", "three wide"))));
        assertEquals(3, store.stats().dimension());
        assertEquals(1, store.search("three wide", 1).size());
    }

    @Test
    void shouldClearIdempotently() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(8));
        store.add(List.of(chunk("a.txt", "temporary")));
        store.save();

        store.clear();
        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.search("temporary", 3).isEmpty());
        assertFalse(Files.exists(tempDir.resolve(LocalVectorStore.INDEX_FILE)));
        assertFalse(store.load());
    }

    @Test
    void shouldReturnNothingForNonPositiveTopK() throws IOException {
        LocalVectorStore store = store(new HashingEmbeddingService(8));
        store.add(List.of(chunk("a.txt", "something")));

        assertTrue(store.search("something", 0).isEmpty());
    }

    @Test
    void shouldComputeSquaredDistance() {
        assertEquals(25.0, LocalVectorStore.squaredL2(new float[] { 0f, 0f }, new float[] { 3f, 4f }), 1e-9);
    }

    private LocalVectorStore store(EmbeddingService service) {
        return new LocalVectorStore(tempDir, new EmbeddingBatcher(service, 4, 1));
    }

    private static Chunk chunk(String source, String content) {
        return new Chunk(content, ChunkMetadata.forText(source, content));
    }
}

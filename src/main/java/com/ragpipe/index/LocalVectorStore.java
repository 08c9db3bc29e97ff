package com.ragpipe.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ragpipe.document.Chunk;
import com.ragpipe.document.ChunkMetadata;
import com.ragpipe.document.SnakeCaseJson;
import com.ragpipe.embedding.EmbeddingBatcher;
import com.ragpipe.embedding.EmbeddingInput;

/**
 * In-process store doing exact squared-L2 search over every vector. Persists to
 * {@code index.bin} (vectors) and {@code metadata.json} (chunk records) in one directory.
 */
public class LocalVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalVectorStore.class);
    static final String INDEX_FILE = "index.bin";
    static final String METADATA_FILE = "metadata.json";
    private static final int MAGIC = 0x52505649;

    private final Path directory;
    private final EmbeddingBatcher batcher;
    private final ChunkRegistry registry = new ChunkRegistry();
    private final List<Long> ids = new ArrayList<>();
    private final List<float[]> vectors = new ArrayList<>();

    public LocalVectorStore(Path directory, EmbeddingBatcher batcher) {
        this.directory = directory;
        this.batcher = batcher;
    }

    @Override
    public AddResult add(List<Chunk> chunks) {
        ChunkRegistry.AddPlan plan = registry.plan(chunks);
        if (plan.fresh().isEmpty()) {
            log.info("index.add store=local added=0 duplicates={}", plan.duplicates());
            return new AddResult(0, plan.duplicates());
        }

        List<EmbeddingInput> inputs = plan.fresh().stream()
                .map(chunk -> new EmbeddingInput(chunk.content(), chunk.image()))
                .toList();
        List<float[]> embedded = batcher.embed(inputs);
        int width = registry.requireDimension(embedded);

        List<Chunk> assigned = registry.assignIds(plan.fresh());
        for (int i = 0; i < assigned.size(); i++) {
            ids.add(assigned.get(i).chunkId());
            vectors.add(embedded.get(i));
        }
        registry.register(assigned, width);
        log.info("index.add store=local added={} duplicates={} total={}", assigned.size(), plan.duplicates(), registry.size());
        return new AddResult(assigned.size(), plan.duplicates());
    }

    @Override
    public List<SearchResult> search(String query, int topK) {
        if (topK <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        float[] queryVector = batcher.embeddingService().embedQuery(query);
        if (queryVector.length != registry.dimension()) {
            throw new DimensionMismatchException(registry.dimension(), queryVector.length);
        }

        List<Neighbor> neighbors = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            neighbors.add(new Neighbor(ids.get(i), squaredL2(queryVector, vectors.get(i))));
        }
        neighbors.sort(Comparator.comparingDouble(Neighbor::distance).thenComparingLong(Neighbor::id));

        List<SearchResult> results = new ArrayList<>();
        for (Neighbor neighbor : neighbors.subList(0, Math.min(topK, neighbors.size()))) {
            Chunk chunk = registry.get(neighbor.id());
            if (chunk == null) {
                continue;
            }
            results.add(new SearchResult(chunk, (float) (1.0 / (1.0 + neighbor.distance()))));
        }
        return results;
    }

    @Override
    public void save() throws IOException {
        Files.createDirectories(directory);
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(directory.resolve(INDEX_FILE))))) {
            out.writeInt(MAGIC);
            out.writeInt(registry.dimension());
            out.writeInt(vectors.size());
            for (int i = 0; i < vectors.size(); i++) {
                out.writeLong(ids.get(i));
                for (float value : vectors.get(i)) {
                    out.writeFloat(value);
                }
            }
        }

        List<ChunkRecord> records = registry.all().stream()
                .map(chunk -> new ChunkRecord(chunk.chunkId(), chunk.content(), chunk.metadata()))
                .toList();
        Snapshot snapshot = new Snapshot(registry.dimension(), records.size(), records);
        SnakeCaseJson.mapper().writerWithDefaultPrettyPrinter()
                .writeValue(directory.resolve(METADATA_FILE).toFile(), snapshot);
        log.info("index.save store=local path={} chunks={}", directory, records.size());
    }

    @Override
    public boolean load() throws IOException {
        Path indexFile = directory.resolve(INDEX_FILE);
        Path metadataFile = directory.resolve(METADATA_FILE);
        if (!Files.exists(indexFile) || !Files.exists(metadataFile)) {
            return false;
        }

        Map<Long, float[]> loadedVectors = new HashMap<>();
        List<Long> order = new ArrayList<>();
        int dimension;
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(indexFile)))) {
            if (in.readInt() != MAGIC) {
                throw new IOException("Unrecognized index file: " + indexFile);
            }
            dimension = in.readInt();
            int count = in.readInt();
            for (int i = 0; i < count; i++) {
                long id = in.readLong();
                float[] vector = new float[dimension];
                for (int d = 0; d < dimension; d++) {
                    vector[d] = in.readFloat();
                }
                loadedVectors.put(id, vector);
                order.add(id);
            }
        }

        Snapshot snapshot = SnakeCaseJson.mapper().readValue(metadataFile.toFile(), Snapshot.class);
        if (snapshot.chunks().size() != loadedVectors.size()) {
            throw new IOException("Index holds " + loadedVectors.size() + " vectors but metadata lists " + snapshot.chunks().size() + " chunks");
        }
        List<Chunk> restored = new ArrayList<>();
        for (ChunkRecord record : snapshot.chunks()) {
            if (!loadedVectors.containsKey(record.chunkId())) {
                throw new IOException("No vector stored for chunk " + record.chunkId());
            }
            restored.add(new Chunk(record.content(), record.metadata(), record.chunkId(), null));
        }

        ids.clear();
        vectors.clear();
        for (Long id : order) {
            ids.add(id);
            vectors.add(loadedVectors.get(id));
        }
        registry.restore(restored, dimension);
        log.info("index.load store=local path={} chunks={} dimension={}", directory, registry.size(), dimension);
        return true;
    }

    @Override
    public void clear() throws IOException {
        registry.clear();
        ids.clear();
        vectors.clear();
        Files.deleteIfExists(directory.resolve(INDEX_FILE));
        Files.deleteIfExists(directory.resolve(METADATA_FILE));
        log.info("index.clear store=local path={}", directory);
    }

    @Override
    public IndexStats stats() {
        return new IndexStats(registry.size(), registry.dimension(), vectors.size(), registry.sources(), "local");
    }

    @Override
    public int size() {
        return registry.size();
    }

    static double squaredL2(float[] a, float[] b) {
        double sum = 0d;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    private record Neighbor(long id, double distance) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChunkRecord(long chunkId, String content, ChunkMetadata metadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Snapshot(int dimension, int numChunks, List<ChunkRecord> chunks) {
        Snapshot {
            chunks = chunks == null ? List.of() : chunks;
        }
    }
}

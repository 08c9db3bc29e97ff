package com.ragpipe.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.ragpipe.document.Chunk;

/**
 * Chunk records, dedup keys and the fixed embedding width of one store. Ids are handed out
 * densely from the current count and are never reused.
 */
class ChunkRegistry {
    private final Map<Long, Chunk> chunks = new LinkedHashMap<>();
    private final Set<String> dedupKeys = new HashSet<>();
    private int dimension;

    AddPlan plan(List<Chunk> incoming) {
        Set<String> seen = new HashSet<>(dedupKeys);
        List<Chunk> fresh = new ArrayList<>();
        int duplicates = 0;
        for (Chunk chunk : incoming) {
            if (seen.add(chunk.dedupKey())) {
                fresh.add(chunk);
            } else {
                duplicates++;
            }
        }
        return new AddPlan(fresh, duplicates);
    }

    int requireDimension(List<float[]> vectors) {
        int expected = dimension;
        for (float[] vector : vectors) {
            if (vector.length == 0) {
                throw new IllegalStateException("Embedding service returned an empty vector");
            }
            if (expected == 0) {
                expected = vector.length;
            }
            if (vector.length != expected) {
                throw new DimensionMismatchException(expected, vector.length);
            }
        }
        return expected;
    }

    List<Chunk> assignIds(List<Chunk> fresh) {
        long next = chunks.size();
        List<Chunk> assigned = new ArrayList<>(fresh.size());
        for (Chunk chunk : fresh) {
            assigned.add(new Chunk(chunk.content(), chunk.metadata(), next++, null));
        }
        return assigned;
    }

    void register(List<Chunk> assigned, int width) {
        if (dimension == 0) {
            dimension = width;
        }
        for (Chunk chunk : assigned) {
            chunks.put(chunk.chunkId(), chunk);
            dedupKeys.add(chunk.dedupKey());
        }
    }

    void restore(Collection<Chunk> restored, int width) {
        clear();
        register(new ArrayList<>(restored), width);
    }

    Chunk get(long id) {
        return chunks.get(id);
    }

    Collection<Chunk> all() {
        return chunks.values();
    }

    int size() {
        return chunks.size();
    }

    int dimension() {
        return dimension;
    }

    List<String> sources() {
        Set<String> sources = new TreeSet<>();
        for (Chunk chunk : chunks.values()) {
            sources.add(chunk.source());
        }
        return List.copyOf(sources);
    }

    void clear() {
        chunks.clear();
        dedupKeys.clear();
        dimension = 0;
    }

    record AddPlan(List<Chunk> fresh, int duplicates) {
    }
}

package com.ragpipe.index;

import java.io.IOException;
import java.util.List;

import com.ragpipe.document.Chunk;

/**
 * Contract shared by every vector backend. {@code add} is single-caller and must not run
 * concurrently with {@code search}; concurrent searches are allowed.
 */
public interface VectorStore {
    /**
     * Embeds and indexes chunks whose dedup key is not yet present. Nothing is mutated when
     * embedding fails.
     */
    AddResult add(List<Chunk> chunks) throws IOException;

    /**
     * Returns up to {@code topK} results, best first, with higher scores meaning closer.
     */
    List<SearchResult> search(String query, int topK) throws IOException;

    void save() throws IOException;

    /**
     * Restores previously persisted state. Returns {@code false} when there is nothing to load.
     */
    boolean load() throws IOException;

    void clear() throws IOException;

    IndexStats stats();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}

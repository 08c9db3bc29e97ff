package com.ragpipe.index;

import java.util.List;

public record IndexStats(int numChunks, int dimension, long indexSize, List<String> sources, String storeType) {
    public IndexStats {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}

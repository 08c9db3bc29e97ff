package com.ragpipe.index;

import com.ragpipe.document.Chunk;

public record SearchResult(Chunk chunk, float score) {
}

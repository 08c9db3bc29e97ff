package com.ragpipe.document;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkMetadata(
        String source,
        String filename,
        String type,
        Integer totalPages,
        String processor,
        Map<String, String> extras,
        int chunkIndex,
        int totalChunks,
        int chunkSizeUsed,
        int chunkOverlapUsed,
        String chunkingMode,
        String chunkContentHash,
        String documentContentHash,
        String contentType,
        String embeddingModelVersion,
        Integer pageNumber) {

    public ChunkMetadata {
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static ChunkMetadata forText(String source, String chunkContent) {
        return new ChunkMetadata(source, "", "text", null, null, Map.of(), 0, 1, 0, 0, "character",
                ContentHashes.sha256(chunkContent), null, "default", "", null);
    }
}

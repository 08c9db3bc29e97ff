package com.ragpipe.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Chunk(String content, ChunkMetadata metadata, Long chunkId, @JsonIgnore byte[] image) {

    public Chunk {
        content = content == null ? "" : content;
    }

    public Chunk(String content, ChunkMetadata metadata) {
        this(content, metadata, null, null);
    }

    @JsonIgnore
    public boolean hasImage() {
        return image != null && image.length > 0;
    }

    /**
     * Chunk-level hash when present, document-level hash otherwise, and a hash of the text
     * itself for chunks built outside the chunking engine.
     */
    @JsonIgnore
    public String dedupKey() {
        if (metadata != null && metadata.chunkContentHash() != null && !metadata.chunkContentHash().isBlank()) {
            return metadata.chunkContentHash();
        }
        if (metadata != null && metadata.documentContentHash() != null && !metadata.documentContentHash().isBlank()) {
            return metadata.documentContentHash();
        }
        return ContentHashes.sha256(content);
    }

    @JsonIgnore
    public String source() {
        return metadata == null ? "unknown" : metadata.source();
    }
}

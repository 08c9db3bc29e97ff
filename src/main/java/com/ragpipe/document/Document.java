package com.ragpipe.document;

import java.time.Instant;
import java.util.List;

public record Document(
        String content,
        DocumentMetadata metadata,
        String contentHash,
        Instant ingestionTimestamp,
        List<ExtractedPage> pages) {

    public Document {
        content = content == null ? "" : content;
        metadata = metadata == null ? DocumentMetadata.ofSource(null, null, null) : metadata;
        contentHash = contentHash == null ? ContentHashes.sha256(content) : contentHash;
        ingestionTimestamp = ingestionTimestamp == null ? Instant.now() : ingestionTimestamp;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static Document of(String content, DocumentMetadata metadata) {
        return new Document(content, metadata, null, null, List.of());
    }

    public static Document withPages(String content, DocumentMetadata metadata, List<ExtractedPage> pages) {
        return new Document(content, metadata, null, null, pages);
    }
}

package com.ragpipe.ingest;

public record IngestionReport(
        int filesSeen,
        int filesFailed,
        int documents,
        int chunks,
        int chunksAdded,
        int duplicates,
        ExecutionMode mode) {
}

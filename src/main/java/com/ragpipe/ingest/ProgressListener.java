package com.ragpipe.ingest;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total, outcome) -> {
    };

    void onProgress(int completed, int total, FileOutcome outcome);
}

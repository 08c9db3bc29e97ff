package com.ragpipe.ingest;

import java.util.List;

import com.ragpipe.document.Document;

public record LoadReport(List<FileOutcome> outcomes, ExecutionMode mode, boolean fellBackToSequential) {
    public LoadReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<Document> documents() {
        return outcomes.stream().filter(FileOutcome::ok).map(FileOutcome::document).toList();
    }

    public List<FileOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.ok()).toList();
    }

    public int succeeded() {
        return (int) outcomes.stream().filter(FileOutcome::ok).count();
    }

    public int failed() {
        return outcomes.size() - succeeded();
    }
}

package com.ragpipe.retrieval;

import java.util.List;

public record QueryResponse(String question, String context, RetrievalOutcome outcome) {
    public List<RankedResult> results() {
        return outcome.results();
    }
}

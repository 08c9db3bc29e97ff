package com.ragpipe.retrieval;

import java.util.List;

import com.ragpipe.index.SearchResult;

public record RetrievalOutcome(List<SearchResult> candidates, List<RankedResult> results, boolean reranked, boolean fellBack) {
    public RetrievalOutcome {
        candidates = List.copyOf(candidates);
        results = List.copyOf(results);
    }
}

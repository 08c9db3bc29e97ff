package com.ragpipe.retrieval;

import java.util.List;

public interface Reranker {
    /**
     * Scores {@code documents} against {@code query} and returns at most {@code topN} entries whose
     * {@code index} points into {@code documents}.
     */
    List<RerankScore> rerank(String query, List<String> documents, int topN) throws RerankException;
}

package com.ragpipe.retrieval;

import com.ragpipe.document.Chunk;
import com.ragpipe.index.SearchResult;

public record RankedResult(Chunk chunk, float score, Float rerankScore, Integer originalRank, Integer newRank) {

    public static RankedResult unranked(SearchResult result) {
        return new RankedResult(result.chunk(), result.score(), null, null, null);
    }

    public static RankedResult candidate(SearchResult result, int originalRank) {
        return new RankedResult(result.chunk(), result.score(), null, originalRank, null);
    }

    public RankedResult reranked(float relevance, int rank) {
        return new RankedResult(chunk, score, relevance, originalRank, rank);
    }

    public boolean isReranked() {
        return rerankScore != null;
    }
}

package com.ragpipe.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragpipe.index.SearchResult;
import com.ragpipe.index.VectorStore;

/**
 * Two-stage retrieval: a broad vector search followed by an optional rerank pass. Reranking is
 * best effort; any failure falls back to vector-search order.
 */
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final VectorStore store;
    private final Reranker reranker;
    private final int candidateCount;
    private final int defaultTopK;

    public RetrievalService(VectorStore store, Reranker reranker, int candidateCount, int defaultTopK) {
        this.store = store;
        this.reranker = reranker;
        this.candidateCount = candidateCount;
        this.defaultTopK = Math.max(1, defaultTopK);
    }

    public static RetrievalService withoutReranker(VectorStore store, int defaultTopK) {
        return new RetrievalService(store, null, 0, defaultTopK);
    }

    public boolean rerankingEnabled() {
        return reranker != null;
    }

    public List<RankedResult> retrieve(String query, int topK) throws IOException {
        return retrieveOutcome(query, topK).results();
    }

    public RetrievalOutcome retrieveOutcome(String query, int topK) throws IOException {
        if (store.isEmpty()) {
            throw new IllegalStateException("The index is empty; ingest documents before querying");
        }
        int k = topK > 0 ? topK : defaultTopK;

        if (reranker == null) {
            List<SearchResult> results = store.search(query, k);
            return new RetrievalOutcome(results, results.stream().map(RankedResult::unranked).toList(), false, false);
        }

        List<SearchResult> candidates = store.search(query, Math.max(candidateCount, k));
        List<RankedResult> ranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            ranked.add(RankedResult.candidate(candidates.get(i), i + 1));
        }
        if (ranked.isEmpty()) {
            return new RetrievalOutcome(candidates, List.of(), false, false);
        }

        List<RerankScore> scores;
        try {
            List<String> documents = candidates.stream().map(result -> result.chunk().content()).toList();
            scores = reranker.rerank(query, documents, k);
            validate(scores, candidates.size());
        } catch (RerankException | RuntimeException e) {
            log.warn("retrieval.rerank.fallback candidates={} topK={} reason={}", candidates.size(), k, e.getMessage());
            return new RetrievalOutcome(candidates, ranked.subList(0, Math.min(k, ranked.size())), false, true);
        }

        List<RankedResult> merged = new ArrayList<>(scores.size());
        for (RerankScore score : scores) {
            merged.add(ranked.get(score.index()).reranked(score.relevanceScore(), 0));
        }
        merged.sort(Comparator.comparing(RankedResult::rerankScore, Comparator.reverseOrder())
                .thenComparing(RankedResult::originalRank));

        List<RankedResult> results = new ArrayList<>(Math.min(k, merged.size()));
        for (int i = 0; i < merged.size() && i < k; i++) {
            RankedResult result = merged.get(i);
            results.add(result.reranked(result.rerankScore(), i + 1));
        }
        log.debug("retrieval.reranked candidates={} returned={}", candidates.size(), results.size());
        return new RetrievalOutcome(candidates, results, true, false);
    }

    public QueryResponse query(String question, int topK) throws IOException {
        RetrievalOutcome outcome = retrieveOutcome(question, topK);
        return new QueryResponse(question, buildContext(outcome.results()), outcome);
    }

    public static String buildContext(List<RankedResult> results) {
        List<String> parts = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            RankedResult result = results.get(i);
            parts.add("[Source " + (i + 1) + ": " + result.chunk().source() + "]\n" + result.chunk().content() + "\n");
        }
        return String.join("\n---\n", parts);
    }

    private static void validate(List<RerankScore> scores, int candidates) throws RerankException {
        if (scores == null || scores.isEmpty()) {
            throw new RerankException("Reranker returned no scores");
        }
        Set<Integer> seen = new HashSet<>();
        for (RerankScore score : scores) {
            if (score.index() < 0 || score.index() >= candidates) {
                throw new RerankException("Rerank index " + score.index() + " is out of range");
            }
            if (!seen.add(score.index())) {
                throw new RerankException("Rerank index " + score.index() + " is repeated");
            }
            if (Float.isNaN(score.relevanceScore())) {
                throw new RerankException("Rerank score for index " + score.index() + " is not a number");
            }
        }
    }
}

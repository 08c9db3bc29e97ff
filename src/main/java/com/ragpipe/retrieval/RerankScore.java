package com.ragpipe.retrieval;

public record RerankScore(int index, float relevanceScore) {
}

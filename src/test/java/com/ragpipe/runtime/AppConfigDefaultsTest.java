package com.ragpipe.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToLocalStoreAndDisabledReranker() {
        AppConfig config = new AppConfig();

        assertEquals("local", config.getVectorStore().getType());
        assertFalse(config.getReranker().isEnabled());
        assertEquals(20, config.getReranker().getCandidateCount());
        assertEquals(5, config.getReranker().getFinalTopK());
        assertEquals(500, config.getChunking().getChunkSize());
        assertEquals(50, config.getChunking().getChunkOverlap());
        assertEquals(32, config.getEmbedding().getBatchSize());
        assertTrue(config.getIngestion().getParallel().isEnabled());
        assertEquals("auto", config.getIngestion().getParallel().getMode());
        assertEquals(5, config.getRetrieval().getTopK());
        assertEquals("http://localhost:19530", config.getVectorStore().getMilvus().baseUrl());
        assertTrue(config.getChunking().getProfiles().keySet().containsAll(List.of("code", "table", "documentation")));
    }

    @Test
    void shouldOverrideFromEnvironment() {
        AppConfig config = new AppConfig().applyEnvironment(Map.of(
                "EMBEDDING_API_URL", "http://embed:8000/v1/embeddings",
                "RERANKER_ENABLED", "Yes",
                "RERANKER_API_URL", "http://rerank:8001/v1/rerank",
                "VECTOR_STORE_TYPE", "milvus",
                "MILVUS_HOST", "milvus.internal",
                "MILVUS_PORT", "29530",
                "MILVUS_COLLECTION_NAME", "papers",
                "EXTRACTION_API_URL", " "));

        assertEquals("http://embed:8000/v1/embeddings", config.getEmbedding().getApiUrl());
        assertTrue(config.getReranker().isEnabled());
        assertEquals("http://rerank:8001/v1/rerank", config.getReranker().getApiUrl());
        assertEquals("milvus", config.getVectorStore().getType());
        assertEquals("http://milvus.internal:29530", config.getVectorStore().getMilvus().baseUrl());
        assertEquals("papers", config.getVectorStore().getMilvus().getCollectionName());
        assertEquals("", config.getIngestion().getExtraction().getApiUrl());
    }

    @Test
    void shouldLoadBundledApplicationYaml() throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config;
        try (InputStream in = getClass().getResourceAsStream("/application.yml")) {
            assertNotNull(in);
            config = mapper.readValue(in, AppConfig.class);
        }

        assertEquals(500, config.getChunking().getChunkSize());
        assertEquals(1000, config.getChunking().getProfiles().get("code").getChunkSize());
        assertEquals(2, config.getChunking().getProfiles().get("table").getContentPatterns().size());
        assertEquals("\t", config.getChunking().getProfiles().get("table").getContentPatterns().get(1));
        assertEquals("rag_documents", config.getVectorStore().getMilvus().getCollectionName());
        assertEquals(100, config.getIngestion().getParallel().getStaggerMs());
    }

    @Test
    void shouldKeepDefaultsForKeysMissingFromYaml() throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig config = mapper.readValue("""
                chunking:
                  chunkSize: 256
                unknownSection:
                  anything: true
                """, AppConfig.class);

        assertEquals(256, config.getChunking().getChunkSize());
        assertEquals(50, config.getChunking().getChunkOverlap());
        assertEquals("local", config.getVectorStore().getType());
    }
}

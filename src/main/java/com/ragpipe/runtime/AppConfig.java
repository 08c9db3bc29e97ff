package com.ragpipe.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private RerankerConfig reranker = new RerankerConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private QueryLogConfig queryLog = new QueryLogConfig();

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public RerankerConfig getReranker() {
        return reranker;
    }

    public void setReranker(RerankerConfig reranker) {
        this.reranker = reranker == null ? new RerankerConfig() : reranker;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public VectorStoreConfig getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStoreConfig vectorStore) {
        this.vectorStore = vectorStore == null ? new VectorStoreConfig() : vectorStore;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public QueryLogConfig getQueryLog() {
        return queryLog;
    }

    public void setQueryLog(QueryLogConfig queryLog) {
        this.queryLog = queryLog == null ? new QueryLogConfig() : queryLog;
    }

    /**
     * Applies the supported environment variables on top of the file-based values.
     * Blank variables are ignored.
     */
    public AppConfig applyEnvironment(Map<String, String> env) {
        ifPresent(env, "EMBEDDING_API_URL", embedding::setApiUrl);
        ifPresent(env, "EMBEDDING_API_KEY", embedding::setApiKey);
        ifPresent(env, "RERANKER_API_URL", reranker::setApiUrl);
        ifPresent(env, "RERANKER_BACKEND", reranker::setBackend);
        ifPresent(env, "RERANKER_ENABLED", value -> reranker.setEnabled(isTruthy(value)));
        ifPresent(env, "VECTOR_STORE_TYPE", vectorStore::setType);
        ifPresent(env, "EXTRACTION_API_URL", ingestion.getExtraction()::setApiUrl);
        MilvusConfig milvus = vectorStore.getMilvus();
        ifPresent(env, "MILVUS_HOST", milvus::setHost);
        ifPresent(env, "MILVUS_PORT", value -> milvus.setPort(Integer.parseInt(value.trim())));
        ifPresent(env, "MILVUS_USER", milvus::setUser);
        ifPresent(env, "MILVUS_PASSWORD", milvus::setPassword);
        ifPresent(env, "MILVUS_DB_NAME", milvus::setDbName);
        ifPresent(env, "MILVUS_COLLECTION_NAME", milvus::setCollectionName);
        return this;
    }

    private static void ifPresent(Map<String, String> env, String key, Consumer<String> setter) {
        String value = env.get(key);
        if (value != null && !value.isBlank()) {
            setter.accept(value);
        }
    }

    private static boolean isTruthy(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String apiUrl = "";
        private String apiKey = "";
        private String model = "";
        private String modelVersion = "";
        private int timeoutMs = 60000;
        private int batchSize = 32;
        private int maxConcurrentRequests = 1;
        private int maxRetries = 2;
        private long retryDelayMs = 1000;
        private int offlineDimension = 384;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl == null ? "" : apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model == null ? "" : model;
        }

        public String getModelVersion() {
            return modelVersion;
        }

        public void setModelVersion(String modelVersion) {
            this.modelVersion = modelVersion == null ? "" : modelVersion;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public int getOfflineDimension() {
            return offlineDimension;
        }

        public void setOfflineDimension(int offlineDimension) {
            this.offlineDimension = offlineDimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankerConfig {
        private boolean enabled = false;
        private String backend = "rerank";
        private String apiUrl = "";
        private String model = "Qwen3-VL-Reranker-8B";
        private int timeoutMs = 30000;
        private int maxRetries = 3;
        private long retryDelayMs = 500;
        private int candidateCount = 20;
        private int finalTopK = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend == null || backend.isBlank() ? "rerank" : backend;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl == null ? "" : apiUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public int getCandidateCount() {
            return candidateCount;
        }

        public void setCandidateCount(int candidateCount) {
            this.candidateCount = candidateCount;
        }

        public int getFinalTopK() {
            return finalTopK;
        }

        public void setFinalTopK(int finalTopK) {
            this.finalTopK = finalTopK;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private String mode = "character";
        private String encoding = "cl100k_base";
        private int chunkSize = 500;
        private int chunkOverlap = 50;
        private int minChunkSize = 1;
        private int tableThreshold = 10;
        private boolean pageChunking = false;
        private Map<String, ProfileConfig> profiles = defaultProfiles();

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode == null ? "character" : mode;
        }

        public String getEncoding() {
            return encoding;
        }

        public void setEncoding(String encoding) {
            this.encoding = encoding;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getMinChunkSize() {
            return minChunkSize;
        }

        public void setMinChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
        }

        public int getTableThreshold() {
            return tableThreshold;
        }

        public void setTableThreshold(int tableThreshold) {
            this.tableThreshold = tableThreshold;
        }

        public boolean isPageChunking() {
            return pageChunking;
        }

        public void setPageChunking(boolean pageChunking) {
            this.pageChunking = pageChunking;
        }

        public Map<String, ProfileConfig> getProfiles() {
            return profiles;
        }

        public void setProfiles(Map<String, ProfileConfig> profiles) {
            this.profiles = profiles == null ? new LinkedHashMap<>() : new LinkedHashMap<>(profiles);
        }

        static Map<String, ProfileConfig> defaultProfiles() {
            Map<String, ProfileConfig> profiles = new LinkedHashMap<>();
            profiles.put("code", new ProfileConfig(1000, 100, 20, 2000,
                    List.of(".py", ".java", ".js", ".ts", ".go", ".rs", ".c", ".cpp", ".h", ".cs", ".rb", ".kt", ".sh"),
                    List.of()));
            profiles.put("table", new ProfileConfig(1500, 0, 20, 3000,
                    List.of(".csv", ".tsv"),
                    List.of("|", "\t")));
            profiles.put("documentation", new ProfileConfig(800, 100, 20, 1500,
                    List.of(".md", ".rst", ".adoc", ".html"),
                    List.of()));
            return profiles;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfig {
        private int chunkSize;
        // null inherits the global overlap; 0 is an explicit "no overlap"
        private Integer chunkOverlap;
        private int minChunkSize;
        private int maxChunkSize;
        private List<String> extensions = new ArrayList<>();
        private List<String> contentPatterns = new ArrayList<>();

        public ProfileConfig() {
        }

        public ProfileConfig(int chunkSize, int chunkOverlap, int minChunkSize, int maxChunkSize,
                List<String> extensions, List<String> contentPatterns) {
            this.chunkSize = chunkSize;
            this.chunkOverlap = chunkOverlap;
            this.minChunkSize = minChunkSize;
            this.maxChunkSize = maxChunkSize;
            this.extensions = new ArrayList<>(extensions);
            this.contentPatterns = new ArrayList<>(contentPatterns);
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public Integer getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(Integer chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getMinChunkSize() {
            return minChunkSize;
        }

        public void setMinChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
        }

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null ? new ArrayList<>() : extensions;
        }

        public List<String> getContentPatterns() {
            return contentPatterns;
        }

        public void setContentPatterns(List<String> contentPatterns) {
            this.contentPatterns = contentPatterns == null ? new ArrayList<>() : contentPatterns;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private List<String> extensions = List.of(".txt", ".md", ".py", ".js", ".html", ".css", ".json", ".pdf");
        private ParallelConfig parallel = new ParallelConfig();
        private ExtractionConfig extraction = new ExtractionConfig();

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null || extensions.isEmpty()
                    ? List.of(".txt", ".md", ".py", ".js", ".html", ".css", ".json", ".pdf")
                    : extensions;
        }

        public ParallelConfig getParallel() {
            return parallel;
        }

        public void setParallel(ParallelConfig parallel) {
            this.parallel = parallel == null ? new ParallelConfig() : parallel;
        }

        public ExtractionConfig getExtraction() {
            return extraction;
        }

        public void setExtraction(ExtractionConfig extraction) {
            this.extraction = extraction == null ? new ExtractionConfig() : extraction;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParallelConfig {
        private boolean enabled = true;
        private String mode = "auto";
        private int maxWorkers = 0;
        private int minFilesForParallel = 2;
        private long staggerMs = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode == null ? "auto" : mode;
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public int getMinFilesForParallel() {
            return minFilesForParallel;
        }

        public void setMinFilesForParallel(int minFilesForParallel) {
            this.minFilesForParallel = minFilesForParallel;
        }

        public long getStaggerMs() {
            return staggerMs;
        }

        public void setStaggerMs(long staggerMs) {
            this.staggerMs = staggerMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractionConfig {
        private String apiUrl = "";
        private int timeoutMs = 120000;
        private List<String> extensions = List.of(".pdf", ".pptx", ".docx");
        private boolean renderImages = false;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl == null ? "" : apiUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null ? List.of() : extensions;
        }

        public boolean isRenderImages() {
            return renderImages;
        }

        public void setRenderImages(boolean renderImages) {
            this.renderImages = renderImages;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorStoreConfig {
        private String type = "local";
        private String path = "vector_store";
        private MilvusConfig milvus = new MilvusConfig();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type == null ? "local" : type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public MilvusConfig getMilvus() {
            return milvus;
        }

        public void setMilvus(MilvusConfig milvus) {
            this.milvus = milvus == null ? new MilvusConfig() : milvus;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MilvusConfig {
        private String scheme = "http";
        private String host = "localhost";
        private int port = 19530;
        private String user = "";
        private String password = "";
        private String dbName = "default";
        private String collectionName = "rag_documents";
        private String indexType = "IVF_FLAT";
        private String metricType = "L2";
        private int timeoutMs = 30000;
        private int maxRetries = 2;
        private long retryDelayMs = 1000;

        public String getScheme() {
            return scheme;
        }

        public void setScheme(String scheme) {
            this.scheme = scheme;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user == null ? "" : user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password == null ? "" : password;
        }

        public String getDbName() {
            return dbName;
        }

        public void setDbName(String dbName) {
            this.dbName = dbName;
        }

        public String getCollectionName() {
            return collectionName;
        }

        public void setCollectionName(String collectionName) {
            this.collectionName = collectionName;
        }

        public String getIndexType() {
            return indexType;
        }

        public void setIndexType(String indexType) {
            this.indexType = indexType;
        }

        public String getMetricType() {
            return metricType;
        }

        public void setMetricType(String metricType) {
            this.metricType = metricType;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public String baseUrl() {
            return scheme + "://" + host + ":" + port;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 5;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryLogConfig {
        private boolean enabled = false;
        private String outputDir = "query_results";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }
    }
}

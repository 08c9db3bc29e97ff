package com.ragpipe.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragpipe.document.ChunkMetadata;
import com.ragpipe.document.SnakeCaseJson;
import com.ragpipe.index.SearchResult;

/**
 * Writes each query to its own {@code <yyyyMMdd_HHmmss>_<slug>} folder holding the query
 * metadata, the raw vector hits and, when reranking ran, the reranked list.
 */
public class QueryResultLog {
    private static final Logger log = LoggerFactory.getLogger(QueryResultLog.class);
    static final String METADATA_FILE = "query_metadata.json";
    static final String RAW_FILE = "raw_retrieval.json";
    static final String RERANKED_FILE = "reranked_results.json";
    private static final DateTimeFormatter FOLDER_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_SLUG_LENGTH = 50;

    private final Path outputDir;
    private final Clock clock;
    private final ObjectMapper mapper = SnakeCaseJson.mapper();

    public QueryResultLog(Path outputDir) {
        this(outputDir, Clock.systemDefaultZone());
    }

    public QueryResultLog(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    public Path save(String query, List<SearchResult> raw, List<RankedResult> reranked, Map<String, Object> extra) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        String timestamp = now.toString();
        Path folder = uniqueFolder(FOLDER_TIMESTAMP.format(now) + "_" + slug(query));
        Files.createDirectories(folder);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("query", query);
        metadata.put("timestamp", timestamp);
        metadata.put("raw_result_count", raw.size());
        metadata.put("reranked_result_count", reranked == null ? 0 : reranked.size());
        metadata.put("reranker_used", reranked != null);
        if (extra != null) {
            metadata.putAll(extra);
        }
        write(folder.resolve(METADATA_FILE), metadata);

        List<SavedResult> rawResults = raw.stream().map(SavedResult::of).toList();
        write(folder.resolve(RAW_FILE), new ResultFile(query, timestamp, rawResults.size(), rawResults));
        if (reranked != null && !reranked.isEmpty()) {
            List<SavedResult> rerankedResults = reranked.stream().map(SavedResult::of).toList();
            write(folder.resolve(RERANKED_FILE), new ResultFile(query, timestamp, rerankedResults.size(), rerankedResults));
        }
        log.info("query.saved path={} raw={} reranked={}", folder, raw.size(), reranked == null ? 0 : reranked.size());
        return folder;
    }

    /**
     * Saved query folders, newest first.
     */
    public List<Path> list() throws IOException {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(outputDir)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(dir -> Files.exists(dir.resolve(METADATA_FILE)))
                    .sorted(Comparator.comparing((Path dir) -> dir.getFileName().toString()).reversed())
                    .toList();
        }
    }

    public SavedQuery load(Path folder) throws IOException {
        Map<String, Object> metadata = Files.exists(folder.resolve(METADATA_FILE))
                ? mapper.readValue(folder.resolve(METADATA_FILE).toFile(), new TypeReference<Map<String, Object>>() {
                })
                : Map.of();
        ResultFile raw = Files.exists(folder.resolve(RAW_FILE))
                ? mapper.readValue(folder.resolve(RAW_FILE).toFile(), ResultFile.class)
                : null;
        ResultFile reranked = Files.exists(folder.resolve(RERANKED_FILE))
                ? mapper.readValue(folder.resolve(RERANKED_FILE).toFile(), ResultFile.class)
                : null;
        return new SavedQuery(folder, metadata, raw, reranked);
    }

    static String slug(String query) {
        StringBuilder builder = new StringBuilder(query.length());
        for (char c : query.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                builder.append(c);
            } else {
                builder.append('_');
            }
        }
        String slug = builder.length() > MAX_SLUG_LENGTH ? builder.substring(0, MAX_SLUG_LENGTH) : builder.toString();
        int end = slug.length();
        while (end > 0 && slug.charAt(end - 1) == '_') {
            end--;
        }
        return end == 0 ? "query" : slug.substring(0, end);
    }

    private Path uniqueFolder(String name) {
        Path candidate = outputDir.resolve(name);
        int suffix = 2;
        while (Files.exists(candidate)) {
            candidate = outputDir.resolve(name + "_" + suffix++);
        }
        return candidate;
    }

    private void write(Path path, Object value) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), value);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SavedResult(
            String content,
            float score,
            Long chunkId,
            ChunkMetadata metadata,
            Float rerankScore,
            Integer originalRank,
            Integer newRank) {

        static SavedResult of(SearchResult result) {
            return new SavedResult(result.chunk().content(), result.score(), result.chunk().chunkId(),
                    result.chunk().metadata(), null, null, null);
        }

        static SavedResult of(RankedResult result) {
            return new SavedResult(result.chunk().content(), result.score(), result.chunk().chunkId(),
                    result.chunk().metadata(), result.rerankScore(), result.originalRank(), result.newRank());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResultFile(String query, String timestamp, int resultCount, List<SavedResult> results) {
        public ResultFile {
            results = results == null ? new ArrayList<>() : results;
        }
    }

    public record SavedQuery(Path folder, Map<String, Object> metadata, ResultFile raw, ResultFile reranked) {
    }
}

package com.ragpipe;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragpipe.chunking.ChunkingEngine;
import com.ragpipe.embedding.EmbeddingBatcher;
import com.ragpipe.embedding.EmbeddingService;
import com.ragpipe.embedding.EmbeddingServices;
import com.ragpipe.index.IndexStats;
import com.ragpipe.index.VectorStore;
import com.ragpipe.index.VectorStores;
import com.ragpipe.ingest.DocumentExtractor;
import com.ragpipe.ingest.DocumentLoader;
import com.ragpipe.ingest.FileOutcome;
import com.ragpipe.ingest.IngestionReport;
import com.ragpipe.ingest.IngestionService;
import com.ragpipe.ingest.PlainTextExtractor;
import com.ragpipe.ingest.RemoteDocumentExtractor;
import com.ragpipe.retrieval.QueryResponse;
import com.ragpipe.retrieval.QueryResultLog;
import com.ragpipe.retrieval.RankedResult;
import com.ragpipe.retrieval.Rerankers;
import com.ragpipe.retrieval.RetrievalService;
import com.ragpipe.runtime.AppConfig;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "ragpipe",
        mixinStandardHelpOptions = true,
        version = "ragpipe 0.1.0",
        description = "Ingest documents into a vector index and query them with optional reranking.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_EMPTY_INDEX = 3;
    static final long STOP_GRACE_SECONDS = 120;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "interactive")
    Mode mode;

    @Option(names = "--file", description = "Single file to ingest")
    Path file;

    @Option(names = "--directory", description = "Directory to ingest")
    Path directory;

    @Option(names = "--text", description = "Raw text to ingest")
    String text;

    @Option(names = "--source", description = "Source label for --text", defaultValue = "direct_input")
    String source;

    @Option(names = "--extensions", split = ",", description = "File extensions to include, e.g. .txt,.md")
    List<String> extensions;

    @Option(names = "--no-recursive", description = "Only ingest the top level of --directory")
    boolean noRecursive;

    @Option(names = { "-q", "--query" }, description = "Question for query mode")
    String query;

    @Option(names = "--top-k", description = "Number of results to return (defaults to retrieval.topK)", defaultValue = "0")
    int topK;

    @Option(names = "--context-only", description = "Print only the assembled context")
    boolean contextOnly;

    @Option(names = "--verbose", description = "Print scores and metadata for every result")
    boolean verbose;

    @Option(names = "--save-results", description = "Write query results to the query log directory")
    boolean saveResults;

    @Option(names = "--yes", description = "Skip the confirmation prompt in clear mode")
    boolean assumeYes;

    Map<String, String> environment = System.getenv();
    InputStream in = System.in;
    PrintStream out = System.out;
    PrintStream err = System.err;
    StopSignal stopSignal = Main::onShutdown;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        ingest,
        query,
        stats,
        clear,
        interactive
    }

    /**
     * Hooks a stop action to the process being asked to stop (Ctrl-C). The returned handle
     * withdraws the action once it is no longer needed.
     */
    @FunctionalInterface
    interface StopSignal {
        Runnable register(Runnable onStop);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath).applyEnvironment(environment);
        log.info("Starting ragpipe in {} mode", mode);
        log.info("Using config file: {} store={}", configPath, config.getVectorStore().getType());

        EmbeddingService embeddingService = EmbeddingServices.fromConfig(httpClient, config.getEmbedding());
        EmbeddingBatcher batcher = new EmbeddingBatcher(
                embeddingService,
                config.getEmbedding().getBatchSize(),
                config.getEmbedding().getMaxConcurrentRequests());
        VectorStore store = VectorStores.create(config, batcher, httpClient);
        store.load();

        return switch (mode) {
            case ingest -> runIngest(config, store, embeddingService);
            case query -> runQuery(config, store);
            case stats -> runStats(store);
            case clear -> runClear(store);
            case interactive -> runInteractive(config, store);
        };
    }

    AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private int runIngest(AppConfig config, VectorStore store, EmbeddingService embeddingService) throws IOException {
        int inputs = (file == null ? 0 : 1) + (directory == null ? 0 : 1) + (text == null ? 0 : 1);
        if (inputs != 1) {
            err.println("Error: ingest mode needs exactly one of --file, --directory or --text");
            return EXIT_USAGE_ERROR;
        }

        DocumentLoader loader = new DocumentLoader(extractors(config), config.getIngestion().getParallel());
        ChunkingEngine chunkingEngine = ChunkingEngine.fromConfig(config, embeddingService.version());
        IngestionService ingestionService = new IngestionService(loader, chunkingEngine, store);

        CountDownLatch finished = new CountDownLatch(1);
        Runnable withdraw = () -> {
        };
        if (directory != null) {
            withdraw = stopSignal.register(() -> stopAndAwait(ingestionService, finished));
        }
        try {
            return ingest(config, store, ingestionService);
        } finally {
            finished.countDown();
            withdraw.run();
        }
    }

    private int ingest(AppConfig config, VectorStore store, IngestionService ingestionService) throws IOException {
        IngestionReport report;
        if (directory != null) {
            List<String> wanted = extensions == null || extensions.isEmpty()
                    ? config.getIngestion().getExtensions()
                    : normalizeExtensions(extensions);
            out.printf("Loading documents from %s%n", directory);
            AtomicInteger cancelled = new AtomicInteger();
            report = ingestionService.ingestDirectory(directory, wanted, !noRecursive, (completed, total, outcome) -> {
                if (FileOutcome.CANCELLED.equals(outcome.error())) {
                    cancelled.incrementAndGet();
                }
                if (outcome.ok()) {
                    out.printf("  [%d/%d] [OK] %s%n", completed, total, outcome.relativePath());
                } else {
                    out.printf("  [%d/%d] [FAIL] %s: %s%n", completed, total, outcome.relativePath(), outcome.error());
                }
            });
            out.printf("Loaded %d of %d files (%d failed, mode=%s)%n",
                    report.documents(), report.filesSeen(), report.filesFailed(), report.mode().label());
            if (cancelled.get() > 0) {
                out.printf("Stopped early: %d files were not processed%n", cancelled.get());
            }
        } else if (file != null) {
            report = ingestionService.ingestFile(file);
        } else {
            report = ingestionService.ingestText(text, source);
        }

        out.printf("Indexed %d new chunks (%d duplicates skipped) from %d chunks%n",
                report.chunksAdded(), report.duplicates(), report.chunks());
        IndexStats stats = store.stats();
        out.printf("Index now holds %d chunks%n", stats.numChunks());
        return EXIT_OK;
    }

    private void stopAndAwait(IngestionService ingestionService, CountDownLatch finished) {
        err.println("Stopping: files already being extracted will finish first");
        ingestionService.requestStop();
        try {
            if (!finished.await(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("ingest.stop.timeout graceSeconds={}", STOP_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static Runnable onShutdown(Runnable onStop) {
        Thread hook = new Thread(onStop, "ragpipe-ingest-stop");
        Runtime.getRuntime().addShutdownHook(hook);
        return () -> {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // already shutting down; the hook is running and waits for this batch
                log.debug("ingest.stop.hook.running reason={}", e.getMessage());
            }
        };
    }

    private int runQuery(AppConfig config, VectorStore store) throws IOException {
        if (query == null || query.isBlank()) {
            err.println("Error: --query is required in query mode");
            return EXIT_USAGE_ERROR;
        }
        if (store.isEmpty()) {
            err.println("Error: the index is empty. Ingest documents first with --mode ingest");
            return EXIT_EMPTY_INDEX;
        }
        RetrievalService retrievalService = retrievalService(config, store);
        answer(retrievalService, queryLog(config), query);
        return EXIT_OK;
    }

    private int runStats(VectorStore store) {
        IndexStats stats = store.stats();
        out.println("Index statistics");
        out.printf("  store type: %s%n", stats.storeType());
        out.printf("  chunks:     %d%n", stats.numChunks());
        out.printf("  dimension:  %d%n", stats.dimension());
        out.printf("  index size: %d%n", stats.indexSize());
        out.printf("  sources:    %d%n", stats.sources().size());
        for (String sourceName : stats.sources()) {
            out.printf("    - %s%n", sourceName);
        }
        return EXIT_OK;
    }

    private int runClear(VectorStore store) throws IOException {
        if (!assumeYes) {
            out.print("This deletes every indexed chunk. Type 'yes' to confirm: ");
            out.flush();
            String answer = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).readLine();
            if (answer == null || !"yes".equals(answer.trim().toLowerCase(Locale.ROOT))) {
                out.println("Cancelled.");
                return EXIT_OK;
            }
        }
        store.clear();
        out.println("Index cleared.");
        return EXIT_OK;
    }

    private int runInteractive(AppConfig config, VectorStore store) throws IOException {
        if (store.isEmpty()) {
            err.println("Error: the index is empty. Ingest documents first with --mode ingest");
            return EXIT_EMPTY_INDEX;
        }
        RetrievalService retrievalService = retrievalService(config, store);
        QueryResultLog queryLog = queryLog(config);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        out.printf("ragpipe ready with %d chunks. Type 'stats' for index details, 'exit' to quit.%n", store.size());
        while (true) {
            out.print("query> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if ("exit".equalsIgnoreCase(input) || "quit".equalsIgnoreCase(input)) {
                break;
            }
            if ("stats".equalsIgnoreCase(input)) {
                runStats(store);
                continue;
            }
            answer(retrievalService, queryLog, input);
        }
        return EXIT_OK;
    }

    private void answer(RetrievalService retrievalService, QueryResultLog queryLog, String question) throws IOException {
        QueryResponse response = retrievalService.query(question, topK);
        if (contextOnly) {
            out.println(response.context());
        } else {
            printResults(response);
        }
        if (queryLog != null) {
            Path saved = queryLog.save(
                    question,
                    response.outcome().candidates(),
                    response.outcome().reranked() ? response.results() : null,
                    Map.of("top_k", response.results().size(), "fell_back", response.outcome().fellBack()));
            out.printf("Results saved to %s%n", saved);
        }
    }

    private void printResults(QueryResponse response) {
        List<RankedResult> results = response.results();
        out.printf("Top %d results for: %s%n", results.size(), response.question());
        if (response.outcome().fellBack()) {
            out.println("(reranker unavailable, showing vector-search order)");
        }
        for (int i = 0; i < results.size(); i++) {
            RankedResult result = results.get(i);
            out.printf("%n[%d] %s%n", i + 1, result.chunk().source());
            if (verbose) {
                out.printf("    score=%s rerank=%s originalRank=%s chunkId=%s contentType=%s%n",
                        String.format(Locale.ROOT, "%.4f", result.score()),
                        result.rerankScore() == null ? "-" : String.format(Locale.ROOT, "%.4f", result.rerankScore()),
                        result.originalRank() == null ? "-" : result.originalRank(),
                        result.chunk().chunkId(),
                        result.chunk().metadata() == null ? "-" : result.chunk().metadata().contentType());
            }
            out.println(preview(result.chunk().content(), verbose ? 1000 : 300));
        }
    }

    private RetrievalService retrievalService(AppConfig config, VectorStore store) {
        AppConfig.RerankerConfig rerankerConfig = config.getReranker();
        int defaultTopK = rerankerConfig.isEnabled() ? rerankerConfig.getFinalTopK() : config.getRetrieval().getTopK();
        if (!rerankerConfig.isEnabled() || rerankerConfig.getApiUrl().isBlank()) {
            if (rerankerConfig.isEnabled()) {
                log.warn("reranker.disabled reason=no-api-url");
            }
            return RetrievalService.withoutReranker(store, config.getRetrieval().getTopK());
        }
        return new RetrievalService(
                store,
                Rerankers.fromConfig(httpClient, rerankerConfig),
                rerankerConfig.getCandidateCount(),
                defaultTopK);
    }

    private QueryResultLog queryLog(AppConfig config) {
        if (!saveResults && !config.getQueryLog().isEnabled()) {
            return null;
        }
        return new QueryResultLog(Path.of(config.getQueryLog().getOutputDir()));
    }

    private List<DocumentExtractor> extractors(AppConfig config) {
        AppConfig.ExtractionConfig extraction = config.getIngestion().getExtraction();
        List<DocumentExtractor> extractors = new ArrayList<>();
        if (!extraction.getApiUrl().isBlank()) {
            extractors.add(RemoteDocumentExtractor.fromConfig(httpClient, extraction));
        }
        extractors.add(new PlainTextExtractor(extraction.getExtensions()));
        return extractors;
    }

    private static List<String> normalizeExtensions(List<String> raw) {
        return raw.stream()
                .map(String::trim)
                .filter(ext -> !ext.isEmpty())
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .toList();
    }

    private static String preview(String content, int limit) {
        String flattened = content.strip();
        if (flattened.length() > limit) {
            return flattened.substring(0, limit) + "...";
        }
        return flattened;
    }
}

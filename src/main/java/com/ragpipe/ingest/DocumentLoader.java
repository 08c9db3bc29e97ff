package com.ragpipe.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragpipe.document.Document;
import com.ragpipe.document.DocumentMetadata;
import com.ragpipe.runtime.AppConfig;

/**
 * Enumerates files and extracts them into documents, sequentially or on a worker pool. Every
 * eligible file yields exactly one {@link FileOutcome}; a failing file never aborts the batch.
 */
public class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private final List<DocumentExtractor> extractors;
    private final AppConfig.ParallelConfig parallelConfig;
    private final PoolFactory poolFactory;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public DocumentLoader(List<DocumentExtractor> extractors, AppConfig.ParallelConfig parallelConfig) {
        this(extractors, parallelConfig, DocumentLoader::defaultPool);
    }

    DocumentLoader(List<DocumentExtractor> extractors, AppConfig.ParallelConfig parallelConfig, PoolFactory poolFactory) {
        this.extractors = List.copyOf(extractors);
        this.parallelConfig = parallelConfig;
        this.poolFactory = poolFactory;
    }

    /**
     * Stops handing out new files. Files already being extracted finish and report normally.
     * The request is permanent for this loader, including loads that have not started yet.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    public Document loadFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a regular file: " + file);
        }
        DocumentExtractor extractor = extractorFor(file);
        if (extractor == null) {
            throw new IOException("No extractor available for " + file.getFileName());
        }
        return extractor.extract(file);
    }

    public Document loadText(String text, String source) {
        return Document.of(text, DocumentMetadata.ofSource(source, "", "text"));
    }

    public LoadReport loadDirectory(Path root, List<String> extensions, boolean recursive) throws IOException {
        return loadDirectory(root, extensions, recursive, null, null, ProgressListener.NONE);
    }

    public LoadReport loadDirectory(Path root,
            List<String> extensions,
            boolean recursive,
            Boolean parallel,
            Integer maxWorkers,
            ProgressListener listener) throws IOException {
        List<Path> files = enumerate(root, extensions, recursive);
        List<ExtractionTask> tasks = new ArrayList<>(files.size());
        for (Path file : files) {
            int extractorIndex = extractorIndex(file);
            tasks.add(new ExtractionTask(
                    file,
                    root.relativize(file).toString(),
                    extractorIndex,
                    extractorIndex >= 0 && extractors.get(extractorIndex).remote()));
        }
        if (tasks.isEmpty()) {
            log.info("ingest.load root={} files=0", root);
            return new LoadReport(List.of(), ExecutionMode.SEQUENTIAL, false);
        }

        boolean parallelEnabled = parallel == null ? parallelConfig.isEnabled() : parallel;
        ExecutionMode mode = selectMode(tasks, parallelEnabled);
        int workers = resolveWorkers(maxWorkers, tasks.size());
        log.info("ingest.load root={} files={} mode={} workers={}", root, tasks.size(), mode.label(),
                mode == ExecutionMode.SEQUENTIAL ? 1 : workers);

        ProgressListener safeListener = listener == null ? ProgressListener.NONE : listener;
        AtomicInteger completed = new AtomicInteger();
        if (mode == ExecutionMode.SEQUENTIAL) {
            List<FileOutcome> outcomes = runSequentially(tasks, completed, tasks.size(), safeListener);
            return new LoadReport(outcomes, mode, false);
        }
        return runParallel(tasks, mode, workers, completed, safeListener);
    }

    List<Path> enumerate(Path root, List<String> extensions, boolean recursive) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        List<String> wanted = extensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
        try (Stream<Path> walk = recursive ? Files.walk(root) : Files.list(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
                        return wanted.stream().anyMatch(name::endsWith);
                    })
                    .sorted()
                    .toList();
        }
    }

    ExecutionMode selectMode(List<ExtractionTask> tasks, boolean parallelEnabled) {
        if (!parallelEnabled || tasks.size() < Math.max(1, parallelConfig.getMinFilesForParallel())) {
            return ExecutionMode.SEQUENTIAL;
        }
        String configured = parallelConfig.getMode().trim().toLowerCase(Locale.ROOT);
        return switch (configured) {
            case "process" -> ExecutionMode.PROCESS;
            case "thread" -> ExecutionMode.THREAD;
            case "auto" -> tasks.stream().anyMatch(ExtractionTask::remote) ? ExecutionMode.THREAD : ExecutionMode.PROCESS;
            default -> throw new IllegalArgumentException("Unknown parallel mode: " + parallelConfig.getMode());
        };
    }

    private int resolveWorkers(Integer maxWorkers, int fileCount) {
        int requested = maxWorkers != null && maxWorkers > 0 ? maxWorkers : parallelConfig.getMaxWorkers();
        if (requested <= 0) {
            requested = Runtime.getRuntime().availableProcessors();
        }
        return Math.max(1, Math.min(requested, fileCount));
    }

    private List<FileOutcome> runSequentially(List<ExtractionTask> tasks, AtomicInteger completed, int total, ProgressListener listener) {
        List<FileOutcome> outcomes = new ArrayList<>(tasks.size());
        for (ExtractionTask task : tasks) {
            FileOutcome outcome = shouldStop()
                    ? FileOutcome.failure(task.relativePath(), FileOutcome.CANCELLED)
                    : extract(task);
            report(outcome, completed, total, listener);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private LoadReport runParallel(List<ExtractionTask> tasks,
            ExecutionMode mode,
            int workers,
            AtomicInteger completed,
            ProgressListener listener) {
        int total = tasks.size();
        ExecutorService executor;
        try {
            executor = poolFactory.create(mode, workers);
        } catch (RuntimeException e) {
            log.warn("ingest.pool.unavailable mode={} reason={} fallback=sequential", mode.label(), e.getMessage());
            return new LoadReport(runSequentially(tasks, completed, total, listener), mode, true);
        }

        ExecutorCompletionService<FileOutcome> completion = new ExecutorCompletionService<>(executor);
        Map<Future<FileOutcome>, ExtractionTask> submitted = new LinkedHashMap<>();
        List<ExtractionTask> notSubmitted = new ArrayList<>();
        List<FileOutcome> outcomes = new ArrayList<>(total);
        boolean interrupted = false;
        boolean poolFailed = false;
        try {
            for (int i = 0; i < tasks.size(); i++) {
                ExtractionTask task = tasks.get(i);
                if (interrupted || poolFailed || shouldStop()) {
                    notSubmitted.add(task);
                    continue;
                }
                try {
                    submitted.put(completion.submit(() -> shouldStop()
                            ? FileOutcome.failure(task.relativePath(), FileOutcome.CANCELLED)
                            : extract(task)), task);
                } catch (RejectedExecutionException e) {
                    log.warn("ingest.pool.rejected mode={} file={} reason={} fallback=sequential",
                            mode.label(), task.relativePath(), e.getMessage());
                    poolFailed = true;
                    notSubmitted.add(task);
                    continue;
                }
                if (mode == ExecutionMode.THREAD && parallelConfig.getStaggerMs() > 0 && i < tasks.size() - 1) {
                    try {
                        Thread.sleep(parallelConfig.getStaggerMs());
                    } catch (InterruptedException e) {
                        interrupted = true;
                        stopRequested.set(true);
                    }
                }
            }

            int received = 0;
            while (received < submitted.size()) {
                Future<FileOutcome> future;
                try {
                    future = completion.take();
                } catch (InterruptedException e) {
                    interrupted = true;
                    stopRequested.set(true);
                    continue;
                }
                received++;
                FileOutcome outcome = resolve(future, submitted.get(future));
                report(outcome, completed, total, listener);
                outcomes.add(outcome);
            }
        } finally {
            executor.shutdown();
        }

        if (!notSubmitted.isEmpty()) {
            if (poolFailed && !interrupted) {
                outcomes.addAll(runSequentially(notSubmitted, completed, total, listener));
            } else {
                for (ExtractionTask task : notSubmitted) {
                    FileOutcome outcome = FileOutcome.failure(task.relativePath(), FileOutcome.CANCELLED);
                    report(outcome, completed, total, listener);
                    outcomes.add(outcome);
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new LoadReport(outcomes, mode, poolFailed);
    }

    private FileOutcome resolve(Future<FileOutcome> future, ExtractionTask task) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return FileOutcome.failure(task.relativePath(), describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileOutcome.failure(task.relativePath(), FileOutcome.CANCELLED);
        }
    }

    FileOutcome extract(ExtractionTask task) {
        try {
            if (task.extractorIndex() < 0) {
                return FileOutcome.failure(task.relativePath(), "No extractor available for " + task.file().getFileName());
            }
            Document document = extractors.get(task.extractorIndex()).extract(task.file());
            return FileOutcome.success(document, task.relativePath());
        } catch (Exception e) {
            return FileOutcome.failure(task.relativePath(), describe(e));
        }
    }

    private void report(FileOutcome outcome, AtomicInteger completed, int total, ProgressListener listener) {
        int done = completed.incrementAndGet();
        if (outcome.ok()) {
            log.debug("ingest.file status=OK progress={}/{} file={}", done, total, outcome.relativePath());
        } else {
            log.warn("ingest.file status=FAIL progress={}/{} file={} error={}", done, total, outcome.relativePath(), outcome.error());
        }
        listener.onProgress(done, total, outcome);
    }

    private boolean shouldStop() {
        return stopRequested.get() || Thread.currentThread().isInterrupted();
    }

    private DocumentExtractor extractorFor(Path file) {
        int index = extractorIndex(file);
        return index < 0 ? null : extractors.get(index);
    }

    private int extractorIndex(Path file) {
        for (int i = 0; i < extractors.size(); i++) {
            if (extractors.get(i).supports(file)) {
                return i;
            }
        }
        return -1;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static ExecutorService defaultPool(ExecutionMode mode, int workers) {
        if (mode == ExecutionMode.PROCESS) {
            return Executors.newWorkStealingPool(workers);
        }
        return Executors.newFixedThreadPool(workers, workerThreads());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ingest-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    interface PoolFactory {
        ExecutorService create(ExecutionMode mode, int workers);
    }
}

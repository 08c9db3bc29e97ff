package com.ragpipe.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragpipe.document.Document;
import com.ragpipe.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentLoaderTest {
    private static final List<String> TEXT = List.of(".txt");

    @TempDir
    Path tempDir;

    @BeforeEach
    void writeFiles() throws IOException {
        for (int i = 1; i <= 5; i++) {
            Files.writeString(tempDir.resolve("f" + i + ".txt"), "content of file " + i);
        }
    }

    @Test
    void shouldIsolateFailingFileWhenRunningSequentially() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new FailingExtractor("f3.txt")), parallel("auto"));

        LoadReport report = loader.loadDirectory(tempDir, TEXT, true, false, null, ProgressListener.NONE);

        assertIsolatedFailure(report);
        assertEquals(ExecutionMode.SEQUENTIAL, report.mode());
    }

    @Test
    void shouldIsolateFailingFileOnProcessPool() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new FailingExtractor("f3.txt")), parallel("process"));

        LoadReport report = loader.loadDirectory(tempDir, TEXT, true, true, 3, ProgressListener.NONE);

        assertIsolatedFailure(report);
        assertEquals(ExecutionMode.PROCESS, report.mode());
        assertFalse(report.fellBackToSequential());
    }

    @Test
    void shouldIsolateFailingFileOnThreadPool() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new FailingExtractor("f3.txt")), parallel("thread"));

        LoadReport report = loader.loadDirectory(tempDir, TEXT, true, true, 2, ProgressListener.NONE);

        assertIsolatedFailure(report);
        assertEquals(ExecutionMode.THREAD, report.mode());
    }

    @Test
    void shouldReportProgressOncePerFile() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new FailingExtractor("f3.txt")), parallel("thread"));
        List<Integer> completed = Collections.synchronizedList(new ArrayList<>());
        List<Integer> totals = Collections.synchronizedList(new ArrayList<>());

        loader.loadDirectory(tempDir, TEXT, true, true, 4, (done, total, outcome) -> {
            completed.add(done);
            totals.add(total);
        });

        assertEquals(List.of(1, 2, 3, 4, 5), completed.stream().sorted().toList());
        assertTrue(totals.stream().allMatch(total -> total == 5));
    }

    @Test
    void shouldFallBackToSequentialWhenPoolCannotStart() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new FailingExtractor("f3.txt")), parallel("process"),
                (mode, workers) -> {
                    throw new IllegalStateException("no worker pool on this host");
                });

        LoadReport report = loader.loadDirectory(tempDir, TEXT, true, true, 2, ProgressListener.NONE);

        assertIsolatedFailure(report);
        assertTrue(report.fellBackToSequential());
    }

    @Test
    void shouldRunRejectedFilesSequentially() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new FailingExtractor("f3.txt")), parallel("process"),
                (mode, workers) -> {
                    ExecutorService executor = Executors.newSingleThreadExecutor();
                    executor.shutdown();
                    return executor;
                });

        LoadReport report = loader.loadDirectory(tempDir, TEXT, true, true, 2, ProgressListener.NONE);

        assertIsolatedFailure(report);
        assertTrue(report.fellBackToSequential());
    }

    @Test
    void shouldCancelRemainingFilesAfterStopRequest() throws IOException {
        AtomicReference<DocumentLoader> loaderRef = new AtomicReference<>();
        DocumentExtractor stopping = new FailingExtractor("none") {
            @Override
            public Document extract(Path file) throws IOException {
                loaderRef.get().requestStop();
                return super.extract(file);
            }
        };
        DocumentLoader loader = new DocumentLoader(List.of(stopping), parallel("auto"));
        loaderRef.set(loader);

        LoadReport report = loader.loadDirectory(tempDir, TEXT, true, false, null, ProgressListener.NONE);

        assertEquals(5, report.outcomes().size());
        assertEquals(1, report.succeeded());
        assertTrue(report.failures().stream().allMatch(outcome -> FileOutcome.CANCELLED.equals(outcome.error())));
    }

    @Test
    void shouldReportFilesWithoutExtractorAsFailures() throws IOException {
        Files.write(tempDir.resolve("scan.pdf"), new byte[] { 37, 80, 68, 70 });
        DocumentLoader loader = new DocumentLoader(List.of(new PlainTextExtractor(List.of(".pdf"))), parallel("auto"));

        LoadReport report = loader.loadDirectory(tempDir, List.of(".pdf"), true, false, null, ProgressListener.NONE);

        assertEquals(1, report.failed());
        assertTrue(report.failures().get(0).error().contains("No extractor"));
    }

    @Test
    void shouldEnumerateMatchingFilesInSortedOrder() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(nested.resolve("deep.TXT"), "deep");
        Files.writeString(tempDir.resolve("skip.bin"), "binary");
        DocumentLoader loader = new DocumentLoader(List.of(new PlainTextExtractor(List.of())), parallel("auto"));

        List<Path> recursive = loader.enumerate(tempDir, TEXT, true);
        List<Path> flat = loader.enumerate(tempDir, TEXT, false);

        assertEquals(6, recursive.size());
        assertTrue(recursive.contains(nested.resolve("deep.TXT")));
        assertEquals(5, flat.size());
        assertEquals(tempDir.resolve("f1.txt"), flat.get(0));
    }

    @Test
    void shouldRejectMissingDirectory() {
        DocumentLoader loader = new DocumentLoader(List.of(new PlainTextExtractor(List.of())), parallel("auto"));

        assertThrows(IOException.class, () -> loader.loadDirectory(tempDir.resolve("missing"), TEXT, true));
    }

    @Test
    void shouldSelectModeFromConfigAndFileKinds() {
        AppConfig.ParallelConfig config = parallel("auto");
        DocumentLoader loader = new DocumentLoader(List.of(new PlainTextExtractor(List.of())), config);
        List<ExtractionTask> local = List.of(task("a.txt", false), task("b.txt", false));
        List<ExtractionTask> mixed = List.of(task("a.txt", false), task("b.pdf", true));

        assertEquals(ExecutionMode.PROCESS, loader.selectMode(local, true));
        assertEquals(ExecutionMode.THREAD, loader.selectMode(mixed, true));
        assertEquals(ExecutionMode.SEQUENTIAL, loader.selectMode(mixed, false));
        assertEquals(ExecutionMode.SEQUENTIAL, loader.selectMode(List.of(task("a.txt", false)), true));

        config.setMode("fork");
        assertThrows(IllegalArgumentException.class, () -> loader.selectMode(local, true));
    }

    @Test
    void shouldLoadSingleFileAndRawText() throws IOException {
        DocumentLoader loader = new DocumentLoader(List.of(new PlainTextExtractor(List.of())), parallel("auto"));

        Document file = loader.loadFile(tempDir.resolve("f2.txt"));
        Document text = loader.loadText("typed in", "direct_input");

        assertEquals("content of file 2", file.content());
        assertEquals("f2.txt", file.metadata().filename());
        assertEquals("direct_input", text.metadata().source());
        assertThrows(IOException.class, () -> loader.loadFile(tempDir.resolve("absent.txt")));
    }

    private static void assertIsolatedFailure(LoadReport report) {
        assertEquals(5, report.outcomes().size());
        assertEquals(4, report.documents().size());
        assertEquals(1, report.failures().size());
        FileOutcome failure = report.failures().get(0);
        assertEquals("f3.txt", failure.relativePath());
        assertTrue(failure.error().contains("corrupt"), failure.error());
    }

    private static AppConfig.ParallelConfig parallel(String mode) {
        AppConfig.ParallelConfig config = new AppConfig.ParallelConfig();
        config.setMode(mode);
        config.setStaggerMs(0);
        return config;
    }

    private static ExtractionTask task(String name, boolean remote) {
        return new ExtractionTask(Path.of(name), name, 0, remote);
    }

    private static class FailingExtractor extends PlainTextExtractor {
        private final String failingName;

        FailingExtractor(String failingName) {
            super(List.of());
            this.failingName = failingName;
        }

        @Override
        public Document extract(Path file) throws IOException {
            if (file.getFileName().toString().equals(failingName)) {
                throw new IOException("corrupt file " + failingName);
            }
            return super.extract(file);
        }
    }
}

package com.ragpipe.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragpipe.chunking.ChunkingEngine;
import com.ragpipe.document.Chunk;
import com.ragpipe.document.Document;
import com.ragpipe.index.AddResult;
import com.ragpipe.index.VectorStore;

/**
 * Loads documents, chunks them and adds the chunks to a store. Extraction may run on a pool;
 * chunking and insertion always run on the calling thread.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentLoader loader;
    private final ChunkingEngine chunkingEngine;
    private final VectorStore store;

    public IngestionService(DocumentLoader loader, ChunkingEngine chunkingEngine, VectorStore store) {
        this.loader = loader;
        this.chunkingEngine = chunkingEngine;
        this.store = store;
    }

    public IngestionReport ingestDirectory(Path root,
            List<String> extensions,
            boolean recursive,
            ProgressListener listener) throws IOException {
        LoadReport loadReport = loader.loadDirectory(root, extensions, recursive, null, null, listener);
        List<Document> documents = loadReport.documents();
        IngestionReport report = index(documents, loadReport.outcomes().size(), loadReport.failed(), loadReport.mode());
        log.info("ingest.directory root={} files={} ok={} failed={} mode={} chunks={} added={} duplicates={}",
                root,
                report.filesSeen(),
                loadReport.succeeded(),
                report.filesFailed(),
                report.mode().label(),
                report.chunks(),
                report.chunksAdded(),
                report.duplicates());
        return report;
    }

    public IngestionReport ingestFile(Path file) throws IOException {
        Document document = loader.loadFile(file);
        return index(List.of(document), 1, 0, ExecutionMode.SEQUENTIAL);
    }

    public IngestionReport ingestText(String text, String source) throws IOException {
        Document document = loader.loadText(text, source);
        return index(List.of(document), 0, 0, ExecutionMode.SEQUENTIAL);
    }

    public void requestStop() {
        loader.requestStop();
    }

    private IngestionReport index(List<Document> documents, int filesSeen, int filesFailed, ExecutionMode mode) throws IOException {
        List<Chunk> chunks = chunkingEngine.chunkAll(documents);
        AddResult added = chunks.isEmpty() ? new AddResult(0, 0) : store.add(chunks);
        if (added.added() > 0) {
            store.save();
        }
        return new IngestionReport(filesSeen, filesFailed, documents.size(), chunks.size(), added.added(), added.duplicates(), mode);
    }
}

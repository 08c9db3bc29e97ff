package com.ragpipe.chunking;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragpipe.document.Chunk;
import com.ragpipe.document.ChunkMetadata;
import com.ragpipe.document.ContentHashes;
import com.ragpipe.document.Document;
import com.ragpipe.document.DocumentMetadata;
import com.ragpipe.document.ExtractedPage;
import com.ragpipe.runtime.AppConfig;

public class ChunkingEngine {
    private static final Logger log = LoggerFactory.getLogger(ChunkingEngine.class);

    private final ContentTypeClassifier classifier;
    private final TextSplitter splitter;
    private final SplitMode mode;
    private final boolean pageChunking;
    private final String embeddingModelVersion;

    public ChunkingEngine(ContentTypeClassifier classifier,
            TextSplitter splitter,
            SplitMode mode,
            boolean pageChunking,
            String embeddingModelVersion) {
        this.classifier = classifier;
        this.splitter = splitter;
        if (mode == SplitMode.TOKEN && !splitter.supportsTokens()) {
            log.warn("chunking.mode.downgraded requested=token active=character reason=no-tokenizer");
            this.mode = SplitMode.CHARACTER;
        } else {
            this.mode = mode;
        }
        this.pageChunking = pageChunking;
        this.embeddingModelVersion = embeddingModelVersion == null ? "" : embeddingModelVersion;
    }

    public static ChunkingEngine fromConfig(AppConfig config, String embeddingModelVersion) {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        SplitMode requested = SplitMode.fromConfig(chunking.getMode());
        TextSplitter splitter = new TextSplitter(requested == SplitMode.TOKEN ? createTokenizer(chunking.getEncoding()) : null);
        return new ChunkingEngine(
                ContentTypeClassifier.fromConfig(chunking),
                splitter,
                requested,
                chunking.isPageChunking(),
                embeddingModelVersion);
    }

    static Tokenizer createTokenizer(String encoding) {
        try {
            return new JtokkitTokenizer(encoding);
        } catch (RuntimeException e) {
            log.warn("chunking.tokenizer.unavailable encoding={} reason={}", encoding, e.getMessage());
            return null;
        }
    }

    public SplitMode mode() {
        return mode;
    }

    public List<Chunk> chunk(Document document) {
        DocumentMetadata docMeta = document.metadata();
        String classifyKey = docMeta.source().isBlank() || "unknown".equals(docMeta.source())
                ? docMeta.filename()
                : docMeta.source();
        ContentTypeProfile profile = classifier.resolve(classifyKey, document.content());
        int chunkSize = profile.effectiveChunkSize();
        int overlap = profile.chunkOverlap();

        List<Piece> pieces = new ArrayList<>();
        if (pageChunking && !document.pages().isEmpty()) {
            for (ExtractedPage page : document.pages()) {
                for (String text : splitter.split(page.text(), chunkSize, overlap, profile.minChunkSize(), mode)) {
                    pieces.add(new Piece(text, page.pageNumber(), page.hasImage() ? page.image() : null));
                }
            }
        } else {
            for (String text : splitter.split(document.content(), chunkSize, overlap, profile.minChunkSize(), mode)) {
                pieces.add(new Piece(text, null, null));
            }
        }

        List<Chunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            Piece piece = pieces.get(i);
            ChunkMetadata metadata = new ChunkMetadata(
                    docMeta.source(),
                    docMeta.filename(),
                    docMeta.type(),
                    docMeta.totalPages(),
                    docMeta.processor(),
                    docMeta.extras(),
                    i,
                    pieces.size(),
                    chunkSize,
                    overlap,
                    mode.label(),
                    ContentHashes.sha256(piece.text()),
                    document.contentHash(),
                    profile.name(),
                    embeddingModelVersion,
                    piece.pageNumber());
            chunks.add(new Chunk(piece.text(), metadata, null, piece.image()));
        }
        log.debug("chunking.document source={} contentType={} mode={} chunks={}",
                docMeta.source(), profile.name(), mode.label(), chunks.size());
        return chunks;
    }

    public List<Chunk> chunkAll(List<Document> documents) {
        List<Chunk> all = new ArrayList<>();
        for (Document document : documents) {
            all.addAll(chunk(document));
        }
        log.info("chunking.batch documents={} chunks={}", documents.size(), all.size());
        return all;
    }

    private record Piece(String text, Integer pageNumber, byte[] image) {
    }
}

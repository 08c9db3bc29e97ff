package com.ragpipe.ingest;

import java.io.IOException;
import java.nio.file.Path;

import com.ragpipe.document.Document;

public interface DocumentExtractor {
    boolean supports(Path file);

    /**
     * Whether extraction blocks on a remote service rather than local CPU work.
     */
    boolean remote();

    Document extract(Path file) throws IOException;
}

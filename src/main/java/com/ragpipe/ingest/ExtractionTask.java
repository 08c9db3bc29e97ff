package com.ragpipe.ingest;

import java.nio.file.Path;

/**
 * Everything a worker needs to extract one file. Holds plain values only so it can be handed to
 * any pool.
 */
record ExtractionTask(Path file, String relativePath, int extractorIndex, boolean remote) {
}

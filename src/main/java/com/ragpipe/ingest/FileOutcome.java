package com.ragpipe.ingest;

import com.ragpipe.document.Document;

public record FileOutcome(Document document, String relativePath, String error) {
    public static final String CANCELLED = "cancelled";

    public static FileOutcome success(Document document, String relativePath) {
        return new FileOutcome(document, relativePath, null);
    }

    public static FileOutcome failure(String relativePath, String error) {
        return new FileOutcome(null, relativePath, error == null ? "unknown error" : error);
    }

    public boolean ok() {
        return document != null;
    }
}

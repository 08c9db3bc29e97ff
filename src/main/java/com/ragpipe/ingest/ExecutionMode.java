package com.ragpipe.ingest;

import java.util.Locale;

public enum ExecutionMode {
    SEQUENTIAL,
    PROCESS,
    THREAD;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

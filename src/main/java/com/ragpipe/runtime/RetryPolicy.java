package com.ragpipe.runtime;

import java.io.IOException;
import java.io.InterruptedIOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final long delayMs;

    public RetryPolicy(int maxRetries, long delayMs) {
        this.maxRetries = Math.max(0, maxRetries);
        this.delayMs = Math.max(0L, delayMs);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, 0L);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Runs {@code call}, retrying transport failures with a fixed delay. Unchecked exceptions are
     * not retried.
     */
    public <T> T execute(String operation, IoCall<T> call) throws IOException {
        IOException last = null;
        int maxAttempts = maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.run();
            } catch (IOException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.warn("retry operation={} attempt={} maxAttempts={} delayMs={} reason={}",
                        operation, attempt, maxAttempts, delayMs, e.getMessage());
                sleep();
            }
        }
        throw last;
    }

    private void sleep() throws InterruptedIOException {
        if (delayMs == 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }

    @FunctionalInterface
    public interface IoCall<T> {
        T run() throws IOException;
    }
}

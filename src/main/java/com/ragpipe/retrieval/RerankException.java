package com.ragpipe.retrieval;

public class RerankException extends Exception {
    public RerankException(String message) {
        super(message);
    }

    public RerankException(String message, Throwable cause) {
        super(message, cause);
    }
}

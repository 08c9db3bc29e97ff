package com.ragpipe.chunking;

public interface Tokenizer {
    int[] encode(String text);

    String decode(int[] tokens);

    default String name() {
        return "unknown";
    }
}

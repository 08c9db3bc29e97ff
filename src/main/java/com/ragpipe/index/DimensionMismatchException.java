package com.ragpipe.index;

public class DimensionMismatchException extends IllegalStateException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension " + actual + " does not match index dimension " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}

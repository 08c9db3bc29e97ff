package com.ragpipe.index;

public record AddResult(int added, int duplicates) {
}

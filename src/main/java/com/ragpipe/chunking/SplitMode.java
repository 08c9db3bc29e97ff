package com.ragpipe.chunking;

import java.util.Locale;

public enum SplitMode {
    TOKEN,
    CHARACTER;

    public static SplitMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return CHARACTER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "token", "tokens" -> TOKEN;
            case "character", "characters", "char" -> CHARACTER;
            default -> throw new IllegalArgumentException("Unknown chunking mode: " + value);
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

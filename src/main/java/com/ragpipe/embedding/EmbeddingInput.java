package com.ragpipe.embedding;

public record EmbeddingInput(String text, byte[] image) {
    public EmbeddingInput {
        text = text == null ? "" : text;
    }

    public static EmbeddingInput text(String text) {
        return new EmbeddingInput(text, null);
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }
}

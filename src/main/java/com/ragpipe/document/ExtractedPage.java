package com.ragpipe.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ExtractedPage(int pageNumber, String text, @JsonIgnore byte[] image) {
    public ExtractedPage {
        text = text == null ? "" : text;
    }

    public boolean hasImage() {
        return image != null && image.length > 0;
    }
}

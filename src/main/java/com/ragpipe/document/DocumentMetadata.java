package com.ragpipe.document;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentMetadata(
        String source,
        String filename,
        String type,
        Integer totalPages,
        String processor,
        Map<String, String> extras) {

    public DocumentMetadata {
        source = source == null ? "unknown" : source;
        filename = filename == null ? "" : filename;
        type = type == null ? "text" : type;
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static DocumentMetadata ofSource(String source, String filename, String type) {
        return new DocumentMetadata(source, filename, type, null, null, Map.of());
    }

    public DocumentMetadata withExtra(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(extras);
        merged.put(key, value);
        return new DocumentMetadata(source, filename, type, totalPages, processor, merged);
    }
}

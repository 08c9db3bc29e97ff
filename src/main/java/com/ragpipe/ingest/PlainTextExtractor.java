package com.ragpipe.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.ragpipe.document.Document;
import com.ragpipe.document.DocumentMetadata;

public class PlainTextExtractor implements DocumentExtractor {
    private final List<String> excludedExtensions;

    public PlainTextExtractor(List<String> excludedExtensions) {
        this.excludedExtensions = excludedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public boolean supports(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return excludedExtensions.stream().noneMatch(name::endsWith);
    }

    @Override
    public boolean remote() {
        return false;
    }

    @Override
    public Document extract(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        DocumentMetadata metadata = new DocumentMetadata(
                file.toString(),
                file.getFileName().toString(),
                "text",
                null,
                "plain-text",
                null);
        return Document.of(content, metadata);
    }
}

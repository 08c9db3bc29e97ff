package com.ragpipe.chunking;

import java.util.List;
import java.util.Locale;

import com.ragpipe.runtime.AppConfig;

public record ContentTypeProfile(
        String name,
        int chunkSize,
        int chunkOverlap,
        int minChunkSize,
        int maxChunkSize,
        List<String> extensions,
        List<String> contentPatterns) {

    public static final String DEFAULT = "default";

    public ContentTypeProfile {
        extensions = extensions == null
                ? List.of()
                : extensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
        contentPatterns = contentPatterns == null ? List.of() : List.copyOf(contentPatterns);
    }

    public static ContentTypeProfile fromConfig(String name, AppConfig.ProfileConfig config, AppConfig.ChunkingConfig defaults) {
        return new ContentTypeProfile(
                name,
                config.getChunkSize() > 0 ? config.getChunkSize() : defaults.getChunkSize(),
                config.getChunkOverlap() != null ? config.getChunkOverlap() : defaults.getChunkOverlap(),
                config.getMinChunkSize() > 0 ? config.getMinChunkSize() : defaults.getMinChunkSize(),
                config.getMaxChunkSize(),
                config.getExtensions(),
                config.getContentPatterns());
    }

    public static ContentTypeProfile fallback(AppConfig.ChunkingConfig defaults) {
        return new ContentTypeProfile(DEFAULT, defaults.getChunkSize(), defaults.getChunkOverlap(),
                defaults.getMinChunkSize(), 0, List.of(), List.of());
    }

    public boolean matchesExtension(String path) {
        if (path == null || extensions.isEmpty()) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    public int effectiveChunkSize() {
        if (maxChunkSize > 0) {
            return Math.min(chunkSize, maxChunkSize);
        }
        return chunkSize;
    }
}

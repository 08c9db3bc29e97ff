package com.ragpipe.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.ragpipe.runtime.AppConfig;

public class ContentTypeClassifier {
    private final List<ContentTypeProfile> profiles;
    private final ContentTypeProfile fallback;
    private final int patternThreshold;

    public ContentTypeClassifier(List<ContentTypeProfile> profiles, ContentTypeProfile fallback, int patternThreshold) {
        this.profiles = List.copyOf(profiles);
        this.fallback = fallback;
        this.patternThreshold = patternThreshold;
    }

    public static ContentTypeClassifier fromConfig(AppConfig.ChunkingConfig config) {
        List<ContentTypeProfile> profiles = new ArrayList<>();
        for (Map.Entry<String, AppConfig.ProfileConfig> entry : config.getProfiles().entrySet()) {
            profiles.add(ContentTypeProfile.fromConfig(entry.getKey(), entry.getValue(), config));
        }
        return new ContentTypeClassifier(profiles, ContentTypeProfile.fallback(config), config.getTableThreshold());
    }

    public String classify(String source, String content) {
        return resolve(source, content).name();
    }

    public ContentTypeProfile resolve(String source, String content) {
        for (ContentTypeProfile profile : profiles) {
            if (profile.matchesExtension(source)) {
                return profile;
            }
        }
        if (content != null && !content.isEmpty()) {
            for (ContentTypeProfile profile : profiles) {
                for (String pattern : profile.contentPatterns()) {
                    if (countOccurrences(content, pattern) > patternThreshold) {
                        return profile;
                    }
                }
            }
        }
        return fallback;
    }

    public ContentTypeProfile fallback() {
        return fallback;
    }

    static int countOccurrences(String content, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while (true) {
            int index = content.indexOf(pattern, from);
            if (index < 0) {
                return count;
            }
            count++;
            from = index + pattern.length();
        }
    }
}

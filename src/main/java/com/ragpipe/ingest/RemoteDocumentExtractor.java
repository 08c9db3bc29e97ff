package com.ragpipe.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragpipe.document.Document;
import com.ragpipe.document.DocumentMetadata;
import com.ragpipe.document.ExtractedPage;
import com.ragpipe.runtime.AppConfig;

import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Sends binary documents (PDF, slides, word processor files) to an extraction service and
 * turns the returned pages into a {@link Document}.
 */
public class RemoteDocumentExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(RemoteDocumentExtractor.class);
    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");
    private static final String DATA_URI_SEPARATOR = "base64,";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final List<String> extensions;
    private final boolean renderImages;

    public RemoteDocumentExtractor(OkHttpClient httpClient, String endpoint, List<String> extensions, boolean renderImages) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.extensions = extensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT)).toList();
        this.renderImages = renderImages;
    }

    public static RemoteDocumentExtractor fromConfig(OkHttpClient baseClient, AppConfig.ExtractionConfig config) {
        OkHttpClient client = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new RemoteDocumentExtractor(client, config.getApiUrl(), config.getExtensions(), config.isRenderImages());
    }

    @Override
    public boolean supports(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    @Override
    public boolean remote() {
        return true;
    }

    @Override
    public Document extract(Path file) throws IOException {
        String filename = file.getFileName().toString();
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", filename, RequestBody.create(file.toFile(), OCTET_STREAM))
                .addFormDataPart("render_images", String.valueOf(renderImages))
                .build();
        Request request = new Request.Builder()
                .url(endpoint)
                .post(body)
                .build();

        JsonNode root;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Extraction service returned HTTP " + response.code() + " for " + filename);
            }
            root = mapper.readTree(response.body().string());
        }

        JsonNode pagesNode = root.path("pages");
        if (!pagesNode.isArray()) {
            throw new IOException("Extraction response for " + filename + " has no pages");
        }
        List<ExtractedPage> pages = new ArrayList<>();
        StringBuilder content = new StringBuilder();
        for (JsonNode pageNode : pagesNode) {
            int pageNumber = pageNode.path("page_number").asInt(pages.size() + 1);
            String text = pageNode.path("text").asText("");
            byte[] image = decodeImage(pageNode.path("image").asText(""));
            pages.add(new ExtractedPage(pageNumber, text, image));
            content.append("\n\n=== Page ").append(pageNumber).append(" ===\n\n").append(text);
        }

        String extension = filename.contains(".")
                ? filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT)
                : "binary";
        DocumentMetadata metadata = new DocumentMetadata(
                file.toString(),
                filename,
                extension,
                pages.size(),
                root.path("processor").asText("remote-extraction"),
                null);
        log.debug("extraction.remote file={} pages={}", filename, pages.size());
        return Document.withPages(content.toString().trim(), metadata, pages);
    }

    private static byte[] decodeImage(String encoded) {
        if (encoded.isBlank()) {
            return null;
        }
        int separator = encoded.indexOf(DATA_URI_SEPARATOR);
        String raw = separator >= 0 ? encoded.substring(separator + DATA_URI_SEPARATOR.length()) : encoded;
        return Base64.getDecoder().decode(raw);
    }
}

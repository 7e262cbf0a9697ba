package com.example.imagetagger.metadata;

import com.example.imagetagger.WorkItem;
import com.example.imagetagger.task.MetadataGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Asks a remote service to describe an image. The raw image bytes are POSTed to the
 * endpoint and the service answers with {@code {"title", "description", "keywords"}}.
 * A 204 or an empty body means the service produced nothing for the image.
 */
public final class HttpMetadataGenerator implements MetadataGenerator<ImageMetadata> {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpMetadataGenerator.class);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;

    public HttpMetadataGenerator(URI endpoint, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), endpoint, apiKey, timeout);
    }

    HttpMetadataGenerator(HttpClient client, ObjectMapper mapper, URI endpoint, String apiKey, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public Optional<ImageMetadata> generate(WorkItem item) throws IOException {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", item.mediaType())
                .header("X-File-Name", URLEncoder.encode(item.fileName(), StandardCharsets.UTF_8))
                .POST(HttpRequest.BodyPublishers.ofFile(item.path()));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while describing " + item.path());
            interrupted.initCause(ex);
            throw interrupted;
        }

        int status = response.statusCode();
        if (status == 204) {
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new IOException("Metadata service returned HTTP " + status + " for " + item.fileName());
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        ImageMetadata metadata = mapper.readValue(body, ImageMetadata.class);
        if (metadata == null || metadata.isEmpty()) {
            LOGGER.debug("Metadata service returned an empty description for {}", item.path());
            return Optional.empty();
        }
        return Optional.of(metadata);
    }
}

package com.example.imagetagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class ConfigLoader {
    static final int DEFAULT_RETRY_ATTEMPTS = 1;
    static final long DEFAULT_RETRY_DELAY_MILLIS = 500;
    static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 60;
    static final String DEFAULT_API_KEY_VARIABLE = "METADATA_API_KEY";
    static final String DEFAULT_SIDECAR_SUFFIX = ".json";
    static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            "._*"
    );
    static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            ".git"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public BatchConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.concurrency != null && raw.concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + raw.concurrency);
        }
        int concurrency = raw.concurrency == null ? BatchConfig.DEFAULT_CONCURRENCY : raw.concurrency;

        Set<String> extensions = BatchConfig.DEFAULT_EXTENSIONS;
        if (raw.extensions != null) {
            extensions = normalizeExtensions(raw.extensions);
            if (extensions.isEmpty()) {
                throw new IllegalArgumentException("Config must include at least one extension.");
            }
        }

        int retryAttempts = raw.retryAttempts != null && raw.retryAttempts > 0
                ? raw.retryAttempts
                : DEFAULT_RETRY_ATTEMPTS;
        long retryDelayMillis = raw.retryDelayMillis != null && raw.retryDelayMillis >= 0
                ? raw.retryDelayMillis
                : DEFAULT_RETRY_DELAY_MILLIS;
        int timeoutSeconds = raw.requestTimeoutSeconds != null && raw.requestTimeoutSeconds > 0
                ? raw.requestTimeoutSeconds
                : DEFAULT_REQUEST_TIMEOUT_SECONDS;

        Optional<Path> rootDirectory = nonBlank(raw.rootDirectory).map(Path::of);
        Optional<Path> reportFile = nonBlank(raw.reportFile).map(Path::of);
        Optional<URI> endpoint = nonBlank(raw.generatorEndpoint).map(URI::create);

        return new BatchConfig(
                rootDirectory,
                concurrency,
                extensions,
                raw.followLinks != null && raw.followLinks,
                mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns),
                retryAttempts,
                Duration.ofMillis(retryDelayMillis),
                reportFile,
                endpoint,
                nonBlank(raw.apiKeyEnvironmentVariable).orElse(DEFAULT_API_KEY_VARIABLE),
                Duration.ofSeconds(timeoutSeconds),
                nonBlank(raw.sidecarSuffix).orElse(DEFAULT_SIDECAR_SUFFIX)
        );
    }

    private Set<String> normalizeExtensions(List<String> values) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String extension = ImageEnumerator.normalizeExtension(value);
            if (!extension.isEmpty()) {
                normalized.add(extension);
            }
        }
        return normalized;
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    private static class RawConfig {
        public String rootDirectory;
        public Integer concurrency;
        public List<String> extensions;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public Integer retryAttempts;
        public Long retryDelayMillis;
        public String reportFile;
        public String generatorEndpoint;
        public String apiKeyEnvironmentVariable;
        public Integer requestTimeoutSeconds;
        public String sidecarSuffix;
    }
}

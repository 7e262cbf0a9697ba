package com.example.imagetagger;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime settings for a batch run.
 */
public record BatchConfig(
        Optional<Path> rootDirectory,
        int concurrency,
        Set<String> extensions,
        boolean followLinks,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        int retryAttempts,
        Duration retryDelay,
        Optional<Path> reportFile,
        Optional<URI> generatorEndpoint,
        String apiKeyEnvironmentVariable,
        Duration requestTimeout,
        String sidecarSuffix
) {
    public static final int DEFAULT_CONCURRENCY = 4;
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("jpg", "jpeg", "png");

    public BatchConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("extensions must not be empty.");
        }
        if (retryAttempts <= 0) {
            throw new IllegalArgumentException("retryAttempts must be positive: " + retryAttempts);
        }
        extensions = Set.copyOf(extensions);
        excludeFilePatterns = List.copyOf(excludeFilePatterns);
        excludeDirectoryPatterns = List.copyOf(excludeDirectoryPatterns);
    }

    /**
     * Four workers, jpg/jpeg/png, no retry, no report.
     */
    public static BatchConfig defaults() {
        return new BatchConfig(
                Optional.empty(),
                DEFAULT_CONCURRENCY,
                DEFAULT_EXTENSIONS,
                false,
                ConfigLoader.DEFAULT_EXCLUDE_FILES,
                ConfigLoader.DEFAULT_EXCLUDE_DIRECTORIES,
                1,
                Duration.ofMillis(ConfigLoader.DEFAULT_RETRY_DELAY_MILLIS),
                Optional.empty(),
                Optional.empty(),
                ConfigLoader.DEFAULT_API_KEY_VARIABLE,
                Duration.ofSeconds(ConfigLoader.DEFAULT_REQUEST_TIMEOUT_SECONDS),
                ConfigLoader.DEFAULT_SIDECAR_SUFFIX
        );
    }

    public BatchConfig withConcurrency(int value) {
        return new BatchConfig(rootDirectory, value, extensions, followLinks, excludeFilePatterns,
                excludeDirectoryPatterns, retryAttempts, retryDelay, reportFile, generatorEndpoint,
                apiKeyEnvironmentVariable, requestTimeout, sidecarSuffix);
    }

    public BatchConfig withExtensions(Set<String> value) {
        return new BatchConfig(rootDirectory, concurrency, value, followLinks, excludeFilePatterns,
                excludeDirectoryPatterns, retryAttempts, retryDelay, reportFile, generatorEndpoint,
                apiKeyEnvironmentVariable, requestTimeout, sidecarSuffix);
    }

    public BatchConfig withRetry(int attempts, Duration delay) {
        return new BatchConfig(rootDirectory, concurrency, extensions, followLinks, excludeFilePatterns,
                excludeDirectoryPatterns, attempts, delay, reportFile, generatorEndpoint,
                apiKeyEnvironmentVariable, requestTimeout, sidecarSuffix);
    }
}

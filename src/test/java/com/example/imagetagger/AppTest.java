package com.example.imagetagger;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppTest {
    @Test
    void requiresConfigArgument() throws Exception {
        assertEquals(1, App.run(new String[0]));
    }

    @Test
    void requiresGeneratorEndpoint() throws Exception {
        Path config = Files.createTempFile("app-config", ".json");
        Files.writeString(config, "{\"rootDirectory\": \"/tmp\"}");

        assertEquals(1, App.run(new String[]{config.toString()}));
    }

    @Test
    void reportsInvalidRoot() throws Exception {
        Path config = Files.createTempFile("app-config", ".json");
        Files.writeString(config, "{\"generatorEndpoint\": \"http://127.0.0.1:1/describe\"}");
        Path missing = Files.createTempDirectory("app-root").resolve("missing");

        assertEquals(2, App.run(new String[]{config.toString(), missing.toString()}));
    }

    @Test
    void emptyFolderRunsToCompletionAndWritesReport() throws Exception {
        Path root = Files.createTempDirectory("app-empty");
        Path report = Files.createTempDirectory("app-report").resolve("report.json");
        Path config = Files.createTempFile("app-config", ".json");
        Files.writeString(config, "{\"generatorEndpoint\": \"http://127.0.0.1:1/describe\", \"reportFile\": \""
                + report.toString().replace("\\", "\\\\") + "\"}");

        assertEquals(0, App.run(new String[]{config.toString(), root.toString()}));
        assertEquals(true, Files.exists(report));
    }
}

package com.example.imagetagger;

import com.example.imagetagger.task.FailureReason;
import com.example.imagetagger.task.RetryAttempt;
import com.example.imagetagger.task.TaskOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchReportWriterTest {
    @Test
    void writesFailuresAndSummary() throws Exception {
        Path output = Files.createTempDirectory("report-test");
        Path reportFile = output.resolve("nested/report.json");
        BatchReportWriter writer = new BatchReportWriter(reportFile);

        WorkItem ok = WorkItem.of(Path.of("/photos/ok.jpg"));
        WorkItem bad = WorkItem.of(Path.of("/photos/bad.jpg"));
        writer.onItemCompleted(TaskOutcome.success(ok), new BatchProgress(2, 1, 1, 0));
        writer.onItemCompleted(
                TaskOutcome.failure(bad, FailureReason.GENERATION_ERROR, "HTTP 503")
                        .withFailedAttempts(List.of(new RetryAttempt(1, Instant.now(), FailureReason.GENERATION_ERROR, "HTTP 503"))),
                new BatchProgress(2, 2, 1, 1));
        Instant now = Instant.now();
        writer.write(new BatchSummary(7, 2, 2, 1, 1, false, now, now));

        assertTrue(Files.exists(reportFile));
        JsonNode report = new ObjectMapper().readTree(reportFile.toFile());
        assertEquals(7, report.get("summary").get("batchId").asLong());
        assertEquals(1, report.get("summary").get("failed").asInt());
        JsonNode failures = report.get("failures");
        assertEquals(1, failures.size());
        assertEquals(bad.path().toString(), failures.get(0).get("path").asText());
        assertEquals("GENERATION_ERROR", failures.get(0).get("reason").asText());
        assertEquals(2, failures.get(0).get("attempts").asInt());
        assertEquals(1, failures.get(0).get("retryAttempts").size());
        assertTrue(report.get("completedAt").isTextual());
    }
}

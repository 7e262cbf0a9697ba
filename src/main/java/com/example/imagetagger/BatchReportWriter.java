package com.example.imagetagger;

import com.example.imagetagger.events.ProgressSink;
import com.example.imagetagger.task.TaskOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects failed items as they complete and writes a JSON report once the batch is over.
 */
public final class BatchReportWriter implements ProgressSink {
    private final ObjectMapper mapper;
    private final Path reportPath;
    private final List<FailedFileRecord> failures = new ArrayList<>();

    public BatchReportWriter(Path reportPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.reportPath = reportPath;
    }

    @Override
    public synchronized void onItemCompleted(TaskOutcome outcome, BatchProgress progress) {
        if (!outcome.isSuccess()) {
            failures.add(FailedFileRecord.from(outcome));
        }
    }

    public synchronized List<FailedFileRecord> failures() {
        return List.copyOf(failures);
    }

    /**
     * Writes the report, creating parent directories if needed.
     */
    public void write(BatchSummary summary) throws IOException {
        BatchReport report = new BatchReport(Instant.now(), summary, failures());
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
    }

    public Path path() {
        return reportPath;
    }

    public record BatchReport(
            Instant completedAt,
            BatchSummary summary,
            List<FailedFileRecord> failures
    ) {
    }
}

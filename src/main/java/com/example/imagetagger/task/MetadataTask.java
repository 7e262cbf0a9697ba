package com.example.imagetagger.task;

import com.example.imagetagger.WorkItem;
import com.example.imagetagger.events.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates metadata for an image and writes it back. Every fault is captured in
 * the returned {@link TaskOutcome}; nothing escapes {@link #execute(WorkItem)}.
 *
 * @param <M> metadata type passed from the generator to the writer
 */
public final class MetadataTask<M> implements TaskUnit {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataTask.class);

    private final MetadataGenerator<M> generator;
    private final MetadataWriter<M> writer;
    private final ProgressSink sink;

    public MetadataTask(MetadataGenerator<M> generator, MetadataWriter<M> writer) {
        this(generator, writer, ProgressSink.NONE);
    }

    public MetadataTask(MetadataGenerator<M> generator, MetadataWriter<M> writer, ProgressSink sink) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.sink = ProgressSink.compose(sink == null ? ProgressSink.NONE : sink);
    }

    @Override
    public TaskOutcome execute(WorkItem item) {
        log("Processing: " + item.fileName());
        TaskOutcome outcome;
        try {
            outcome = generateAndWrite(item);
        } catch (Exception | Error ex) {
            LOGGER.warn("Unexpected failure while processing {}", item.path(), ex);
            outcome = TaskOutcome.failure(item, FailureReason.UNEXPECTED, describe(ex));
        }
        if (outcome.isSuccess()) {
            log("Added metadata to " + item.fileName());
        } else {
            log("Error processing " + item.path() + ": " + outcome.getDetail());
        }
        return outcome;
    }

    private TaskOutcome generateAndWrite(WorkItem item) {
        Optional<M> metadata;
        try {
            metadata = generator.generate(item);
        } catch (IOException ex) {
            LOGGER.debug("Metadata generation failed for {}", item.path(), ex);
            return TaskOutcome.failure(item, FailureReason.GENERATION_ERROR, describe(ex));
        }
        if (metadata == null || metadata.isEmpty()) {
            return TaskOutcome.failure(item, FailureReason.GENERATION_ERROR, "no metadata generated");
        }
        try {
            writer.write(item, metadata.get());
        } catch (IOException ex) {
            LOGGER.debug("Metadata write failed for {}", item.path(), ex);
            return TaskOutcome.failure(item, FailureReason.WRITE_ERROR, describe(ex));
        }
        return TaskOutcome.success(item);
    }

    private void log(String message) {
        LOGGER.info(message);
        sink.onLog(message);
    }

    static String describe(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return ex.getClass().getSimpleName() + ": " + message;
    }
}

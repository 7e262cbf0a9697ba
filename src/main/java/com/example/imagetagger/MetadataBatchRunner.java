package com.example.imagetagger;

import com.example.imagetagger.events.ProgressSink;
import com.example.imagetagger.task.MetadataGenerator;
import com.example.imagetagger.task.MetadataTask;
import com.example.imagetagger.task.MetadataWriter;
import com.example.imagetagger.task.RetryingTask;
import com.example.imagetagger.task.TaskUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for running batches over image folders. Owns the worker pool for its
 * whole lifetime: open from construction, shut down by {@link #close()}.
 */
public final class MetadataBatchRunner implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataBatchRunner.class);

    private final BatchConfig config;
    private final ImageEnumerator enumerator;
    private final WorkerPool pool;
    private final BatchCoordinator coordinator;

    MetadataBatchRunner(BatchConfig config, ImageEnumerator enumerator, WorkerPool pool, BatchCoordinator coordinator) {
        this.config = config;
        this.enumerator = enumerator;
        this.pool = pool;
        this.coordinator = coordinator;
    }

    public static <M> MetadataBatchRunner create(BatchConfig config,
                                                 MetadataGenerator<M> generator,
                                                 MetadataWriter<M> writer,
                                                 ProgressSink sink) {
        TaskUnit task = RetryingTask.wrap(
                new MetadataTask<>(generator, writer, sink),
                config.retryAttempts(),
                config.retryDelay()
        );
        return create(config, task, sink);
    }

    public static MetadataBatchRunner create(BatchConfig config, TaskUnit task, ProgressSink sink) {
        WorkerPool pool = new WorkerPool(config.concurrency());
        return new MetadataBatchRunner(
                config,
                ImageEnumerator.fromConfig(config),
                pool,
                new BatchCoordinator(pool, task, sink)
        );
    }

    /**
     * Runs a batch over the configured root directory.
     */
    public BatchHandle runBatch() throws EnumerationException {
        Path root = config.rootDirectory()
                .orElseThrow(() -> new EnumerationException(Path.of(""), "No root directory configured"));
        return runBatch(root);
    }

    /**
     * Enumerates {@code root} and starts processing every image found. Returns as soon
     * as the items are queued.
     *
     * @throws EnumerationException     if {@code root} cannot be walked
     * @throws BatchInProgressException if the previous batch is still running
     * @throws PoolClosedException      if the runner has been closed
     */
    public BatchHandle runBatch(Path root) throws EnumerationException {
        if (pool.isShutdown()) {
            throw new PoolClosedException("Runner is closed");
        }
        List<WorkItem> items = enumerator.enumerate(root);
        LOGGER.info("Found {} images under {}", items.size(), root);
        return coordinator.start(items);
    }

    public BatchCoordinator coordinator() {
        return coordinator;
    }

    public BatchConfig config() {
        return config;
    }

    @Override
    public void close() {
        pool.close();
    }
}

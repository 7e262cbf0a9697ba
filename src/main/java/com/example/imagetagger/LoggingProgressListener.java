package com.example.imagetagger;

import com.example.imagetagger.events.ProgressSink;
import com.example.imagetagger.task.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console presentation for the command-line app: one line per finished image plus a summary.
 */
final class LoggingProgressListener implements ProgressSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onItemCompleted(TaskOutcome outcome, BatchProgress progress) {
        if (outcome.isSuccess()) {
            LOGGER.info("[{}/{}] {} done", progress.completed(), progress.total(), outcome.getItem().fileName());
        } else {
            LOGGER.warn("[{}/{}] {} failed ({}): {}", progress.completed(), progress.total(),
                    outcome.getItem().fileName(), outcome.getReason().orElseThrow(), outcome.getDetail());
        }
    }

    @Override
    public void onBatchCompleted(BatchSummary summary) {
        LOGGER.info("Finished processing {} images in {} ms: {} succeeded, {} failed{}",
                summary.total(), summary.elapsed().toMillis(), summary.succeeded(), summary.failed(),
                summary.cancelled() ? " (cancelled)" : "");
    }
}

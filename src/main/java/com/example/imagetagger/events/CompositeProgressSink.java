package com.example.imagetagger.events;

import com.example.imagetagger.BatchProgress;
import com.example.imagetagger.BatchSummary;
import com.example.imagetagger.task.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

final class CompositeProgressSink implements ProgressSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeProgressSink.class);

    private final List<ProgressSink> sinks;

    CompositeProgressSink(List<ProgressSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void onLog(String message) {
        deliver("log", sink -> sink.onLog(message));
    }

    @Override
    public void onItemCompleted(TaskOutcome outcome, BatchProgress progress) {
        deliver("item", sink -> sink.onItemCompleted(outcome, progress));
    }

    @Override
    public void onBatchCompleted(BatchSummary summary) {
        deliver("batch", sink -> sink.onBatchCompleted(summary));
    }

    private void deliver(String event, Consumer<ProgressSink> call) {
        for (ProgressSink sink : sinks) {
            try {
                call.accept(sink);
            } catch (RuntimeException ex) {
                LOGGER.warn("Progress sink {} failed on {} event", sink, event, ex);
            }
        }
    }
}

package com.example.imagetagger.events;

import com.example.imagetagger.BatchCoordinator;
import com.example.imagetagger.BatchSummary;
import com.example.imagetagger.RecordingSink;
import com.example.imagetagger.WorkItem;
import com.example.imagetagger.WorkerPool;
import com.example.imagetagger.task.TaskOutcome;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorProgressSinkTest {
    @Test
    void eventsRunOnTheConsumerExecutor() throws Exception {
        ExecutorService uiThread = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "ui"));
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        RecordingSink consumer = new RecordingSink() {
            @Override
            public void onBatchCompleted(BatchSummary summary) {
                threadNames.add(Thread.currentThread().getName());
                super.onBatchCompleted(summary);
            }

            @Override
            public void onLog(String message) {
                threadNames.add(Thread.currentThread().getName());
                super.onLog(message);
            }
        };

        try (WorkerPool pool = new WorkerPool(3)) {
            BatchCoordinator coordinator = new BatchCoordinator(
                    pool, TaskOutcome::success, new ExecutorProgressSink(uiThread, consumer));
            coordinator.start(List.of(
                    WorkItem.of(Path.of("/p/1.jpg")),
                    WorkItem.of(Path.of("/p/2.jpg")),
                    WorkItem.of(Path.of("/p/3.jpg"))
            ));
            assertTrue(consumer.completed.await(10, TimeUnit.SECONDS));
        } finally {
            uiThread.shutdown();
            assertTrue(uiThread.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(Set.of("ui"), threadNames);
        assertEquals(3, consumer.outcomes.size());
        assertEquals(3, consumer.summaries.get(0).succeeded());
    }
}

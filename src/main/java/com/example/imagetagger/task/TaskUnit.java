package com.example.imagetagger.task;

import com.example.imagetagger.WorkItem;

/**
 * Processes a single work item. Implementations report every failure through the
 * returned outcome and must be safe to run concurrently for different items.
 */
@FunctionalInterface
public interface TaskUnit {
    TaskOutcome execute(WorkItem item);
}

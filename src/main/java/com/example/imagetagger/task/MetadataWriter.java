package com.example.imagetagger.task;

import com.example.imagetagger.WorkItem;

import java.io.IOException;

/**
 * Persists generated metadata for an image. Implementations must be thread safe.
 *
 * @param <M> metadata type, opaque to the batch engine
 */
@FunctionalInterface
public interface MetadataWriter<M> {
    void write(WorkItem item, M metadata) throws IOException;
}

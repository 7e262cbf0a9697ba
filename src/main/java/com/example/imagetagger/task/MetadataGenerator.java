package com.example.imagetagger.task;

import com.example.imagetagger.WorkItem;

import java.io.IOException;
import java.util.Optional;

/**
 * Produces descriptive metadata for an image. Called concurrently from worker
 * threads with different items, and may block on the network.
 *
 * @param <M> metadata type, opaque to the batch engine
 */
@FunctionalInterface
public interface MetadataGenerator<M> {
    /**
     * @return the metadata, or empty if the service had nothing to say about the image
     * @throws IOException if the service call failed
     */
    Optional<M> generate(WorkItem item) throws IOException;
}

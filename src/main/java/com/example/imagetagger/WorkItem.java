package com.example.imagetagger;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One image queued for processing. Paths are absolute and normalized.
 */
public record WorkItem(
        Path path,
        String mediaType
) {
    public WorkItem {
        Objects.requireNonNull(path, "path");
        path = path.toAbsolutePath().normalize();
        mediaType = mediaType == null ? MediaTypeDetector.OCTET_STREAM : mediaType;
    }

    public static WorkItem of(Path path) {
        return new WorkItem(path, null);
    }

    public String fileName() {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}

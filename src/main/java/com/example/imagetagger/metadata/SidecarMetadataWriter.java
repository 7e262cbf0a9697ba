package com.example.imagetagger.metadata;

import com.example.imagetagger.WorkItem;
import com.example.imagetagger.task.MetadataWriter;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores metadata as a JSON file next to the image, e.g. {@code beach.jpg.json}.
 * The image file itself is never modified; embedding the metadata in EXIF/XMP
 * would need another {@link MetadataWriter}.
 * The sidecar is written to a temporary file first and moved into place.
 */
public final class SidecarMetadataWriter implements MetadataWriter<ImageMetadata> {
    private final ObjectMapper mapper;
    private final String suffix;

    public SidecarMetadataWriter(String suffix) {
        this(new ObjectMapper(), suffix);
    }

    public SidecarMetadataWriter(ObjectMapper mapper, String suffix) {
        if (suffix == null || suffix.isBlank()) {
            throw new IllegalArgumentException("suffix must not be blank.");
        }
        this.mapper = mapper;
        this.suffix = suffix;
    }

    @Override
    public void write(WorkItem item, ImageMetadata metadata) throws IOException {
        Path target = sidecarFor(item.path());
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), metadata);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public Path sidecarFor(Path image) {
        return image.resolveSibling(image.getFileName().toString() + suffix);
    }
}

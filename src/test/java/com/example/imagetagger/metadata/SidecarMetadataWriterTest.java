package com.example.imagetagger.metadata;

import com.example.imagetagger.WorkItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SidecarMetadataWriterTest {
    @Test
    void writesSidecarNextToImage() throws Exception {
        Path dir = Files.createTempDirectory("sidecar-test");
        Path image = dir.resolve("harbour.jpg");
        Files.write(image, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF});
        SidecarMetadataWriter writer = new SidecarMetadataWriter(".json");

        writer.write(WorkItem.of(image), new ImageMetadata("Harbour", "Boats at dusk", List.of("boats", "dusk")));

        Path sidecar = dir.resolve("harbour.jpg.json");
        assertTrue(Files.exists(sidecar));
        ImageMetadata stored = new ObjectMapper().readValue(sidecar.toFile(), ImageMetadata.class);
        assertEquals("Harbour", stored.title());
        assertEquals(List.of("boats", "dusk"), stored.keywords());
        try (var files = Files.list(dir)) {
            assertEquals(2L, files.count());
        }
        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}, Files.readAllBytes(image));
    }

    @Test
    void replacesExistingSidecar() throws Exception {
        Path dir = Files.createTempDirectory("sidecar-replace");
        Path image = dir.resolve("a.png");
        Files.writeString(image, "png");
        SidecarMetadataWriter writer = new SidecarMetadataWriter(".meta.json");

        writer.write(WorkItem.of(image), new ImageMetadata("old", null, null));
        writer.write(WorkItem.of(image), new ImageMetadata("new", null, null));

        ImageMetadata stored = new ObjectMapper().readValue(dir.resolve("a.png.meta.json").toFile(), ImageMetadata.class);
        assertEquals("new", stored.title());
        assertTrue(stored.keywords().isEmpty());
    }
}

package com.example.imagetagger.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Descriptive metadata returned by the generation service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageMetadata(
        String title,
        String description,
        List<String> keywords
) {
    public ImageMetadata {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean isEmpty() {
        return isBlank(title) && isBlank(description) && keywords.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

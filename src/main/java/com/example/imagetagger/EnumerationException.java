package com.example.imagetagger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when the root directory of a batch cannot be walked.
 */
public class EnumerationException extends IOException {
    private final Path root;

    public EnumerationException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public EnumerationException(Path root, String message, Throwable cause) {
        super(message + ": " + root, cause);
        this.root = root;
    }

    public Path root() {
        return root;
    }
}

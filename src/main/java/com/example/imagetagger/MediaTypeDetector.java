package com.example.imagetagger;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.nio.file.Path;

/**
 * Resolves a media type from a file name. No file content is read, so detection
 * is cheap enough to run for every enumerated image.
 */
public class MediaTypeDetector {
    static final String OCTET_STREAM = "application/octet-stream";

    private final Tika tika;

    public MediaTypeDetector() {
        this(new Tika());
    }

    public MediaTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public String detect(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return OCTET_STREAM;
        }
        MediaType mediaType = MediaType.parse(tika.detect(name.toString()));
        return mediaType == null ? OCTET_STREAM : mediaType.toString();
    }
}

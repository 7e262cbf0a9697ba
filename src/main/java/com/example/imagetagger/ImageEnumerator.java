package com.example.imagetagger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a directory tree breadth-first and collects the files whose extension is
 * on the allow-list. Entries of a directory are visited in name order so a given
 * filesystem snapshot always yields the same sequence.
 */
public final class ImageEnumerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageEnumerator.class);

    private final Set<String> extensions;
    private final boolean followLinks;
    private final List<PathMatcher> excludedFiles;
    private final List<PathMatcher> excludedDirectories;
    private final MediaTypeDetector detector;

    public ImageEnumerator(Set<String> extensions) {
        this(extensions, false, List.of(), List.of(), new MediaTypeDetector());
    }

    public ImageEnumerator(Set<String> extensions,
                           boolean followLinks,
                           List<String> excludeFilePatterns,
                           List<String> excludeDirectoryPatterns,
                           MediaTypeDetector detector) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one extension is required.");
        }
        this.extensions = extensions.stream()
                .map(ImageEnumerator::normalizeExtension)
                .collect(Collectors.toUnmodifiableSet());
        this.followLinks = followLinks;
        this.excludedFiles = matchers(excludeFilePatterns);
        this.excludedDirectories = matchers(excludeDirectoryPatterns);
        this.detector = detector;
    }

    public static ImageEnumerator fromConfig(BatchConfig config) {
        return new ImageEnumerator(
                config.extensions(),
                config.followLinks(),
                config.excludeFilePatterns(),
                config.excludeDirectoryPatterns(),
                new MediaTypeDetector()
        );
    }

    /**
     * Returns every eligible image under {@code root}. An empty list is a valid result.
     *
     * @throws EnumerationException if the root is missing, not a directory or unreadable
     */
    public List<WorkItem> enumerate(Path root) throws EnumerationException {
        if (root == null) {
            throw new EnumerationException(Path.of(""), "Root directory is not set");
        }
        Path start = root.toAbsolutePath().normalize();
        if (!Files.exists(start)) {
            throw new EnumerationException(start, "Root directory does not exist");
        }
        if (!Files.isDirectory(start)) {
            throw new EnumerationException(start, "Root is not a directory");
        }
        if (!Files.isReadable(start)) {
            throw new EnumerationException(start, "Root directory is not readable");
        }

        List<WorkItem> items = new ArrayList<>();
        Set<Path> visited = new HashSet<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(start);

        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            if (!markVisited(visited, current)) {
                continue;
            }
            List<Path> entries;
            try {
                entries = listSorted(current);
            } catch (IOException ex) {
                if (current.equals(start)) {
                    throw new EnumerationException(start, "Failed to list root directory", ex);
                }
                LOGGER.warn("Failed to list directory {}", current, ex);
                continue;
            }
            for (Path entry : entries) {
                if (shouldSkipLink(entry)) {
                    continue;
                }
                LinkOption[] options = linkOptions();
                if (Files.isDirectory(entry, options)) {
                    if (!matchesAny(excludedDirectories, entry)) {
                        pending.addLast(entry);
                    }
                } else if (Files.isRegularFile(entry, options) && isEligible(entry)) {
                    items.add(new WorkItem(entry, detector.detect(entry)));
                }
            }
        }
        LOGGER.debug("Enumerated {} images under {}", items.size(), start);
        return items;
    }

    boolean isEligible(Path file) {
        if (matchesAny(excludedFiles, file)) {
            return false;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private List<Path> listSorted(Path directory) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        }
        entries.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return entries;
    }

    private boolean markVisited(Set<Path> visited, Path directory) {
        if (!followLinks) {
            return true;
        }
        try {
            return visited.add(directory.toRealPath());
        } catch (IOException ex) {
            LOGGER.warn("Failed to resolve {}", directory, ex);
            return false;
        }
    }

    private boolean shouldSkipLink(Path path) {
        return !followLinks && Files.isSymbolicLink(path);
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream()
                .filter(pattern -> pattern != null && !pattern.isBlank())
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    static String normalizeExtension(String extension) {
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}

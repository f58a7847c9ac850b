package io.jobs4j.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursively collects handler class files below a directory.
 *
 * <p>A missing directory is not an error and yields no files. Unreadable subtrees are logged as
 * warnings and skipped without aborting the rest of the walk. Every call reads the file system
 * again; results are returned in traversal order.
 */
public class JobFileScanner {
    private static final Logger log = LoggerFactory.getLogger(JobFileScanner.class);

    private final HandlerFileConvention convention;

    public JobFileScanner(HandlerFileConvention convention) {
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
    }

    public HandlerFileConvention convention() {
        return convention;
    }

    public List<Path> scan(Path root) {
        Objects.requireNonNull(root, "root must not be null");

        if (Files.notExists(root)) {
            log.debug("Handler directory does not exist, nothing to scan path={}", root);
            return List.of();
        }
        if (!Files.isDirectory(root)) {
            log.warn("JobFileScanner: Path is not a directory {}", root);
            return List.of();
        }

        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && convention.matches(file.getFileName().toString())) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    warnScanError(file, exc);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        warnScanError(dir, exc);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            // The visitor never rethrows; this only covers failures walkFileTree raises itself.
            warnScanError(root, e);
        }

        log.debug("Scanned path={} convention={} matches={}", root, convention, files.size());
        return files;
    }

    private static void warnScanError(Path path, IOException exc) {
        if (exc instanceof NoSuchFileException) {
            log.debug("Path disappeared during scan path={}", path);
        } else if (exc instanceof AccessDeniedException) {
            log.warn("JobFileScanner: Permission denied accessing directory {}", path);
        } else if (exc instanceof NotDirectoryException) {
            log.warn("JobFileScanner: Path is not a directory {}", path);
        } else {
            log.warn("JobFileScanner: Unexpected error scanning directory {} type={} msg={}",
                    path, exc.getClass().getName(), exc.getMessage());
        }
    }
}

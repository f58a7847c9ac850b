package io.jobs4j.exception;

import java.nio.file.Path;

/**
 * A candidate handler file could not be loaded: unreadable, not a valid class file, missing
 * dependencies, or a static initializer that threw.
 */
public class HandlerImportException extends JobsException {

    private final Path path;

    public HandlerImportException(Path path, Throwable cause) {
        super("Failed to import handler from " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    private static String describe(Throwable cause) {
        Throwable root = cause;
        if (root instanceof ExceptionInInitializerError && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null ? root.getClass().getName() : root.getClass().getSimpleName() + ": " + message;
    }
}

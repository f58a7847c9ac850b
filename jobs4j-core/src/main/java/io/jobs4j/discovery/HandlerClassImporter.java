package io.jobs4j.discovery;

import io.jobs4j.core.HandlerDescriptor;
import io.jobs4j.exception.HandlerImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a handler class file and describes the type it declares.
 *
 * <p>The class is initialised as part of the import, so static initialisers run here and their
 * failures surface as {@link HandlerImportException}. The handler kind is not checked.
 */
public class HandlerClassImporter {
    private static final Logger log = LoggerFactory.getLogger(HandlerClassImporter.class);

    private final ClassLoader parent;

    public HandlerClassImporter() {
        this(defaultClassLoader());
    }

    public HandlerClassImporter(ClassLoader parent) {
        this.parent = Objects.requireNonNull(parent, "parent must not be null");
    }

    /**
     * @return the descriptor, or {@code null} if the file declares a type that cannot be instantiated
     * @throws HandlerImportException if the file cannot be read, defined, linked or initialised
     */
    public HandlerDescriptor importDescriptor(Path path) {
        Objects.requireNonNull(path, "path must not be null");

        Class<?> type;
        try {
            type = new HandlerClassLoader(parent).define(path);
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (IOException | ClassNotFoundException | LinkageError | SecurityException e) {
            throw new HandlerImportException(path, e);
        }

        if (!isConstructible(type)) {
            log.debug("Not a constructible handler type path={} type={}", path, type.getName());
            return null;
        }
        return HandlerDescriptor.of(type);
    }

    static boolean isConstructible(Class<?> type) {
        if (type.isInterface() || type.isAnnotation() || type.isEnum() || type.isArray() || type.isPrimitive()) {
            return false;
        }
        int modifiers = type.getModifiers();
        if (Modifier.isAbstract(modifiers)) {
            return false;
        }
        if (type.isAnonymousClass() || type.isLocalClass()) {
            return false;
        }
        return !type.isMemberClass() || Modifier.isStatic(modifiers);
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : HandlerClassImporter.class.getClassLoader();
    }
}

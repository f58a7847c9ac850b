package io.jobs4j.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Defines a handler class straight from its class file. The binary name is taken from the bytes,
 * so the file can live anywhere; when the file sits in a package-shaped directory tree, sibling
 * classes it references are loaded from the same tree.
 *
 * <p>One loader is used per imported file.
 */
final class HandlerClassLoader extends ClassLoader {

    private Path root;

    HandlerClassLoader(ClassLoader parent) {
        super("jobs4j-handlers", parent);
    }

    /**
     * Returns the class stored in {@code file}. If the parent loader can already see a class with the
     * same name, that class is returned instead, so handlers compiled into the application keep their
     * identity.
     */
    Class<?> define(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        String name = ClassFileNames.binaryName(bytes);

        Class<?> shared = findShared(name);
        if (shared != null) {
            return shared;
        }

        this.root = packageRoot(file, name);
        return defineClass(name, bytes, 0, bytes.length);
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
        if (root != null) {
            Path candidate = root.resolve(name.replace('.', '/') + ".class");
            if (Files.isRegularFile(candidate)) {
                try {
                    byte[] bytes = Files.readAllBytes(candidate);
                    return defineClass(name, bytes, 0, bytes.length);
                } catch (IOException e) {
                    throw new ClassNotFoundException(name, e);
                }
            }
        }
        throw new ClassNotFoundException(name);
    }

    private Class<?> findShared(String name) {
        ClassLoader parent = getParent();
        if (parent == null) {
            return null;
        }
        try {
            return Class.forName(name, false, parent);
        } catch (ClassNotFoundException notShared) {
            return null;
        }
    }

    // root/com/acme/jobs/SendEmailJob.class named com.acme.jobs.SendEmailJob -> root
    private static Path packageRoot(Path file, String className) {
        Path dir = file.toAbsolutePath().getParent();
        int lastDot = className.lastIndexOf('.');
        if (dir == null || lastDot < 0) {
            return dir;
        }
        String[] segments = className.substring(0, lastDot).split("\\.");
        Path packagePath = Path.of(segments[0], Arrays.copyOfRange(segments, 1, segments.length));
        if (!dir.endsWith(packagePath)) {
            return null;
        }
        Path root = dir;
        for (int i = 0; i < packagePath.getNameCount() && root != null; i++) {
            root = root.getParent();
        }
        return root;
    }
}

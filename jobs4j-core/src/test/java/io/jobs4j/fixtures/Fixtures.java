package io.jobs4j.fixtures;

import io.jobs4j.Dispatchable;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Puts handler class files on disk so they can be discovered: either copies of compiled fixtures,
 * or classes compiled at test time that the test class path does not contain.
 */
public final class Fixtures {

    /**
     * A handler in package {@code acme.jobs} that formats its payload through a package-private sibling.
     */
    public static final Map<String, String> PING_JOB_SOURCES = pingJobSources();

    private Fixtures() {
    }

    public static Path copyClass(Class<?> type, Path dir) throws IOException {
        Files.createDirectories(dir);
        String fileName = type.getSimpleName() + ".class";
        Path target = dir.resolve(fileName);
        try (InputStream in = type.getResourceAsStream(fileName)) {
            Objects.requireNonNull(in, "no class file for " + type.getName());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    public static boolean compilerAvailable() {
        return ToolProvider.getSystemJavaCompiler() != null;
    }

    /**
     * Compiles {@code sources} (binary name to source text) against the jobs4j API and the test fixtures,
     * writing class files in package layout under {@code classesDir}.
     */
    public static void compile(Map<String, String> sources, Path sourceDir, Path classesDir) throws IOException {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("no system Java compiler, run the tests on a JDK");
        }

        List<File> files = new ArrayList<>();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            Path file = sourceDir.resolve(source.getKey().replace('.', '/') + ".java");
            Files.createDirectories(file.getParent());
            Files.writeString(file, source.getValue());
            files.add(file.toFile());
        }
        Files.createDirectories(classesDir);

        String classPath = codeSource(Dispatchable.class) + File.pathSeparator + codeSource(Inbox.class);
        List<String> options = List.of("-d", classesDir.toString(), "-classpath", classPath);
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager = compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
            boolean compiled = compiler.getTask(null, fileManager, diagnostics, options, null,
                    fileManager.getJavaFileObjectsFromFiles(files)).call();
            if (!compiled) {
                throw new IllegalStateException("compilation failed: " + diagnostics.getDiagnostics());
            }
        }
    }

    // the surefire class path may be a manifest-only jar, so point javac at the real locations
    private static String codeSource(Class<?> type) {
        try {
            return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("cannot locate classes of " + type.getName(), e);
        }
    }

    private static Map<String, String> pingJobSources() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("acme.jobs.PingJob", String.join("\n",
                "package acme.jobs;",
                "",
                "import io.jobs4j.Dispatchable;",
                "import io.jobs4j.annotation.Queue;",
                "import io.jobs4j.fixtures.Inbox;",
                "",
                "@Queue(\"pings\")",
                "public class PingJob implements Dispatchable<String> {",
                "    @Override",
                "    public void handle(String payload) {",
                "        Inbox.RECEIVED.add(Greeting.format(payload));",
                "    }",
                "}",
                ""));
        sources.put("acme.jobs.Greeting", String.join("\n",
                "package acme.jobs;",
                "",
                "final class Greeting {",
                "    private Greeting() {",
                "    }",
                "",
                "    static String format(String payload) {",
                "        return \"pong:\" + payload;",
                "    }",
                "}",
                ""));
        return Map.copyOf(sources);
    }
}

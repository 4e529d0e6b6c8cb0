package io.github.cobfuscator.helpers;

import org.junit.jupiter.api.Assumptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Compiles C sources with the system compiler and runs the result. Tests using it are
 * skipped when no {@code cc} is installed.
 */
public final class NativeRunner {

    private static final String COMPILER = "cc";
    private static Boolean available;

    private NativeRunner() {
    }

    public static synchronized void assumeCompiler() {
        if (available == null) {
            available = ProcessHelper.isAvailable(COMPILER);
        }
        Assumptions.assumeTrue(available, "no C compiler available");
    }

    /** Builds {@code source} as a program and returns its standard output. */
    public static String compileAndRun(String name, String source) throws IOException {
        Path temp = Files.createTempDirectory("c-obfuscator-native-");
        try {
            Path file = temp.resolve(name);
            Files.writeString(file, source, StandardCharsets.UTF_8);
            ProcessHelper.run(temp, 60_000, Arrays.asList(COMPILER, "-std=c99", "-O0", "-w", "-o", "program",
                    file.getFileName().toString())).check("cc " + name);
            return ProcessHelper.run(temp, 20_000, Arrays.asList(temp.resolve("program").toString()))
                    .check("run " + name).stdout;
        } finally {
            deleteTree(temp);
        }
    }

    public static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
        }
    }
}

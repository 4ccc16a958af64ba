package com.acme.perfgate.lifecycle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Scratch directory for logs, generated configs and load scripts; deleted on close.
 */
public final class TempWorkspace implements AutoCloseable {
    private final Path root;

    private TempWorkspace(Path root) {
        this.root = root;
    }

    public static TempWorkspace create(String prefix) throws IOException {
        return new TempWorkspace(Files.createTempDirectory(prefix));
    }

    public Path root() {
        return root;
    }

    public Path resolve(String name) {
        return root.resolve(name);
    }

    @Override
    public void close() throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}

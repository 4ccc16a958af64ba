package com.acme.perfgate.lifecycle;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * {@code PATH} lookup for external tools.
 */
public final class Executables {
    private Executables() {
    }

    /**
     * A name containing a path separator is checked as-is; anything else is searched in
     * the {@code PATH} entries of {@code env}.
     */
    public static Optional<Path> find(String name, Map<String, String> env) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        if (name.contains(File.separator)) {
            Path direct = Path.of(name);
            return isExecutable(direct) ? Optional.of(direct) : Optional.empty();
        }
        String pathVar = env.get("PATH");
        if (pathVar == null || pathVar.isBlank()) {
            return Optional.empty();
        }
        for (String dir : pathVar.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, name);
            if (isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}

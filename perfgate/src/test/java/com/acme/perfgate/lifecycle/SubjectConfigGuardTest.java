package com.acme.perfgate.lifecycle;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubjectConfigGuardTest {
    @TempDir
    Path dir;

    @Test
    void shouldRestoreOriginalConfig() throws Exception {
        Path config = dir.resolve("config.yaml");
        Path scratch = Files.createDirectories(dir.resolve("scratch"));
        Files.writeString(config, "original: true\n");

        try (SubjectConfigGuard guard = SubjectConfigGuard.open(config, scratch)) {
            assertTrue(guard.hadOriginal());
            guard.install("generated: 1\n");
            guard.install("generated: 2\n");
            assertEquals("generated: 2\n", Files.readString(config));
        }
        assertEquals("original: true\n", Files.readString(config));
    }

    @Test
    void shouldRemoveGeneratedConfigWhenNoneExisted() throws Exception {
        Path config = dir.resolve("sub/config.yaml");
        try (SubjectConfigGuard guard = SubjectConfigGuard.open(config, dir)) {
            assertFalse(guard.hadOriginal());
            guard.install("generated: 1\n");
            assertTrue(Files.exists(config));
        }
        assertFalse(Files.exists(config));
    }
}

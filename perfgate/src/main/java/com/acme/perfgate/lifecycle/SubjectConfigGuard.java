package com.acme.perfgate.lifecycle;

import com.acme.perfgate.model.GateSetupException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

/**
 * Owns the shared subject config path for one invocation. The pre-existing file is
 * backed up on open and restored on close; if there was none, the generated file is
 * deleted on close.
 */
public final class SubjectConfigGuard implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SubjectConfigGuard.class.getName());

    private final Path target;
    private final Path backup;

    private SubjectConfigGuard(Path target, Path backup) {
        this.target = target;
        this.backup = backup;
    }

    /**
     * @param backupDir scratch directory that outlives the guard
     */
    public static SubjectConfigGuard open(Path target, Path backupDir) {
        Path backup = null;
        try {
            if (Files.isRegularFile(target)) {
                backup = backupDir.resolve(target.getFileName() + ".bak");
                Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                Path saved = backup;
                LOG.fine(() -> "Subject config backed up from=" + target + " to=" + saved);
            }
        } catch (IOException e) {
            throw new GateSetupException("failed to back up subject config " + target + ": " + e.getMessage(), e);
        }
        return new SubjectConfigGuard(target, backup);
    }

    public Path target() {
        return target;
    }

    public boolean hadOriginal() {
        return backup != null;
    }

    public void install(String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        if (backup != null) {
            Files.copy(backup, target, StandardCopyOption.REPLACE_EXISTING);
            LOG.fine(() -> "Subject config restored file=" + target);
        } else {
            Files.deleteIfExists(target);
        }
    }
}

package org.jsondb;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writing the temporary file or replacing the target failed.
 * The target file is unchanged and the temporary file, if any, is left for diagnosis.
 */
public class PersistenceException extends IOException {
    private final Path target;
    private final Path tempFile;

    public PersistenceException(Path target, Path tempFile, IOException cause) {
        super(String.format("Failed to persist %s via %s: %s", target, tempFile, cause.getMessage()), cause);
        this.target = target;
        this.tempFile = tempFile;
    }

    public Path getTarget() {
        return target;
    }

    public Path getTempFile() {
        return tempFile;
    }
}

package de.mirkosertic.filequality.discovery;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The analysis root cannot be resolved or read. This is the only failure that aborts a run.
 */
public class AccessException extends IOException {

    private final Path path;

    public AccessException(final Path path, final String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public AccessException(final Path path, final String message, final Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

package de.mirkosertic.filequality.cache;

import java.nio.file.Path;

/**
 * A cache file exists but cannot be turned back into a result.
 */
public class CacheCorruptionException extends Exception {

    private final Path file;

    public CacheCorruptionException(final Path file, final String message) {
        super(message + ": " + file);
        this.file = file;
    }

    public CacheCorruptionException(final Path file, final String message, final Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}

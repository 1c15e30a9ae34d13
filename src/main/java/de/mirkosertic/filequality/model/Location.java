package de.mirkosertic.filequality.model;

/**
 * Position of a finding inside a file.
 *
 * @param line       1-based line number, or 0 if unknown
 * @param byteOffset 0-based byte offset, or -1 if unknown
 */
public record Location(int line, long byteOffset) {

    public static Location line(final int line) {
        return new Location(line, -1);
    }

    public static Location at(final int line, final long byteOffset) {
        return new Location(line, byteOffset);
    }
}

package de.mirkosertic.filequality.model;

import java.nio.file.Path;

/**
 * Structural properties of a file under analysis.
 *
 * @param path         absolute, normalized path
 * @param relativePath path relative to the analysis root (the file name for explicit file lists)
 * @param size         size in bytes
 * @param extension    lower-case extension without the dot, empty if none
 * @param mediaType    media type detected from name and leading bytes
 * @param text         whether the content looks like text
 */
public record FileMetadata(
        Path path,
        Path relativePath,
        long size,
        String extension,
        String mediaType,
        boolean text
) {

    public String fileName() {
        return path.getFileName().toString();
    }
}

package de.mirkosertic.filequality.model;

/**
 * Content and metadata of one file, handed to every applicable rule.
 * Rules must treat the byte array as read-only.
 */
public record FileContent(FileMetadata metadata, byte[] bytes) {

    public long size() {
        return bytes.length;
    }
}

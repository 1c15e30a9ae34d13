package de.mirkosertic.filequality.cache;

import de.mirkosertic.filequality.model.FileResult;

import java.nio.file.Path;

/**
 * @param relativePath path relative to the analysis root the result was computed for;
 *                     directory names and per-rule globs depend on it
 */
public record CacheEntry(Path path, String relativePath, String fingerprint, String ruleSetVersion, FileResult result) {

    public boolean matches(final String expectedRelativePath, final String expectedFingerprint,
                           final String expectedVersion) {
        return relativePath.equals(expectedRelativePath)
                && fingerprint.equals(expectedFingerprint)
                && ruleSetVersion.equals(expectedVersion);
    }
}

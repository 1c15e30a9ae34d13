package de.mirkosertic.filequality.cache;

import de.mirkosertic.filequality.model.FileResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores analysis results keyed by path, valid only for the same path relative to the
 * analysis root, an exact content fingerprint and rule-set version.
 * <p>
 * Implementations must be safe for concurrent use and must never fail an analysis:
 * storage problems degrade to cache misses.
 */
public interface ResultCache {

    /**
     * The cached result if one exists whose relative path, fingerprint and rule-set version all match.
     */
    Optional<FileResult> get(Path path, String relativePath, String fingerprint, String ruleSetVersion);

    void put(Path path, String fingerprint, String ruleSetVersion, FileResult result);

    void invalidate(Path path);

    void clear();
}

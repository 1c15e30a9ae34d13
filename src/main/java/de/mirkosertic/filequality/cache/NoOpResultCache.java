package de.mirkosertic.filequality.cache;

import de.mirkosertic.filequality.model.FileResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Used when caching is disabled: every lookup is a miss.
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public Optional<FileResult> get(final Path path, final String relativePath, final String fingerprint, final String ruleSetVersion) {
        return Optional.empty();
    }

    @Override
    public void put(final Path path, final String fingerprint, final String ruleSetVersion, final FileResult result) {
    }

    @Override
    public void invalidate(final Path path) {
    }

    @Override
    public void clear() {
    }
}

package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.model.FileResult;

/**
 * Result of one analyzer call and whether it was served from the cache.
 */
public record AnalyzedFile(FileResult result, boolean cacheHit) {
}

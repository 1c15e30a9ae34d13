package de.mirkosertic.filequality.analysis;

import java.util.List;

public record AnalysisStatistics(
        long filesFound,
        long filesAnalyzed,
        long cacheHits,
        long filesUnreadable,
        long ruleFailures,
        long bytesProcessed,
        long startTimeMs,
        long endTimeMs,
        /** Files currently being analyzed. */
        List<ActiveFile> currentlyProcessing
) {
    public double filesPerSecond() {
        final long elapsedMs = endTimeMs - startTimeMs;
        if (elapsedMs == 0) return 0;
        return (double) filesAnalyzed / (elapsedMs / 1000.0);
    }

    public double megabytesPerSecond() {
        final long elapsedMs = endTimeMs - startTimeMs;
        if (elapsedMs == 0) return 0;
        final double megabytes = bytesProcessed / (1024.0 * 1024.0);
        return megabytes / (elapsedMs / 1000.0);
    }

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    public record ActiveFile(String filePath, long processingDurationMs) {
    }
}

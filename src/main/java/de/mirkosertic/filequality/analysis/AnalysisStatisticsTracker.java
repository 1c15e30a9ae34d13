package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.FindingKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Tracks the progress of an analysis run and logs it periodically.
 * Thread-safe for use from multiple worker threads.
 */
public class AnalysisStatisticsTracker {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisStatisticsTracker.class);

    private final long progressIntervalMs;

    private final AtomicLong filesFound = new AtomicLong(0);
    private final AtomicLong filesAnalyzed = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong filesUnreadable = new AtomicLong(0);
    private final AtomicLong ruleFailures = new AtomicLong(0);
    private final AtomicLong bytesProcessed = new AtomicLong(0);

    // file path -> start timestamp in millis
    private final ConcurrentHashMap<String, Long> activeFiles = new ConcurrentHashMap<>();

    private final ScheduledExecutorService progressTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "progress-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile ScheduledFuture<?> progressTimerFuture;

    private volatile long startTime = 0;

    public AnalysisStatisticsTracker(final long progressIntervalMs) {
        this.progressIntervalMs = progressIntervalMs;
    }

    public void reset(final long fileCount) {
        filesFound.set(fileCount);
        filesAnalyzed.set(0);
        cacheHits.set(0);
        filesUnreadable.set(0);
        ruleFailures.set(0);
        bytesProcessed.set(0);
        activeFiles.clear();
        startTime = System.currentTimeMillis();
    }

    public void registerActiveFile(final Path path) {
        activeFiles.put(path.toString(), System.currentTimeMillis());
    }

    public void unregisterActiveFile(final Path path) {
        activeFiles.remove(path.toString());
    }

    public void recordResult(final AnalyzedFile analyzed) {
        final FileResult result = analyzed.result();
        filesAnalyzed.incrementAndGet();
        if (analyzed.cacheHit()) {
            cacheHits.incrementAndGet();
        }
        if (!result.isReadable()) {
            filesUnreadable.incrementAndGet();
        } else {
            bytesProcessed.addAndGet(result.size());
        }
        ruleFailures.addAndGet(result.findings().stream().filter(f -> f.kind() == FindingKind.RULE_FAILURE).count());
    }

    public void startPeriodicProgress() {
        if (progressIntervalMs <= 0) {
            return;
        }
        progressTimerFuture = progressTimerExecutor.scheduleAtFixedRate(
                this::logProgress,
                progressIntervalMs,
                progressIntervalMs,
                TimeUnit.MILLISECONDS
        );
        logger.debug("Started periodic progress logging every {}ms", progressIntervalMs);
    }

    public void stopPeriodicProgress() {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
            progressTimerFuture = null;
        }
    }

    public void shutdown() {
        stopPeriodicProgress();
        progressTimerExecutor.shutdown();
        try {
            if (!progressTimerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                progressTimerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            progressTimerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void logProgress() {
        try {
            final AnalysisStatistics stats = getStatistics();
            final StringBuilder message = new StringBuilder(String.format(Locale.ROOT,
                    "Analyzed %d/%d files (%d cached, %.1f files/sec, %.2f MB/sec)",
                    stats.filesAnalyzed(),
                    stats.filesFound(),
                    stats.cacheHits(),
                    stats.filesPerSecond(),
                    stats.megabytesPerSecond()));

            final List<AnalysisStatistics.ActiveFile> processing = stats.currentlyProcessing();
            if (!processing.isEmpty()) {
                message.append(", processing: ").append(processing.stream()
                        .map(af -> Path.of(af.filePath()).getFileName().toString())
                        .collect(Collectors.joining(", ")));
            }
            logger.info("Analysis progress: {}", message);
        } catch (final Exception e) {
            // A throwing task would silently cancel the periodic schedule
            logger.error("Failed to log analysis progress", e);
        }
    }

    public void logCompletion(final boolean complete) {
        final AnalysisStatistics stats = getStatistics();
        logger.info(String.format(Locale.ROOT,
                "Analysis %s: %d/%d files in %.1f seconds (%d cached, %d unreadable, %d rule failures)",
                complete ? "complete" : "cancelled",
                stats.filesAnalyzed(),
                stats.filesFound(),
                stats.elapsedTimeMs() / 1000.0,
                stats.cacheHits(),
                stats.filesUnreadable(),
                stats.ruleFailures()));
    }

    public AnalysisStatistics getStatistics() {
        final long now = System.currentTimeMillis();
        final List<AnalysisStatistics.ActiveFile> currentlyProcessing = new ArrayList<>();
        for (final Map.Entry<String, Long> entry : activeFiles.entrySet()) {
            currentlyProcessing.add(new AnalysisStatistics.ActiveFile(entry.getKey(), now - entry.getValue()));
        }

        return new AnalysisStatistics(
                filesFound.get(),
                filesAnalyzed.get(),
                cacheHits.get(),
                filesUnreadable.get(),
                ruleFailures.get(),
                bytesProcessed.get(),
                startTime,
                now,
                currentlyProcessing
        );
    }
}

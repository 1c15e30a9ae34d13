package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.config.ApplicationConfig;
import de.mirkosertic.filequality.discovery.AccessException;
import de.mirkosertic.filequality.discovery.DiscoveryResult;
import de.mirkosertic.filequality.discovery.FileDiscoverer;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.report.ReportAggregator;
import de.mirkosertic.filequality.report.RunContext;
import de.mirkosertic.filequality.report.RunReport;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one analysis: discovery, parallel per-file analysis and aggregation into a report.
 * <p>
 * Only one run may be active at a time. {@link #cancel()} stops dispatching new files;
 * files already being analyzed finish, files still queued are dropped, and the resulting
 * report is marked incomplete.
 */
public class QualityAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(QualityAnalysisService.class);

    private final FileDiscoverer discoverer;
    private final FileAnalyzer analyzer;
    private final ReportAggregator aggregator;
    private final AnalysisExecutorService executor;
    private final AnalysisStatisticsTracker statisticsTracker;
    private final long fileTimeoutMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public QualityAnalysisService(final ApplicationConfig config,
                                  final FileDiscoverer discoverer,
                                  final FileAnalyzer analyzer,
                                  final ReportAggregator aggregator,
                                  final AnalysisExecutorService executor,
                                  final AnalysisStatisticsTracker statisticsTracker) {
        this.discoverer = discoverer;
        this.analyzer = analyzer;
        this.aggregator = aggregator;
        this.executor = executor;
        this.statisticsTracker = statisticsTracker;
        this.fileTimeoutMs = config.getFileTimeoutMs();
    }

    /**
     * Analyze every file below the root.
     *
     * @throws AccessException if the root does not exist or cannot be read
     */
    public RunReport run(final Path root) throws AccessException {
        final DiscoveryResult discovery = discoverer.discover(root);
        return analyze(discovery);
    }

    /**
     * Analyze an explicit list of files.
     */
    public RunReport run(final List<Path> files) {
        return analyze(discoverer.discover(files));
    }

    public void cancel() {
        if (running.get() && cancelled.compareAndSet(false, true)) {
            logger.info("Cancelling analysis");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public AnalysisStatistics getStatistics() {
        return statisticsTracker.getStatistics();
    }

    public void shutdown() {
        cancel();
        statisticsTracker.shutdown();
        executor.shutdown();
    }

    private RunReport analyze(final DiscoveryResult discovery) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An analysis is already running");
        }
        cancelled.set(false);
        try {
            statisticsTracker.reset(discovery.files().size());
            statisticsTracker.startPeriodicProgress();
            logger.info("Analyzing {} files below {} with {} threads",
                    discovery.files().size(), discovery.root(), executor.getPoolSize());

            final List<PendingFile> pending = new ArrayList<>();
            for (final Path file : discovery.files()) {
                if (cancelled.get()) {
                    break;
                }
                final PendingFile task = new PendingFile(file, discovery.relativize(file));
                task.future = executor.submit(() -> analyzeTracked(task));
                pending.add(task);
            }

            final List<FileResult> results = collect(pending);
            final boolean complete = results.size() == discovery.files().size();
            statisticsTracker.stopPeriodicProgress();
            statisticsTracker.logCompletion(complete);

            return aggregator.aggregate(results, new RunContext(discovery.root(), discovery.issues(), complete));
        } finally {
            statisticsTracker.stopPeriodicProgress();
            running.set(false);
        }
    }

    private @Nullable AnalyzedFile analyzeTracked(final PendingFile task) {
        if (cancelled.get()) {
            return null;
        }
        task.started.set(true);
        statisticsTracker.registerActiveFile(task.path);
        try {
            final AnalyzedFile analyzed = analyzer.analyzeFile(task.path, task.relativePath);
            // A worker that outlived its timeout was already counted by the collector
            if (task.recorded.compareAndSet(false, true)) {
                statisticsTracker.recordResult(analyzed);
            }
            return analyzed;
        } finally {
            statisticsTracker.unregisterActiveFile(task.path);
        }
    }

    private List<FileResult> collect(final List<PendingFile> pending) {
        final List<FileResult> results = new ArrayList<>();
        boolean interrupted = false;

        for (final PendingFile task : pending) {
            final Future<AnalyzedFile> future = task.future;
            if (cancelled.get() && !task.started.get() && !future.isDone()) {
                future.cancel(false);
                continue;
            }
            try {
                final AnalyzedFile analyzed = future.get(fileTimeoutMs, TimeUnit.MILLISECONDS);
                if (analyzed != null) {
                    results.add(analyzed.result());
                }
            } catch (final TimeoutException e) {
                future.cancel(true);
                logger.warn("Analysis of {} timed out after {} ms", task.path, fileTimeoutMs);
                results.add(failed(task, "Analysis timed out after " + fileTimeoutMs + " ms"));
            } catch (final ExecutionException e) {
                logger.error("Analysis of {} failed", task.path, e.getCause());
                results.add(failed(task, "Analysis failed: " + e.getCause()));
            } catch (final CancellationException e) {
                logger.debug("Analysis of {} was cancelled", task.path);
            } catch (final InterruptedException e) {
                logger.warn("Interrupted while waiting for {}, cancelling analysis", task.path);
                future.cancel(true);
                cancelled.set(true);
                interrupted = true;
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private FileResult failed(final PendingFile task, final String message) {
        final FileResult result = analyzer.unreadable(task.path, task.relativePath, message);
        if (task.recorded.compareAndSet(false, true)) {
            statisticsTracker.recordResult(new AnalyzedFile(result, false));
        }
        return result;
    }

    private static final class PendingFile {
        private final Path path;
        private final Path relativePath;
        private final AtomicBoolean started = new AtomicBoolean(false);
        private final AtomicBoolean recorded = new AtomicBoolean(false);
        private Future<AnalyzedFile> future;

        private PendingFile(final Path path, final Path relativePath) {
            this.path = path;
            this.relativePath = relativePath;
        }
    }
}

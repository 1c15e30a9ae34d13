package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.analysis.QualityScorer;
import de.mirkosertic.filequality.config.ApplicationConfig;
import de.mirkosertic.filequality.model.AggregateMode;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Severity;
import de.mirkosertic.filequality.rules.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-file results into a {@link RunReport}.
 * <p>
 * Runs the cross-file duplicate check, rescores the files it flags and computes the run
 * totals. The output depends only on the input results; the clock is read once for the
 * report timestamp.
 */
public class ReportAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ReportAggregator.class);

    private final RuleRegistry registry;
    private final QualityScorer scorer;
    private final AggregateMode aggregateMode;
    private final int worstOffenderCount;
    private final Clock clock;

    public ReportAggregator(final ApplicationConfig config, final RuleRegistry registry, final QualityScorer scorer) {
        this(registry, scorer, config.getAggregateMode(), config.getWorstOffenders(), Clock.systemUTC());
    }

    public ReportAggregator(final RuleRegistry registry, final QualityScorer scorer, final AggregateMode aggregateMode,
                            final int worstOffenderCount, final Clock clock) {
        this.registry = registry;
        this.scorer = scorer;
        this.aggregateMode = aggregateMode;
        this.worstOffenderCount = worstOffenderCount;
        this.clock = clock;
    }

    public RunReport aggregate(final List<FileResult> results, final RunContext context) {
        final List<FileResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparing(FileResult::path));

        final List<FileResult> finalResults = registry.crossFileSettings()
                .map(settings -> applyDuplicates(sorted, new DuplicateContentCheck(settings)))
                .orElse(sorted);

        final Map<Severity, Long> severityCounts = new EnumMap<>(Severity.class);
        for (final Severity severity : Severity.values()) {
            severityCounts.put(severity, 0L);
        }
        for (final FileResult result : finalResults) {
            for (final Finding finding : result.findings()) {
                severityCounts.merge(finding.severity(), 1L, Long::sum);
            }
        }

        final double aggregateScore = aggregateScore(finalResults);
        logger.info("Aggregated {} files: score {} ({})", finalResults.size(), aggregateScore, aggregateMode);

        return new RunReport(
                clock.instant(),
                registry.engineVersion(),
                registry.version(),
                context.root().toString(),
                context.complete(),
                aggregateScore,
                severityCounts,
                ReportSummary.of(finalResults, worstOffenderCount),
                finalResults,
                context.issues());
    }

    private List<FileResult> applyDuplicates(final List<FileResult> sorted, final DuplicateContentCheck check) {
        final Map<Path, Finding> duplicates = check.detect(sorted);
        if (duplicates.isEmpty()) {
            return sorted;
        }
        logger.info("Found {} files with duplicated content", duplicates.size());

        final List<FileResult> updated = new ArrayList<>(sorted.size());
        for (final FileResult result : sorted) {
            final Finding duplicate = duplicates.get(result.path());
            if (duplicate == null) {
                updated.add(result);
                continue;
            }
            final List<Finding> findings = new ArrayList<>(result.findings());
            findings.add(duplicate);
            final int score = scorer.score(findings);
            updated.add(result.withFindings(findings, score, scorer.status(findings, score, true)));
        }
        return updated;
    }

    double aggregateScore(final List<FileResult> results) {
        if (results.isEmpty()) {
            return QualityScorer.MAX_SCORE;
        }
        final int[] scores = results.stream().mapToInt(FileResult::score).sorted().toArray();
        final double value = switch (aggregateMode) {
            case MIN -> scores[0];
            case MEDIAN -> scores.length % 2 == 1
                    ? scores[scores.length / 2]
                    : (scores[scores.length / 2 - 1] + scores[scores.length / 2]) / 2.0;
            case MEAN -> (double) Arrays.stream(scores).sum() / scores.length;
        };
        return ReportSummary.round(value);
    }
}

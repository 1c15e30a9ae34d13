package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.discovery.DiscoveryIssue;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Severity;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result of one analysis run, as consumed by the presentation layer.
 * <p>
 * Results are sorted by path. The query methods never modify the report; they return new lists.
 *
 * @param complete false if the run was cancelled; the results then cover only the analyzed files
 */
public record RunReport(
        Instant timestamp,
        String engineVersion,
        String ruleSetVersion,
        String root,
        boolean complete,
        double aggregateScore,
        Map<Severity, Long> severityCounts,
        ReportSummary summary,
        List<FileResult> results,
        List<DiscoveryIssue> discoveryIssues
) {

    public RunReport {
        severityCounts = Collections.unmodifiableMap(new EnumMap<>(severityCounts));
        results = List.copyOf(results);
        discoveryIssues = List.copyOf(discoveryIssues);
    }

    public Optional<FileResult> result(final Path path) {
        final Path normalized = path.toAbsolutePath().normalize();
        return results.stream().filter(r -> r.path().equals(normalized)).findFirst();
    }

    /**
     * Files with at least one finding of exactly this severity.
     */
    public List<FileResult> withSeverity(final Severity severity) {
        return results.stream().filter(r -> r.hasSeverity(severity)).toList();
    }

    /**
     * All results, lowest score first; ties in path order.
     */
    public List<FileResult> sortedByScore() {
        return results.stream()
                .sorted(Comparator.comparingInt(FileResult::score).thenComparing(FileResult::path))
                .toList();
    }

    /**
     * The {@code n} files with findings and the lowest scores.
     */
    public List<FileResult> worstOffenders(final int n) {
        return ReportSummary.rankWorst(results, n);
    }

    public List<FileResult> filter(final ReportFilter filter) {
        return results.stream().filter(filter::matches).toList();
    }

    public long count(final Severity severity) {
        return severityCounts.getOrDefault(severity, 0L);
    }
}

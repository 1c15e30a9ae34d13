package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.QualityStatus;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Key figures of a run for the dashboard overview.
 *
 * @param passRate percentage of all files with status PASS, 0 for an empty run
 */
public record ReportSummary(
        int totalFiles,
        int filesWithFindings,
        int passCount,
        int failCount,
        int notGradedCount,
        double passRate,
        Map<String, Long> filesByExtension,
        Map<String, Long> filesByTopLevelDirectory,
        Map<String, Long> findingsByRule,
        Map<String, Long> scoreDistribution,
        List<String> worstOffenders
) {

    static final String NO_EXTENSION = "(none)";
    static final String ROOT_DIRECTORY = ".";

    private static final int BUCKET_WIDTH = 20;

    public ReportSummary {
        filesByExtension = Collections.unmodifiableMap(new TreeMap<>(filesByExtension));
        filesByTopLevelDirectory = Collections.unmodifiableMap(new TreeMap<>(filesByTopLevelDirectory));
        findingsByRule = Collections.unmodifiableMap(new TreeMap<>(findingsByRule));
        scoreDistribution = Collections.unmodifiableMap(new TreeMap<>(scoreDistribution));
        worstOffenders = List.copyOf(worstOffenders);
    }

    public static ReportSummary of(final List<FileResult> results, final int worstOffenderCount) {
        int withFindings = 0;
        int pass = 0;
        int fail = 0;
        int notGraded = 0;
        final Map<String, Long> byExtension = new TreeMap<>();
        final Map<String, Long> byDirectory = new TreeMap<>();
        final Map<String, Long> byRule = new TreeMap<>();
        final Map<String, Long> distribution = new TreeMap<>();

        for (final FileResult result : results) {
            if (result.hasFindings()) {
                withFindings++;
            }
            if (result.status() == QualityStatus.PASS) {
                pass++;
            } else if (result.status() == QualityStatus.FAIL) {
                fail++;
            } else {
                notGraded++;
            }
            byExtension.merge(result.extension().isEmpty() ? NO_EXTENSION : result.extension(), 1L, Long::sum);
            byDirectory.merge(topLevelDirectory(result.relativePath()), 1L, Long::sum);
            for (final Finding finding : result.findings()) {
                byRule.merge(finding.rule(), 1L, Long::sum);
            }
            distribution.merge(bucket(result.score()), 1L, Long::sum);
        }

        final double passRate = results.isEmpty() ? 0.0 : round(100.0 * pass / results.size());
        return new ReportSummary(results.size(), withFindings, pass, fail, notGraded, passRate,
                byExtension, byDirectory, byRule, distribution, worstOffenders(results, worstOffenderCount));
    }

    static List<FileResult> rankWorst(final List<FileResult> results, final int limit) {
        return results.stream()
                .filter(FileResult::hasFindings)
                .sorted(Comparator.comparingInt(FileResult::score).thenComparing(FileResult::path))
                .limit(Math.max(0, limit))
                .toList();
    }

    private static List<String> worstOffenders(final List<FileResult> results, final int limit) {
        return rankWorst(results, limit).stream().map(FileResult::relativePath).toList();
    }

    private static String topLevelDirectory(final String relativePath) {
        final Path path = Path.of(relativePath);
        return path.getNameCount() > 1 ? path.getName(0).toString() : ROOT_DIRECTORY;
    }

    // Zero-padded so the buckets sort numerically as strings; the top bucket includes 100
    static String bucket(final int score) {
        final int lower = Math.min(score / BUCKET_WIDTH, 4) * BUCKET_WIDTH;
        final int upper = lower == 80 ? 100 : lower + BUCKET_WIDTH - 1;
        return String.format(Locale.ROOT, "%02d-%02d", lower, upper);
    }

    static double round(final double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.analysis.QualityScorer;
import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.discovery.DiscoveryIssue;
import de.mirkosertic.filequality.model.AggregateMode;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.FindingKind;
import de.mirkosertic.filequality.model.QualityStatus;
import de.mirkosertic.filequality.model.Severity;
import de.mirkosertic.filequality.rules.RuleRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static de.mirkosertic.filequality.report.ReportTestSupport.ROOT;
import static de.mirkosertic.filequality.report.ReportTestSupport.clean;
import static de.mirkosertic.filequality.report.ReportTestSupport.result;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReportAggregator Tests")
class ReportAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-01-02T03:04:05Z");

    private static ReportAggregator aggregator(final AggregateMode mode, final boolean duplicateCheck) {
        final RuleRegistry.Builder builder = RuleRegistry.builder().engineVersion("test");
        if (duplicateCheck) {
            builder.crossFileRule(RuleSettings.defaults(RuleRegistry.DUPLICATE_CONTENT));
        }
        final RuleRegistry registry = builder.build();
        return new ReportAggregator(registry, new QualityScorer(registry, 80), mode, 10,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Duplicate scenario")
    class Duplicates {

        @Test
        @DisplayName("Two identical files: one flagged, aggregate score 95")
        void twoIdenticalFiles() {
            // Given
            final List<FileResult> results = List.of(clean("b.txt", "hello\n"), clean("a.txt", "hello\n"));

            // When
            final RunReport report = aggregator(AggregateMode.MEAN, true).aggregate(results, RunContext.complete(ROOT));

            // Then
            final FileResult a = report.result(ROOT.resolve("a.txt")).orElseThrow();
            final FileResult b = report.result(ROOT.resolve("b.txt")).orElseThrow();
            assertThat(a.findings()).isEmpty();
            assertThat(a.score()).isEqualTo(100);
            assertThat(b.findings()).singleElement().satisfies(finding -> {
                assertThat(finding.kind()).isEqualTo(FindingKind.DUPLICATE);
                assertThat(finding.message()).contains("a.txt");
            });
            assertThat(b.score()).isEqualTo(90);
            assertThat(b.status()).isEqualTo(QualityStatus.PASS);
            assertThat(report.aggregateScore()).isEqualTo(95.0);
            assertThat(report.count(Severity.MEDIUM)).isEqualTo(1);
        }

        @Test
        @DisplayName("Duplicate findings should be appended to existing findings and rescored")
        void shouldRescoreAffectedFiles() {
            final FileResult flagged = result("b.txt", "same", 75, QualityStatus.FAIL,
                    Finding.issue("x", Severity.HIGH, "m"));

            final RunReport report = aggregator(AggregateMode.MEAN, true)
                    .aggregate(List.of(clean("a.txt", "same"), flagged), RunContext.complete(ROOT));

            final FileResult b = report.result(ROOT.resolve("b.txt")).orElseThrow();
            assertThat(b.findings()).extracting(Finding::kind).containsExactly(FindingKind.ISSUE, FindingKind.DUPLICATE);
            assertThat(b.score()).isEqualTo(65);
            assertThat(b.status()).isEqualTo(QualityStatus.FAIL);
        }

        @Test
        @DisplayName("Without the duplicate check identical files stay untouched")
        void disabledCheckShouldNotFlag() {
            final RunReport report = aggregator(AggregateMode.MEAN, false)
                    .aggregate(List.of(clean("a.txt", "x"), clean("b.txt", "x")), RunContext.complete(ROOT));

            assertThat(report.results()).allSatisfy(r -> assertThat(r.findings()).isEmpty());
            assertThat(report.aggregateScore()).isEqualTo(100.0);
        }
    }

    @Nested
    @DisplayName("Totals")
    class Totals {

        private final List<FileResult> results = List.of(
                result("a.txt", "1", 100, QualityStatus.PASS),
                result("b.txt", "2", 90, QualityStatus.PASS, Finding.issue("x", Severity.MEDIUM, "m")),
                result("c.txt", "3", 40, QualityStatus.FAIL, Finding.issue("x", Severity.CRITICAL, "m"),
                        Finding.issue("x", Severity.MEDIUM, "m")),
                result("d.txt", "4", 95, QualityStatus.PASS, Finding.issue("x", Severity.LOW, "m")));

        @Test
        @DisplayName("Should compute the aggregate score per mode")
        void shouldComputeAggregateScore() {
            assertThat(aggregator(AggregateMode.MEAN, false).aggregate(results, RunContext.complete(ROOT)).aggregateScore())
                    .isEqualTo(81.25);
            assertThat(aggregator(AggregateMode.MEDIAN, false).aggregate(results, RunContext.complete(ROOT)).aggregateScore())
                    .isEqualTo(92.5);
            assertThat(aggregator(AggregateMode.MIN, false).aggregate(results, RunContext.complete(ROOT)).aggregateScore())
                    .isEqualTo(40.0);
        }

        @Test
        @DisplayName("An empty run should score 100 and report every severity with zero")
        void emptyRun() {
            final RunReport report = aggregator(AggregateMode.MEAN, true).aggregate(List.of(), RunContext.complete(ROOT));

            assertThat(report.aggregateScore()).isEqualTo(100.0);
            assertThat(report.severityCounts()).containsOnlyKeys(Severity.values()).doesNotContainValue(1L);
            assertThat(report.summary().totalFiles()).isZero();
            assertThat(report.summary().passRate()).isZero();
        }

        @Test
        @DisplayName("Should count findings by severity and carry run metadata")
        void shouldCountBySeverity() {
            final List<DiscoveryIssue> issues = List.of(new DiscoveryIssue(ROOT.resolve("locked"), "Unreadable: denied"));

            final RunReport report = aggregator(AggregateMode.MEAN, false)
                    .aggregate(results, new RunContext(ROOT, issues, false));

            assertThat(report.severityCounts()).containsEntry(Severity.MEDIUM, 2L)
                    .containsEntry(Severity.CRITICAL, 1L)
                    .containsEntry(Severity.LOW, 1L)
                    .containsEntry(Severity.HIGH, 0L)
                    .containsEntry(Severity.INFO, 0L);
            assertThat(report.timestamp()).isEqualTo(NOW);
            assertThat(report.engineVersion()).isEqualTo("test");
            assertThat(report.root()).isEqualTo(ROOT.toString());
            assertThat(report.complete()).isFalse();
            assertThat(report.discoveryIssues()).isEqualTo(issues);
        }

        @Test
        @DisplayName("Results should be sorted by path regardless of input order")
        void shouldSortResults() {
            final RunReport report = aggregator(AggregateMode.MEAN, false)
                    .aggregate(List.of(results.get(3), results.get(0), results.get(2), results.get(1)),
                            RunContext.complete(ROOT));

            assertThat(report.results()).extracting(FileResult::relativePath)
                    .containsExactly("a.txt", "b.txt", "c.txt", "d.txt");
        }
    }
}

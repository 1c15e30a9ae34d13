package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.QualityStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnalysisStatisticsTracker Tests")
class AnalysisStatisticsTrackerTest {

    private final AnalysisStatisticsTracker tracker = new AnalysisStatisticsTracker(0);

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    private static FileResult result(final String name, final long size, final Finding... findings) {
        return new FileResult(Path.of("/project", name).toAbsolutePath(), name, "fp", "nfp", size, "txt",
                "text/plain", List.of(findings), 100, QualityStatus.PASS);
    }

    @Test
    @DisplayName("Should count analyzed files, cache hits and failures")
    void shouldCountResults() {
        // Given
        tracker.reset(4);

        // When
        tracker.recordResult(new AnalyzedFile(result("a.txt", 100), false));
        tracker.recordResult(new AnalyzedFile(result("b.txt", 50), true));
        tracker.recordResult(new AnalyzedFile(result("c.txt", 0, Finding.unreadable("Unreadable: denied")), false));
        tracker.recordResult(new AnalyzedFile(result("d.txt", 10,
                Finding.ruleFailure("naming", new IllegalStateException("boom"))), false));

        // Then
        final AnalysisStatistics stats = tracker.getStatistics();
        assertThat(stats.filesFound()).isEqualTo(4);
        assertThat(stats.filesAnalyzed()).isEqualTo(4);
        assertThat(stats.cacheHits()).isEqualTo(1);
        assertThat(stats.filesUnreadable()).isEqualTo(1);
        assertThat(stats.ruleFailures()).isEqualTo(1);
        assertThat(stats.bytesProcessed()).isEqualTo(160);
    }

    @Test
    @DisplayName("Should list files that are currently being analyzed")
    void shouldTrackActiveFiles() {
        tracker.reset(2);
        final Path file = Path.of("/project/slow.txt").toAbsolutePath();

        tracker.registerActiveFile(file);
        assertThat(tracker.getStatistics().currentlyProcessing())
                .extracting(AnalysisStatistics.ActiveFile::filePath)
                .containsExactly(file.toString());

        tracker.unregisterActiveFile(file);
        assertThat(tracker.getStatistics().currentlyProcessing()).isEmpty();
    }

    @Test
    @DisplayName("Reset should start a new run from zero")
    void shouldReset() {
        tracker.reset(1);
        tracker.recordResult(new AnalyzedFile(result("a.txt", 100), true));

        tracker.reset(3);

        final AnalysisStatistics stats = tracker.getStatistics();
        assertThat(stats.filesFound()).isEqualTo(3);
        assertThat(stats.filesAnalyzed()).isZero();
        assertThat(stats.cacheHits()).isZero();
        assertThat(stats.bytesProcessed()).isZero();
    }
}

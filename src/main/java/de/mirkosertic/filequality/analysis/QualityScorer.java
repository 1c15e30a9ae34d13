package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.FindingKind;
import de.mirkosertic.filequality.model.QualityStatus;
import de.mirkosertic.filequality.model.Severity;
import de.mirkosertic.filequality.rules.RuleRegistry;

import java.util.List;

/**
 * Turns findings into a 0..100 score and a quality status.
 * <p>
 * Every finding costs its severity penalty multiplied by the weight of the rule that
 * produced it; the score never drops below zero. A file passes when its score reaches the
 * threshold and it has no CRITICAL finding.
 */
public class QualityScorer {

    public static final int MAX_SCORE = 100;

    private final RuleRegistry registry;
    private final int passThreshold;

    public QualityScorer(final RuleRegistry registry, final int passThreshold) {
        this.registry = registry;
        this.passThreshold = passThreshold;
    }

    public int score(final List<Finding> findings) {
        long penalty = 0;
        for (final Finding finding : findings) {
            penalty += Math.round(finding.severity().penalty() * registry.weightOf(finding.rule()));
        }
        return (int) Math.max(0, MAX_SCORE - penalty);
    }

    /**
     * @param graded whether at least one rule looked at the file
     */
    public QualityStatus status(final List<Finding> findings, final int score, final boolean graded) {
        if (!graded || findings.stream().anyMatch(f -> f.kind() == FindingKind.UNREADABLE)) {
            return QualityStatus.NOT_GRADED;
        }
        if (score >= passThreshold && findings.stream().noneMatch(f -> f.severity() == Severity.CRITICAL)) {
            return QualityStatus.PASS;
        }
        return QualityStatus.FAIL;
    }

    public int getPassThreshold() {
        return passThreshold;
    }
}

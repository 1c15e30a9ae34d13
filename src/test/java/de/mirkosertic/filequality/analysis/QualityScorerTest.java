package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.QualityStatus;
import de.mirkosertic.filequality.model.Severity;
import de.mirkosertic.filequality.rules.QualityRule;
import de.mirkosertic.filequality.rules.RuleRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QualityScorer Tests")
class QualityScorerTest {

    private static QualityRule named(final String name) {
        return new QualityRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return name;
            }

            @Override
            public List<Finding> evaluate(final FileContent content) {
                return List.of();
            }
        };
    }

    private final RuleRegistry registry = RuleRegistry.builder()
            .register(named("normal"))
            .register(named("heavy"), RuleSettings.fromMap("heavy", Map.of("weight", 2.0)))
            .register(named("light"), RuleSettings.fromMap("light", Map.of("weight", 0.5)))
            .build();

    private final QualityScorer scorer = new QualityScorer(registry, 80);

    @Test
    @DisplayName("No findings should score 100 and pass")
    void noFindingsShouldPass() {
        assertThat(scorer.score(List.of())).isEqualTo(100);
        assertThat(scorer.status(List.of(), 100, true)).isEqualTo(QualityStatus.PASS);
    }

    @Test
    @DisplayName("Penalties should be weighted per rule")
    void penaltiesShouldBeWeighted() {
        final List<Finding> findings = List.of(
                Finding.issue("normal", Severity.MEDIUM, "m"),
                Finding.issue("heavy", Severity.LOW, "m"),
                Finding.issue("light", Severity.LOW, "m"),
                Finding.issue("light", Severity.INFO, "m"));

        // 10 + 2 * 5 + round(0.5 * 5) + 0
        assertThat(scorer.score(findings)).isEqualTo(100 - 10 - 10 - 3);
    }

    @Test
    @DisplayName("Score should never drop below zero")
    void scoreShouldNotBeNegative() {
        assertThat(scorer.score(Collections.nCopies(5, Finding.issue("heavy", Severity.CRITICAL, "m")))).isZero();
    }

    @Test
    @DisplayName("Status should follow threshold, critical findings and readability")
    void statusRules() {
        final List<Finding> low = List.of(Finding.issue("normal", Severity.LOW, "m"));
        final List<Finding> critical = List.of(Finding.issue("light", Severity.CRITICAL, "m"));

        assertThat(scorer.status(low, 80, true)).isEqualTo(QualityStatus.PASS);
        assertThat(scorer.status(low, 79, true)).isEqualTo(QualityStatus.FAIL);
        assertThat(scorer.status(critical, scorer.score(critical), true)).isEqualTo(QualityStatus.FAIL);
        assertThat(scorer.status(List.of(Finding.unreadable("x")), 75, true)).isEqualTo(QualityStatus.NOT_GRADED);
        assertThat(scorer.status(List.of(), 100, false)).isEqualTo(QualityStatus.NOT_GRADED);
    }
}

package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Location;
import de.mirkosertic.filequality.model.Severity;
import de.mirkosertic.filequality.rules.LineEndingRule.LineEnding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LineEndingRule Tests")
class LineEndingRuleTest {

    private static LineEndingRule allowAll() {
        return new LineEndingRule(EnumSet.allOf(LineEnding.class), true, 20);
    }

    @Test
    @DisplayName("Consistent line endings without trailing blanks should pass")
    void consistentFileShouldPass() {
        assertThat(allowAll().evaluate(RuleTestSupport.text("a.txt", "one\ntwo\nthree\n"))).isEmpty();
        assertThat(allowAll().evaluate(RuleTestSupport.text("b.txt", "one\r\ntwo"))).isEmpty();
        assertThat(allowAll().evaluate(RuleTestSupport.text("c.txt", ""))).isEmpty();
    }

    @Test
    @DisplayName("Mixed line endings should produce one MEDIUM finding at the first minority line")
    void mixedLineEndingsShouldBeFlagged() {
        // Given: lines 1 and 3 end in LF, line 2 in CRLF
        final List<Finding> findings = allowAll().evaluate(RuleTestSupport.text("a.txt", "one\ntwo\r\nthree\n"));

        // Then
        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.message()).contains("LF=2").contains("CRLF=1");
            assertThat(finding.location()).isEqualTo(Location.line(2));
        });
    }

    @Test
    @DisplayName("A disallowed style should produce one LOW finding")
    void disallowedStyleShouldBeFlagged() {
        final LineEndingRule rule = new LineEndingRule(EnumSet.of(LineEnding.LF), false, 20);

        final List<Finding> findings = rule.evaluate(RuleTestSupport.text("a.txt", "one\r\ntwo\r\n"));

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(Severity.LOW);
            assertThat(finding.message()).startsWith("CRLF line endings are not allowed");
        });
    }

    @Test
    @DisplayName("Lone CR should be recognized as its own style")
    void loneCarriageReturnShouldBeRecognized() {
        final LineEndingRule rule = new LineEndingRule(EnumSet.of(LineEnding.LF, LineEnding.CRLF), false, 20);

        assertThat(rule.evaluate(RuleTestSupport.text("mac.txt", "one\rtwo\r")))
                .extracting(Finding::message)
                .containsExactly("CR line endings are not allowed (2 lines)");
    }

    @Test
    @DisplayName("Trailing whitespace should be reported per line, including the last line")
    void trailingWhitespaceShouldBeReportedPerLine() {
        final List<Finding> findings = allowAll().evaluate(RuleTestSupport.text("a.txt", "one \ntwo\nthree\t"));

        assertThat(findings).hasSize(2);
        assertThat(findings).extracting(f -> f.location().line()).containsExactly(1, 3);
        assertThat(findings).allSatisfy(f -> assertThat(f.severity()).isEqualTo(Severity.LOW));
    }

    @Test
    @DisplayName("Should never exceed the per-file finding cap")
    void shouldCapFindings() {
        // Given: 50 lines with trailing blanks and mixed endings
        final StringBuilder content = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            content.append("line ").append(i % 2 == 0 ? "\n" : "\r\n");
        }
        final LineEndingRule rule = new LineEndingRule(EnumSet.of(LineEnding.LF), true, 5);

        // When
        final List<Finding> findings = rule.evaluate(RuleTestSupport.text("a.txt", content.toString()));

        // Then: mixed first, then the disallowed style, then whitespace
        assertThat(findings).hasSize(5);
        assertThat(findings.get(0).severity()).isEqualTo(Severity.MEDIUM);
        assertThat(findings.get(1).message()).startsWith("CRLF");
    }

    @Test
    @DisplayName("Should read its options from the settings")
    void shouldReadSettings() {
        final LineEndingRule rule = LineEndingRule.fromSettings(RuleSettings.of(LineEndingRule.NAME,
                Map.of("allowed-line-endings", List.of("lf"), "check-trailing-whitespace", false)));

        assertThat(rule.getAllowedLineEndings()).containsExactly(LineEnding.LF);
        assertThat(rule.evaluate(RuleTestSupport.text("a.txt", "x \n"))).isEmpty();
    }
}

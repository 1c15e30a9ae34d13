package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Location;
import de.mirkosertic.filequality.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EncodingRule Tests")
class EncodingRuleTest {

    private final EncodingRule rule = new EncodingRule(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Valid UTF-8 including multi-byte characters should pass")
    void validUtf8ShouldPass() {
        assertThat(rule.evaluate(RuleTestSupport.text("a.txt", "Grüße, 世界\nzweite Zeile\n"))).isEmpty();
        assertThat(rule.evaluate(RuleTestSupport.text("empty.txt", ""))).isEmpty();
    }

    @Test
    @DisplayName("Should report the first malformed sequence with line and offset")
    void shouldReportFirstMalformedSequence() {
        // Given: 0xFF is never valid in UTF-8; second line starts at offset 4
        final byte[] bytes = {'a', 'b', 'c', '\n', 'd', (byte) 0xFF, 'e', (byte) 0xFE};

        // When
        final List<Finding> findings = rule.evaluate(RuleTestSupport.content("bad.txt", bytes, true));

        // Then
        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(finding.rule()).isEqualTo(EncodingRule.NAME);
            assertThat(finding.location()).isEqualTo(new Location(2, 5));
            assertThat(finding.message()).startsWith("Malformed UTF-8");
        });
    }

    @Test
    @DisplayName("Should report a truncated multi-byte sequence at the end")
    void shouldReportTruncatedSequence() {
        final byte[] bytes = {'o', 'k', (byte) 0xC3};

        assertThat(rule.evaluate(RuleTestSupport.content("cut.txt", bytes, true)))
                .singleElement()
                .extracting(f -> f.location().byteOffset())
                .isEqualTo(2L);
    }

    @Test
    @DisplayName("Should only apply to text files")
    void shouldOnlyApplyToText() {
        assertThat(rule.appliesTo(RuleTestSupport.text("a.txt", "x").metadata())).isTrue();
        assertThat(rule.appliesTo(RuleTestSupport.content("a.png", new byte[]{0}, false).metadata())).isFalse();
    }

    @Test
    @DisplayName("Should honour a configured encoding")
    void shouldHonourConfiguredEncoding() {
        final EncodingRule ascii = EncodingRule.fromSettings(
                RuleSettings.of(EncodingRule.NAME, Map.of("expected-encoding", "US-ASCII")));

        assertThat(ascii.getExpectedEncoding()).isEqualTo(StandardCharsets.US_ASCII);
        assertThat(ascii.evaluate(RuleTestSupport.text("a.txt", "plain"))).isEmpty();
        assertThat(ascii.evaluate(RuleTestSupport.text("b.txt", "Grüße"))).hasSize(1);
    }
}

package de.mirkosertic.filequality.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleSettings Tests")
class RuleSettingsTest {

    @Test
    @DisplayName("Should lift common keys out of the options")
    void shouldLiftCommonKeys() {
        // Given
        final Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("enabled", false);
        raw.put("weight", 2.5);
        raw.put("include-patterns", List.of("*.java"));
        raw.put("exclude-patterns", List.of("**/generated/**"));
        raw.put("max-file-size-bytes", 10);

        // When
        final RuleSettings settings = RuleSettings.fromMap("file-size", raw);

        // Then
        assertThat(settings.enabled()).isFalse();
        assertThat(settings.weight()).isEqualTo(2.5);
        assertThat(settings.includePatterns()).containsExactly("*.java");
        assertThat(settings.excludePatterns()).containsExactly("**/generated/**");
        assertThat(settings.options()).containsOnlyKeys("max-file-size-bytes");
    }

    @Test
    @DisplayName("Should read a list option given as comma separated string")
    void shouldReadCommaSeparatedList() {
        final RuleSettings settings = RuleSettings.of("line-endings", Map.of("allowed-line-endings", "LF, CRLF"));

        assertThat(settings.getStringList("allowed-line-endings", List.of())).containsExactly("LF", "CRLF");
    }

    @Test
    @DisplayName("Fingerprint source should not depend on option insertion order")
    void fingerprintSourceShouldBeStable() {
        final Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", 2);
        final Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", 2);
        second.put("a", 1);

        assertThat(RuleSettings.of("x", first).fingerprintSource())
                .isEqualTo(RuleSettings.of("x", second).fingerprintSource());
        assertThat(RuleSettings.of("x", Map.of("a", 1)).fingerprintSource())
                .isNotEqualTo(RuleSettings.of("x", Map.of("a", 2)).fingerprintSource());
    }
}

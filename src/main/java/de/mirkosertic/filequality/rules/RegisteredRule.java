package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.discovery.FilePatternMatcher;

/**
 * A rule together with the settings it was registered with.
 */
public record RegisteredRule(QualityRule rule, RuleSettings settings, FilePatternMatcher matcher) {

    public RegisteredRule(final QualityRule rule, final RuleSettings settings) {
        this(rule, settings, new FilePatternMatcher(settings.includePatterns(), settings.excludePatterns()));
    }

    public String name() {
        return rule.name();
    }

    public double weight() {
        return settings.weight();
    }
}

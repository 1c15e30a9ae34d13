package de.mirkosertic.filequality.model;

import org.jspecify.annotations.Nullable;

/**
 * A single quality issue reported for a file by one rule.
 */
public record Finding(
        String rule,
        FindingKind kind,
        Severity severity,
        String message,
        @Nullable Location location
) {

    public static Finding issue(final String rule, final Severity severity, final String message) {
        return new Finding(rule, FindingKind.ISSUE, severity, message, null);
    }

    public static Finding issue(final String rule, final Severity severity, final String message, final Location location) {
        return new Finding(rule, FindingKind.ISSUE, severity, message, location);
    }

    public static Finding ruleFailure(final String rule, final Throwable cause) {
        final String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new Finding(rule, FindingKind.RULE_FAILURE, Severity.LOW,
                "Rule '" + rule + "' failed: " + reason, null);
    }

    public static Finding unreadable(final String message) {
        return new Finding("unreadable", FindingKind.UNREADABLE, Severity.HIGH, message, null);
    }

    public static Finding duplicate(final String rule, final Severity severity, final String canonicalPath) {
        return new Finding(rule, FindingKind.DUPLICATE, severity,
                "Content duplicates " + canonicalPath, null);
    }
}

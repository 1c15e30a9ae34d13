package de.mirkosertic.filequality.model;

import java.util.Locale;

/**
 * How per-file scores are combined into the aggregate score of a run.
 */
public enum AggregateMode {
    MEAN,
    MEDIAN,
    MIN;

    public static AggregateMode parse(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

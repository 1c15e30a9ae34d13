package de.mirkosertic.filequality.model;

/**
 * Severity of a {@link Finding}, ordered from least to most severe.
 * Each level carries the penalty it subtracts from a file's score.
 */
public enum Severity {
    INFO(0),
    LOW(5),
    MEDIUM(10),
    HIGH(25),
    CRITICAL(50);

    private final int penalty;

    Severity(final int penalty) {
        this.penalty = penalty;
    }

    public int penalty() {
        return penalty;
    }

    public boolean isAtLeast(final Severity other) {
        return this.ordinal() >= other.ordinal();
    }
}

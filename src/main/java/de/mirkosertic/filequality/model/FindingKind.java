package de.mirkosertic.filequality.model;

public enum FindingKind {
    /** Regular result of a quality rule. */
    ISSUE,
    /** Synthetic finding: the rule threw while evaluating the file. */
    RULE_FAILURE,
    /** Synthetic finding: the file could not be read or its analysis timed out. */
    UNREADABLE,
    /** Injected by the aggregator for all but the canonical member of a duplicate group. */
    DUPLICATE
}

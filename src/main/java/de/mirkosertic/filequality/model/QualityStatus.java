package de.mirkosertic.filequality.model;

public enum QualityStatus {
    PASS,
    FAIL,
    /** The file was unreadable or no rule applied to it. */
    NOT_GRADED
}

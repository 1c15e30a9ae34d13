package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.FileMetadata;
import de.mirkosertic.filequality.model.Finding;

import java.util.List;

/**
 * A named, independently evaluable quality check.
 * <p>
 * Implementations must be stateless with respect to a run and safe to call from several
 * worker threads at once. Exceptions thrown from {@link #evaluate(FileContent)} are caught
 * by the analyzer and reported as a single rule failure finding.
 */
public interface QualityRule {

    /**
     * Unique rule name, also used as the configuration key below {@code quality.rules}.
     */
    String name();

    /**
     * Short description of what this rule checks.
     */
    String description();

    /**
     * Whether the rule runs on this file at all, e.g. text files only.
     */
    default boolean appliesTo(final FileMetadata metadata) {
        return true;
    }

    /**
     * Evaluate one file.
     *
     * @param content the file's bytes and metadata
     * @return findings in the order they occur in the file, never null
     */
    List<Finding> evaluate(FileContent content);

    /**
     * The rule's own parameters in a stable textual form. Part of the rule-set version, so
     * two instances that can produce different findings must return different values.
     * Rules without parameters keep the default.
     */
    default String fingerprintSource() {
        return "";
    }
}

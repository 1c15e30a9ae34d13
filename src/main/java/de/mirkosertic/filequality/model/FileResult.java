package de.mirkosertic.filequality.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of analyzing one file. Never modified: re-evaluation produces a new instance.
 */
public record FileResult(
        @JsonSerialize(using = ToStringSerializer.class) Path path,
        String relativePath,
        @Nullable String fingerprint,
        @Nullable String normalizedFingerprint,
        long size,
        String extension,
        String mediaType,
        List<Finding> findings,
        int score,
        QualityStatus status
) {

    public FileResult {
        findings = List.copyOf(findings);
    }

    /**
     * Copy of this result with a different finding list and the score and status derived from it.
     */
    public FileResult withFindings(final List<Finding> newFindings, final int newScore, final QualityStatus newStatus) {
        return new FileResult(path, relativePath, fingerprint, normalizedFingerprint, size, extension, mediaType,
                newFindings, newScore, newStatus);
    }

    @JsonIgnore
    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    @JsonIgnore
    public boolean isReadable() {
        return findings.stream().noneMatch(f -> f.kind() == FindingKind.UNREADABLE);
    }

    public boolean hasSeverity(final Severity severity) {
        return findings.stream().anyMatch(f -> f.severity() == severity);
    }

    @JsonIgnore
    public Optional<Severity> maxSeverity() {
        return findings.stream()
                .map(Finding::severity)
                .max(Enum::compareTo);
    }
}

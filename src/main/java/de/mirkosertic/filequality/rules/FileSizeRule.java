package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Severity;

import java.util.List;
import java.util.Locale;

/**
 * Flags files larger than a configured number of bytes. The severity grows with the overage:
 * up to 1.5x the limit is LOW, up to 2x MEDIUM, up to 4x HIGH, beyond that CRITICAL.
 */
public class FileSizeRule implements QualityRule {

    public static final String NAME = "file-size";
    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 1024 * 1024;

    private final long maxFileSizeBytes;

    public FileSizeRule(final long maxFileSizeBytes) {
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("max-file-size-bytes must be positive, was " + maxFileSizeBytes);
        }
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public static FileSizeRule fromSettings(final RuleSettings settings) {
        return new FileSizeRule(settings.getLong("max-file-size-bytes", DEFAULT_MAX_FILE_SIZE_BYTES));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "File size must not exceed " + maxFileSizeBytes + " bytes";
    }

    @Override
    public String fingerprintSource() {
        return "max=" + maxFileSizeBytes;
    }

    @Override
    public List<Finding> evaluate(final FileContent content) {
        final long size = content.size();
        if (size <= maxFileSizeBytes) {
            return List.of();
        }
        final double overage = (double) (size - maxFileSizeBytes) / maxFileSizeBytes;
        return List.of(Finding.issue(NAME, severityFor(overage),
                String.format(Locale.ROOT, "File size %d bytes exceeds limit of %d bytes by %.0f%%",
                        size, maxFileSizeBytes, overage * 100)));
    }

    static Severity severityFor(final double overage) {
        if (overage <= 0.5) {
            return Severity.LOW;
        }
        if (overage <= 1.0) {
            return Severity.MEDIUM;
        }
        if (overage <= 3.0) {
            return Severity.HIGH;
        }
        return Severity.CRITICAL;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }
}

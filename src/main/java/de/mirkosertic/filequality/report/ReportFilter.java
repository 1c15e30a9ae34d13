package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.QualityStatus;
import de.mirkosertic.filequality.model.Severity;
import org.jspecify.annotations.Nullable;

/**
 * Selection of file results, as offered by the dashboard's filters. A null criterion matches everything.
 *
 * @param status      quality status to keep
 * @param extension   file extension to keep, without the dot
 * @param minSeverity keep files with at least one finding of this severity or worse
 */
public record ReportFilter(
        @Nullable QualityStatus status,
        @Nullable String extension,
        @Nullable Severity minSeverity
) {

    public static ReportFilter all() {
        return new ReportFilter(null, null, null);
    }

    public static ReportFilter status(final QualityStatus status) {
        return new ReportFilter(status, null, null);
    }

    public ReportFilter withExtension(final String newExtension) {
        return new ReportFilter(status, newExtension, minSeverity);
    }

    public ReportFilter withMinSeverity(final Severity newMinSeverity) {
        return new ReportFilter(status, extension, newMinSeverity);
    }

    public boolean matches(final FileResult result) {
        if (status != null && result.status() != status) {
            return false;
        }
        if (extension != null && !stripDot(extension).equalsIgnoreCase(result.extension())) {
            return false;
        }
        if (minSeverity != null) {
            return result.findings().stream().anyMatch(f -> f.severity().isAtLeast(minSeverity));
        }
        return true;
    }

    private static String stripDot(final String value) {
        return value.startsWith(".") ? value.substring(1) : value;
    }
}

package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cross-file check for files with identical content.
 * <p>
 * Files are grouped by content fingerprint (with whitespace removed when
 * {@code normalize-whitespace} is set). Within a group the lexically first path is the
 * canonical copy; every other member gets one DUPLICATE finding naming it.
 */
public class DuplicateContentCheck {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateContentCheck.class);

    private final String ruleName;
    private final boolean normalizeWhitespace;
    private final long minSizeBytes;
    private final Severity severity;

    public DuplicateContentCheck(final RuleSettings settings) {
        this.ruleName = settings.name();
        this.normalizeWhitespace = settings.getBoolean("normalize-whitespace", true);
        this.minSizeBytes = settings.getLong("min-size-bytes", 1);
        this.severity = Severity.valueOf(settings.getString("severity", Severity.MEDIUM.name()).toUpperCase(Locale.ROOT));
    }

    /**
     * @param sortedResults results in path order
     * @return the finding to add, per duplicate path
     */
    public Map<Path, Finding> detect(final List<FileResult> sortedResults) {
        final Map<String, List<FileResult>> groups = new LinkedHashMap<>();
        for (final FileResult result : sortedResults) {
            final String key = normalizeWhitespace ? result.normalizedFingerprint() : result.fingerprint();
            if (key == null || !result.isReadable() || result.size() < minSizeBytes) {
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(result);
        }

        final Map<Path, Finding> duplicates = new HashMap<>();
        for (final List<FileResult> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            final FileResult canonical = group.get(0);
            for (final FileResult duplicate : group.subList(1, group.size())) {
                duplicates.put(duplicate.path(), Finding.duplicate(ruleName, severity, canonical.relativePath()));
            }
            logger.debug("{} copies of {}", group.size() - 1, canonical.path());
        }
        return duplicates;
    }
}

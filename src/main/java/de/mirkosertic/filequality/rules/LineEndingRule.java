package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.FileMetadata;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Location;
import de.mirkosertic.filequality.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks line terminators and trailing whitespace of text files.
 * <ul>
 *   <li>one MEDIUM finding if a file mixes LF, CRLF and CR terminators</li>
 *   <li>one LOW finding per terminator style that is not allowed</li>
 *   <li>one LOW finding per line ending in spaces or tabs</li>
 * </ul>
 * The number of findings per file is capped by {@code max-findings-per-file}.
 */
public class LineEndingRule implements QualityRule {

    public static final String NAME = "line-endings";

    public enum LineEnding {
        LF, CRLF, CR
    }

    private final Set<LineEnding> allowedLineEndings;
    private final boolean checkTrailingWhitespace;
    private final int maxFindingsPerFile;

    public LineEndingRule(final Set<LineEnding> allowedLineEndings, final boolean checkTrailingWhitespace,
                          final int maxFindingsPerFile) {
        if (maxFindingsPerFile <= 0) {
            throw new IllegalArgumentException("max-findings-per-file must be positive, was " + maxFindingsPerFile);
        }
        this.allowedLineEndings = allowedLineEndings.isEmpty()
                ? EnumSet.allOf(LineEnding.class)
                : EnumSet.copyOf(allowedLineEndings);
        this.checkTrailingWhitespace = checkTrailingWhitespace;
        this.maxFindingsPerFile = maxFindingsPerFile;
    }

    public static LineEndingRule fromSettings(final RuleSettings settings) {
        final Set<LineEnding> allowed = EnumSet.noneOf(LineEnding.class);
        for (final String value : settings.getStringList("allowed-line-endings", List.of())) {
            allowed.add(LineEnding.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        }
        return new LineEndingRule(
                allowed,
                settings.getBoolean("check-trailing-whitespace", true),
                settings.getInt("max-findings-per-file", 20));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Consistent line endings (allowed: " + allowedLineEndings + ") without trailing whitespace";
    }

    @Override
    public boolean appliesTo(final FileMetadata metadata) {
        return metadata.text();
    }

    @Override
    public String fingerprintSource() {
        return "allowed=" + allowedLineEndings.stream().map(Enum::name).sorted().collect(Collectors.joining(","))
                + "|trailing-whitespace=" + checkTrailingWhitespace
                + "|max-findings=" + maxFindingsPerFile;
    }

    @Override
    public List<Finding> evaluate(final FileContent content) {
        final byte[] bytes = content.bytes();
        final Map<LineEnding, Integer> counts = new EnumMap<>(LineEnding.class);
        final Map<LineEnding, Integer> firstLine = new EnumMap<>(LineEnding.class);
        final List<Finding> whitespaceFindings = new ArrayList<>();

        int line = 1;
        int lineStart = 0;
        int i = 0;
        while (i <= bytes.length) {
            final LineEnding ending;
            final int terminatorLength;
            if (i == bytes.length) {
                ending = null;
                terminatorLength = 0;
            } else if (bytes[i] == '\r') {
                final boolean crlf = i + 1 < bytes.length && bytes[i + 1] == '\n';
                ending = crlf ? LineEnding.CRLF : LineEnding.CR;
                terminatorLength = crlf ? 2 : 1;
            } else if (bytes[i] == '\n') {
                ending = LineEnding.LF;
                terminatorLength = 1;
            } else {
                i++;
                continue;
            }

            // bytes[lineStart, i) is the content of the current line
            if (checkTrailingWhitespace && i > lineStart && isBlank(bytes[i - 1])
                    && whitespaceFindings.size() < maxFindingsPerFile) {
                whitespaceFindings.add(Finding.issue(NAME, Severity.LOW,
                        "Trailing whitespace", Location.at(line, i - 1)));
            }

            if (ending == null) {
                break;
            }
            counts.merge(ending, 1, Integer::sum);
            firstLine.putIfAbsent(ending, line);

            i += terminatorLength;
            lineStart = i;
            line++;
        }

        final List<Finding> findings = new ArrayList<>();
        if (counts.size() > 1) {
            final LineEnding minority = counts.entrySet().stream()
                    .min(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .orElseThrow();
            findings.add(Finding.issue(NAME, Severity.MEDIUM,
                    "Mixed line endings: " + describe(counts),
                    Location.line(firstLine.get(minority))));
        }
        for (final Map.Entry<LineEnding, Integer> entry : counts.entrySet()) {
            if (!allowedLineEndings.contains(entry.getKey())) {
                findings.add(Finding.issue(NAME, Severity.LOW,
                        entry.getKey() + " line endings are not allowed (" + entry.getValue() + " lines)",
                        Location.line(firstLine.get(entry.getKey()))));
            }
        }
        findings.addAll(whitespaceFindings);

        return findings.size() > maxFindingsPerFile ? List.copyOf(findings.subList(0, maxFindingsPerFile)) : findings;
    }

    private static boolean isBlank(final byte b) {
        return b == ' ' || b == '\t';
    }

    private static String describe(final Map<LineEnding, Integer> counts) {
        return counts.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }

    public Set<LineEnding> getAllowedLineEndings() {
        return EnumSet.copyOf(allowedLineEndings);
    }
}

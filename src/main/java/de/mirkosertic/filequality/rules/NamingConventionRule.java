package de.mirkosertic.filequality.rules;

import de.mirkosertic.filequality.config.RuleSettings;
import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Severity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags file and directory names that do not match the configured patterns.
 * Directory names are the segments of the path relative to the analysis root.
 */
public class NamingConventionRule implements QualityRule {

    public static final String NAME = "naming";
    public static final String DEFAULT_PATTERN = "[A-Za-z0-9._-]+";

    private final Pattern namingPattern;
    private final Pattern directoryNamingPattern;

    public NamingConventionRule(final Pattern namingPattern, final Pattern directoryNamingPattern) {
        this.namingPattern = namingPattern;
        this.directoryNamingPattern = directoryNamingPattern;
    }

    public static NamingConventionRule fromSettings(final RuleSettings settings) {
        final String filePattern = settings.getString("naming-pattern", DEFAULT_PATTERN);
        return new NamingConventionRule(
                Pattern.compile(filePattern),
                Pattern.compile(settings.getString("directory-naming-pattern", filePattern)));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "File names match " + namingPattern.pattern() + ", directory names match " + directoryNamingPattern.pattern();
    }

    @Override
    public String fingerprintSource() {
        return "files=" + namingPattern.pattern() + "|directories=" + directoryNamingPattern.pattern();
    }

    @Override
    public List<Finding> evaluate(final FileContent content) {
        final Path relativePath = content.metadata().relativePath();
        final List<Finding> findings = new ArrayList<>();

        final int segments = relativePath.getNameCount();
        for (int i = 0; i < segments - 1; i++) {
            final String directoryName = relativePath.getName(i).toString();
            if (!directoryNamingPattern.matcher(directoryName).matches()) {
                findings.add(Finding.issue(NAME, Severity.LOW,
                        "Directory name '" + directoryName + "' does not match " + directoryNamingPattern.pattern()));
            }
        }

        final String fileName = content.metadata().fileName();
        if (!namingPattern.matcher(fileName).matches()) {
            findings.add(Finding.issue(NAME, Severity.LOW,
                    "File name '" + fileName + "' does not match " + namingPattern.pattern()));
        }
        return findings;
    }
}

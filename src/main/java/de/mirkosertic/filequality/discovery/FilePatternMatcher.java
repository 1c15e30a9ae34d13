package de.mirkosertic.filequality.discovery;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Include/exclude glob filter working on paths relative to the analysis root.
 * <p>
 * Exclude patterns are matched against the relative path anchored at "/", so that
 * {@code **}{@code /.git/**} also matches a {@code .git} directory directly below the root
 * and a root that itself lives below e.g. a {@code build} directory is not excluded.
 * Include patterns are matched against the file name, or against the relative path if
 * the pattern contains a slash.
 */
public class FilePatternMatcher {

    private static final Path ANCHOR = Path.of("/");
    private static final String PLACEHOLDER_NAME = ".filequality-placeholder";

    private final List<PathMatcher> includeNameMatchers;
    private final List<PathMatcher> includePathMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeNameMatchers = includePatterns.stream()
                .filter(pattern -> !pattern.contains("/"))
                .map(FilePatternMatcher::glob)
                .toList();
        this.includePathMatchers = includePatterns.stream()
                .filter(pattern -> pattern.contains("/"))
                .map(FilePatternMatcher::glob)
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(FilePatternMatcher::glob)
                .toList();
    }

    public boolean shouldInclude(final Path relativePath) {
        if (isExcluded(relativePath)) {
            return false;
        }

        // If no include patterns specified, include all (except excluded)
        if (includeNameMatchers.isEmpty() && includePathMatchers.isEmpty()) {
            return true;
        }

        final Path fileName = relativePath.getFileName();
        for (final PathMatcher includeMatcher : includeNameMatchers) {
            if (fileName != null && includeMatcher.matches(fileName)) {
                return true;
            }
        }
        for (final PathMatcher includeMatcher : includePathMatchers) {
            if (includeMatcher.matches(relativePath)) {
                return true;
            }
        }

        return false;
    }

    public boolean isExcluded(final Path relativePath) {
        final Path anchored = ANCHOR.resolve(relativePath);
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(anchored) || excludeMatcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether everything below the directory is excluded. Used to prune the walk;
     * files are still filtered one by one.
     */
    public boolean isDirectoryExcluded(final Path relativeDirectory) {
        return isExcluded(relativeDirectory.resolve(PLACEHOLDER_NAME));
    }

    private static PathMatcher glob(final String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }
}

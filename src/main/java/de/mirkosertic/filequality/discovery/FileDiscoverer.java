package de.mirkosertic.filequality.discovery;

import de.mirkosertic.filequality.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the files to analyze below a root directory or within an explicit file list.
 * <p>
 * The result is sorted lexically by path, so identical filesystem state always yields the
 * same sequence. Subpaths that cannot be read are skipped and reported as
 * {@link DiscoveryIssue}s; only an unusable root aborts discovery.
 */
public class FileDiscoverer {

    private static final Logger logger = LoggerFactory.getLogger(FileDiscoverer.class);

    private final FilePatternMatcher matcher;
    private final int maxDepth;

    public FileDiscoverer(final ApplicationConfig config) {
        this(new FilePatternMatcher(config.getIncludePatterns(), config.getExcludePatterns()), config.getMaxDepth());
    }

    public FileDiscoverer(final FilePatternMatcher matcher, final int maxDepth) {
        this.matcher = matcher;
        this.maxDepth = maxDepth;
    }

    /**
     * Walk the root directory. A regular file as root yields just that file.
     *
     * @throws AccessException if the root does not exist or cannot be read
     */
    public DiscoveryResult discover(final Path root) throws AccessException {
        final Path normalizedRoot = root.toAbsolutePath().normalize();

        if (!Files.exists(normalizedRoot)) {
            throw new AccessException(normalizedRoot, "Analysis root does not exist");
        }
        if (!Files.isReadable(normalizedRoot)) {
            throw new AccessException(normalizedRoot, "Analysis root is not readable");
        }

        if (Files.isRegularFile(normalizedRoot)) {
            final Path parent = normalizedRoot.getParent() != null ? normalizedRoot.getParent() : normalizedRoot;
            return new DiscoveryResult(parent, List.of(normalizedRoot), List.of());
        }

        logger.info("Discovering files below: {}", normalizedRoot);
        final Set<Path> files = new TreeSet<>();
        final List<DiscoveryIssue> issues = new ArrayList<>();

        try {
            Files.walkFileTree(normalizedRoot, EnumSet.noneOf(FileVisitOption.class), maxDepth,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                            if (!dir.equals(normalizedRoot)
                                    && matcher.isDirectoryExcluded(normalizedRoot.relativize(dir))) {
                                logger.debug("Skipping excluded directory: {}", dir);
                                return FileVisitResult.SKIP_SUBTREE;
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                            // Directories at the depth limit are reported here as well
                            if (attrs.isRegularFile() && matcher.shouldInclude(normalizedRoot.relativize(file))) {
                                files.add(file.normalize());
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(final Path file, final IOException exc) throws IOException {
                            if (file.equals(normalizedRoot)) {
                                throw new AccessException(normalizedRoot, "Cannot read analysis root", exc);
                            }
                            logger.warn("Skipping unreadable path: {} ({})", file, exc.toString());
                            issues.add(new DiscoveryIssue(file, "Unreadable: " + describe(exc)));
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) {
                            if (exc != null) {
                                logger.warn("Error while listing directory: {} ({})", dir, exc.toString());
                                issues.add(new DiscoveryIssue(dir, "Incomplete listing: " + describe(exc)));
                            }
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (final AccessException e) {
            throw e;
        } catch (final IOException e) {
            throw new AccessException(normalizedRoot, "Error walking analysis root", e);
        }

        logger.info("Discovered {} files below {} ({} skipped paths)", files.size(), normalizedRoot, issues.size());
        return new DiscoveryResult(normalizedRoot, new ArrayList<>(files), issues);
    }

    /**
     * Resolve an explicit list of files. Missing or unreadable entries and directories become
     * discovery issues; exclude patterns still apply. The root of the result is the deepest
     * common parent directory of the given files.
     */
    public DiscoveryResult discover(final List<Path> explicitFiles) {
        final Set<Path> normalized = new TreeSet<>();
        for (final Path file : explicitFiles) {
            normalized.add(file.toAbsolutePath().normalize());
        }
        final Path root = commonParent(normalized);

        final Set<Path> files = new TreeSet<>();
        final List<DiscoveryIssue> issues = new ArrayList<>();
        for (final Path file : normalized) {
            if (!Files.exists(file)) {
                issues.add(new DiscoveryIssue(file, "Does not exist"));
            } else if (!Files.isRegularFile(file)) {
                issues.add(new DiscoveryIssue(file, "Not a regular file"));
            } else if (!Files.isReadable(file)) {
                issues.add(new DiscoveryIssue(file, "Unreadable"));
            } else if (!matcher.isExcluded(root.relativize(file))) {
                files.add(file);
            }
        }

        logger.info("Resolved {} of {} explicit files ({} issues)", files.size(), explicitFiles.size(), issues.size());
        return new DiscoveryResult(root, new ArrayList<>(files), issues);
    }

    private static Path commonParent(final Set<Path> files) {
        Path common = null;
        for (final Path file : files) {
            final Path parent = file.getParent() != null ? file.getParent() : file;
            if (common == null) {
                common = parent;
            } else {
                while (!parent.startsWith(common) && common.getParent() != null) {
                    common = common.getParent();
                }
            }
        }
        return common != null ? common : Path.of("").toAbsolutePath();
    }

    private static String describe(final IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

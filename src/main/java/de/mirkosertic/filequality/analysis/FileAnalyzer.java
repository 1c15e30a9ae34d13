package de.mirkosertic.filequality.analysis;

import de.mirkosertic.filequality.cache.ResultCache;
import de.mirkosertic.filequality.model.FileContent;
import de.mirkosertic.filequality.model.FileMetadata;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.Fingerprint;
import de.mirkosertic.filequality.model.QualityStatus;
import de.mirkosertic.filequality.rules.QualityRule;
import de.mirkosertic.filequality.rules.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Analyzes a single file: fingerprint, cache lookup, rule evaluation, scoring and
 * write-through to the cache.
 * <p>
 * A rule that throws never affects the other rules: its exception is recorded as one
 * RULE_FAILURE finding. A file that cannot be read yields an UNREADABLE result, which is
 * not cached so the next run tries again. The analyzer keeps no state between files and
 * may be called from several threads.
 */
public class FileAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalyzer.class);

    private final RuleRegistry registry;
    private final ResultCache cache;
    private final QualityScorer scorer;
    private final MediaTypeDetector detector;

    public FileAnalyzer(final RuleRegistry registry, final ResultCache cache, final QualityScorer scorer,
                        final MediaTypeDetector detector) {
        this.registry = registry;
        this.cache = cache;
        this.scorer = scorer;
        this.detector = detector;
    }

    public FileResult analyze(final Path path, final Path relativePath) {
        return analyzeFile(path, relativePath).result();
    }

    public AnalyzedFile analyzeFile(final Path path, final Path relativePath) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (final IOException e) {
            logger.warn("Cannot read {}: {}", path, e.toString());
            return new AnalyzedFile(unreadable(path, relativePath, "Unreadable: " + describe(e)), false);
        }

        final String fingerprint = Fingerprint.of(bytes);
        final Optional<FileResult> cached = cache.get(path, relativePath.toString(), fingerprint, registry.version());
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", path);
            return new AnalyzedFile(rescore(cached.get()), true);
        }

        final FileMetadata metadata = detector.describe(path, relativePath, bytes);
        final FileContent content = new FileContent(metadata, bytes);
        final List<QualityRule> rules = registry.applicableRules(metadata);

        final List<Finding> findings = new ArrayList<>();
        for (final QualityRule rule : rules) {
            findings.addAll(evaluate(rule, content));
        }

        final int score = scorer.score(findings);
        final QualityStatus status = scorer.status(findings, score, !rules.isEmpty());
        final FileResult result = new FileResult(
                path,
                relativePath.toString(),
                fingerprint,
                Fingerprint.normalized(bytes),
                bytes.length,
                metadata.extension(),
                metadata.mediaType(),
                findings,
                score,
                status);

        cache.put(path, fingerprint, registry.version(), result);
        logger.debug("Analyzed {}: score {}, {} findings", path, score, findings.size());
        return new AnalyzedFile(result, false);
    }

    // The pass threshold is not part of the rule-set version, so status is never taken from the cache
    private FileResult rescore(final FileResult cached) {
        final int score = scorer.score(cached.findings());
        final boolean graded = cached.status() != QualityStatus.NOT_GRADED;
        return cached.withFindings(cached.findings(), score, scorer.status(cached.findings(), score, graded));
    }

    private static List<Finding> evaluate(final QualityRule rule, final FileContent content) {
        try {
            final List<Finding> findings = rule.evaluate(content);
            if (findings == null) {
                return List.of(Finding.ruleFailure(rule.name(), new IllegalStateException("returned no finding list")));
            }
            return findings;
        } catch (final Exception e) {
            logger.warn("Rule '{}' failed on {}", rule.name(), content.metadata().path(), e);
            return List.of(Finding.ruleFailure(rule.name(), e));
        }
    }

    /**
     * Result for a file that could not be analyzed at all.
     */
    public FileResult unreadable(final Path path, final Path relativePath, final String message) {
        final List<Finding> findings = List.of(Finding.unreadable(message));
        final String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        return new FileResult(
                path,
                relativePath.toString(),
                null,
                null,
                sizeOf(path),
                MediaTypeDetector.extensionOf(fileName),
                "application/octet-stream",
                findings,
                scorer.score(findings),
                QualityStatus.NOT_GRADED);
    }

    private static long sizeOf(final Path path) {
        try {
            return Files.size(path);
        } catch (final IOException e) {
            logger.debug("Size of {} unavailable: {}", path, e.toString());
            return 0;
        }
    }

    private static String describe(final Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

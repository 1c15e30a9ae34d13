package de.mirkosertic.filequality.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.filequality.model.FileResult;
import de.mirkosertic.filequality.model.Finding;
import de.mirkosertic.filequality.model.FindingKind;
import de.mirkosertic.filequality.model.Fingerprint;
import de.mirkosertic.filequality.model.Location;
import de.mirkosertic.filequality.model.QualityStatus;
import de.mirkosertic.filequality.model.Severity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result cache backed by a directory of YAML files with a Caffeine tier in front.
 * <p>
 * Each path owns exactly one file, named by the SHA-256 of the path. A file is written
 * to a temporary sibling first and then moved over the old one, so a crash during an
 * update leaves either the old or the new entry, and never touches other entries.
 * Entries that cannot be read back are treated as misses.
 */
public class PersistentResultCache implements ResultCache {

    private static final Logger logger = LoggerFactory.getLogger(PersistentResultCache.class);

    static final int FORMAT_VERSION = 1;
    private static final String ENTRY_SUFFIX = ".yaml";

    private final Path directory;
    private final Cache<String, CacheEntry> memory;
    private final Yaml yaml;

    public PersistentResultCache(final Path directory, final long memoryEntries) throws IOException {
        this.directory = directory.toAbsolutePath().normalize();
        Files.createDirectories(this.directory);

        this.memory = Caffeine.newBuilder()
                .maximumSize(memoryEntries)
                .build();

        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);

        logger.info("Result cache at {} ({} entries in memory)", this.directory, memoryEntries);
    }

    @Override
    public Optional<FileResult> get(final Path path, final String relativePath, final String fingerprint,
                                    final String ruleSetVersion) {
        final String key = key(path);
        CacheEntry entry = memory.getIfPresent(key);
        if (entry == null) {
            entry = readEntry(path, key);
            if (entry == null) {
                return Optional.empty();
            }
            memory.put(key, entry);
        }
        if (!entry.matches(relativePath, fingerprint, ruleSetVersion)) {
            logger.debug("Stale cache entry for {}", path);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    @Override
    public void put(final Path path, final String fingerprint, final String ruleSetVersion, final FileResult result) {
        final String key = key(path);
        final CacheEntry entry = new CacheEntry(path, result.relativePath(), fingerprint, ruleSetVersion, result);
        memory.put(key, entry);
        try {
            writeEntry(entryFile(key), entry);
        } catch (final IOException e) {
            // The in-memory tier still serves this run
            logger.warn("Failed to persist cache entry for {}: {}", path, e.toString());
        }
    }

    @Override
    public void invalidate(final Path path) {
        final String key = key(path);
        memory.invalidate(key);
        try {
            Files.deleteIfExists(entryFile(key));
        } catch (final IOException e) {
            logger.warn("Failed to delete cache entry for {}: {}", path, e.toString());
        }
    }

    @Override
    public void clear() {
        memory.invalidateAll();
        int deleted = 0;
        try (final DirectoryStream<Path> entries = Files.newDirectoryStream(directory, "*" + ENTRY_SUFFIX)) {
            for (final Path file : entries) {
                Files.deleteIfExists(file);
                deleted++;
            }
        } catch (final IOException e) {
            logger.warn("Failed to clear cache directory {}: {}", directory, e.toString());
        }
        logger.info("Cleared {} cache entries", deleted);
    }

    public Path getDirectory() {
        return directory;
    }

    Path entryFile(final Path path) {
        return entryFile(key(path));
    }

    private Path entryFile(final String key) {
        return directory.resolve(key + ENTRY_SUFFIX);
    }

    private static String key(final Path path) {
        return Fingerprint.of(path.toAbsolutePath().normalize().toString());
    }

    private @Nullable CacheEntry readEntry(final Path path, final String key) {
        final Path file = entryFile(key);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            final CacheEntry entry = parseEntry(file);
            if (!entry.path().equals(path.toAbsolutePath().normalize())) {
                throw new CacheCorruptionException(file, "Cache entry belongs to " + entry.path());
            }
            return entry;
        } catch (final CacheCorruptionException e) {
            logger.warn("Ignoring corrupt cache entry for {}", path, e);
            return null;
        }
    }

    private void writeEntry(final Path file, final CacheEntry entry) throws IOException {
        final Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            try (final Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                yaml.dump(toMap(entry), writer);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, replacing", directory);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static Map<String, Object> toMap(final CacheEntry entry) {
        final FileResult result = entry.result();
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("format", FORMAT_VERSION);
        map.put("path", entry.path().toString());
        map.put("fingerprint", entry.fingerprint());
        map.put("rule-set-version", entry.ruleSetVersion());
        map.put("relative-path", entry.relativePath());
        map.put("normalized-fingerprint", result.normalizedFingerprint());
        map.put("size", result.size());
        map.put("extension", result.extension());
        map.put("media-type", result.mediaType());
        map.put("score", result.score());
        map.put("status", result.status().name());

        final List<Map<String, Object>> findings = new ArrayList<>();
        for (final Finding finding : result.findings()) {
            final Map<String, Object> f = new LinkedHashMap<>();
            f.put("rule", finding.rule());
            f.put("kind", finding.kind().name());
            f.put("severity", finding.severity().name());
            f.put("message", finding.message());
            if (finding.location() != null) {
                f.put("line", finding.location().line());
                f.put("byte-offset", finding.location().byteOffset());
            }
            findings.add(f);
        }
        map.put("findings", findings);
        return map;
    }

    @SuppressWarnings("unchecked")
    private CacheEntry parseEntry(final Path file) throws CacheCorruptionException {
        final Object loaded;
        try (final Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            loaded = yaml.load(reader);
        } catch (final NoSuchFileException e) {
            throw new CacheCorruptionException(file, "Cache entry disappeared", e);
        } catch (final IOException | YAMLException e) {
            throw new CacheCorruptionException(file, "Unreadable cache entry", e);
        }
        if (!(loaded instanceof Map)) {
            throw new CacheCorruptionException(file, "Cache entry is not a mapping");
        }

        final Map<String, Object> map = (Map<String, Object>) loaded;
        if (!Integer.valueOf(FORMAT_VERSION).equals(map.get("format"))) {
            throw new CacheCorruptionException(file, "Unsupported cache format " + map.get("format"));
        }

        try {
            final Path path = Path.of(required(map, "path", file));
            final String fingerprint = required(map, "fingerprint", file);
            final List<Finding> findings = new ArrayList<>();
            final Object rawFindings = map.get("findings");
            if (rawFindings != null) {
                for (final Map<String, Object> f : (List<Map<String, Object>>) rawFindings) {
                    findings.add(parseFinding(f, file));
                }
            }
            final FileResult result = new FileResult(
                    path,
                    required(map, "relative-path", file),
                    fingerprint,
                    (String) map.get("normalized-fingerprint"),
                    ((Number) map.get("size")).longValue(),
                    required(map, "extension", file),
                    required(map, "media-type", file),
                    findings,
                    ((Number) map.get("score")).intValue(),
                    QualityStatus.valueOf(required(map, "status", file)));
            return new CacheEntry(path, result.relativePath(), fingerprint, required(map, "rule-set-version", file),
                    result);
        } catch (final ClassCastException | NullPointerException | IllegalArgumentException e) {
            throw new CacheCorruptionException(file, "Malformed cache entry", e);
        }
    }

    private static Finding parseFinding(final Map<String, Object> f, final Path file) throws CacheCorruptionException {
        final Location location = f.get("line") instanceof Number line
                ? Location.at(line.intValue(), ((Number) f.get("byte-offset")).longValue())
                : null;
        return new Finding(
                required(f, "rule", file),
                FindingKind.valueOf(required(f, "kind", file)),
                Severity.valueOf(required(f, "severity", file)),
                required(f, "message", file),
                location);
    }

    private static String required(final Map<String, Object> map, final String key, final Path file)
            throws CacheCorruptionException {
        final Object value = map.get(key);
        if (value == null) {
            throw new CacheCorruptionException(file, "Missing '" + key + "' in cache entry");
        }
        return value.toString();
    }
}

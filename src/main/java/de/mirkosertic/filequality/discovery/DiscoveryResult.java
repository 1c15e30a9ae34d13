package de.mirkosertic.filequality.discovery;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Files found by one discovery pass, in lexical path order, without duplicates.
 *
 * @param root   normalized analysis root; for explicit file lists the common parent or the working directory
 * @param files  candidate files
 * @param issues subpaths that were skipped because they could not be read
 */
public record DiscoveryResult(Path root, List<Path> files, List<DiscoveryIssue> issues) {

    public DiscoveryResult {
        files = List.copyOf(files);
        issues = List.copyOf(issues);
    }

    public Stream<Path> stream() {
        return files.stream();
    }

    public Path relativize(final Path file) {
        if (file.startsWith(root) && !file.equals(root)) {
            return root.relativize(file);
        }
        return file.getFileName();
    }
}

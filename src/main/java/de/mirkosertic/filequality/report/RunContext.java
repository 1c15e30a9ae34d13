package de.mirkosertic.filequality.report;

import de.mirkosertic.filequality.discovery.DiscoveryIssue;

import java.nio.file.Path;
import java.util.List;

/**
 * Run-level facts the aggregator needs besides the per-file results.
 *
 * @param root     analysis root
 * @param issues   paths skipped during discovery
 * @param complete false if the run was cancelled before every file was analyzed
 */
public record RunContext(Path root, List<DiscoveryIssue> issues, boolean complete) {

    public RunContext {
        issues = List.copyOf(issues);
    }

    public static RunContext complete(final Path root) {
        return new RunContext(root, List.of(), true);
    }
}

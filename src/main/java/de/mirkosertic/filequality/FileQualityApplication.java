package de.mirkosertic.filequality;

import de.mirkosertic.filequality.analysis.AnalysisExecutorService;
import de.mirkosertic.filequality.analysis.AnalysisStatisticsTracker;
import de.mirkosertic.filequality.analysis.FileAnalyzer;
import de.mirkosertic.filequality.analysis.MediaTypeDetector;
import de.mirkosertic.filequality.analysis.QualityAnalysisService;
import de.mirkosertic.filequality.analysis.QualityScorer;
import de.mirkosertic.filequality.cache.NoOpResultCache;
import de.mirkosertic.filequality.cache.PersistentResultCache;
import de.mirkosertic.filequality.cache.ResultCache;
import de.mirkosertic.filequality.config.ApplicationConfig;
import de.mirkosertic.filequality.config.BuildInfo;
import de.mirkosertic.filequality.config.LoggingConfigurator;
import de.mirkosertic.filequality.discovery.AccessException;
import de.mirkosertic.filequality.discovery.FileDiscoverer;
import de.mirkosertic.filequality.report.ReportAggregator;
import de.mirkosertic.filequality.report.ReportWriter;
import de.mirkosertic.filequality.report.RunReport;
import de.mirkosertic.filequality.rules.RuleRegistry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command line entry point. Runs one analysis and writes the JSON report.
 */
public class FileQualityApplication {

    private static final Logger logger = LoggerFactory.getLogger(FileQualityApplication.class);

    static final int EXIT_COMPLETE = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_PARTIAL = 2;

    private final ApplicationConfig config;
    private final ResultCache cache;
    private final RuleRegistry registry;
    private final QualityAnalysisService analysisService;
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public FileQualityApplication(final ApplicationConfig config, final boolean useCache) throws IOException {
        this.config = config;

        // Initialize services in dependency order
        this.registry = RuleRegistry.fromConfig(config);

        this.cache = useCache && config.isCacheEnabled()
                ? new PersistentResultCache(Path.of(config.getCachePath()), config.getCacheMemoryEntries())
                : new NoOpResultCache();

        final QualityScorer scorer = new QualityScorer(registry, config.getPassThreshold());

        final FileAnalyzer analyzer = new FileAnalyzer(registry, cache, scorer, new MediaTypeDetector());

        final ReportAggregator aggregator = new ReportAggregator(config, registry, scorer);

        this.analysisService = new QualityAnalysisService(
                config,
                new FileDiscoverer(config),
                analyzer,
                aggregator,
                new AnalysisExecutorService(config),
                new AnalysisStatisticsTracker(config.getProgressIntervalMs())
        );
    }

    /**
     * Analyze a single root directory, or the given files when more than one target or a
     * single regular file is named.
     */
    public RunReport analyze(final List<Path> targets) throws AccessException {
        if (targets.size() == 1 && !Files.isRegularFile(targets.get(0))) {
            return analysisService.run(targets.get(0));
        }
        return analysisService.run(targets);
    }

    public void clearCache() {
        logger.info("Clearing result cache");
        cache.clear();
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    public ApplicationConfig getConfig() {
        return config;
    }

    /**
     * Cancel a running analysis and release all threads. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down file quality check...");
        try {
            analysisService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down analysis service", e);
        }
    }

    public static void main(final String[] args) {
        System.exit(execute(args, true));
    }

    static int execute(final String[] args, final boolean installShutdownHook) {
        final CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (final IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.print(CommandLineArguments.USAGE);
            return EXIT_ERROR;
        }
        if (arguments.help()) {
            System.out.print(CommandLineArguments.USAGE);
            return EXIT_COMPLETE;
        }
        if (arguments.version()) {
            System.out.println(BuildInfo.describe());
            return EXIT_COMPLETE;
        }

        if (arguments.configFile() != null && !Files.isRegularFile(arguments.configFile())) {
            System.err.println("Configuration file not found: " + arguments.configFile());
            return EXIT_ERROR;
        }

        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(arguments.reportOnStdout());

        FileQualityApplication app = null;
        try {
            final List<Path> targets = resolveTargets(arguments, ApplicationConfig.load(null));
            final ApplicationConfig config = ApplicationConfig.load(projectConfig(arguments, targets));
            logger.info("{} analyzing {}", BuildInfo.describe(), targets);

            app = new FileQualityApplication(config, !arguments.noCache());
            if (installShutdownHook) {
                final FileQualityApplication running = app;
                Runtime.getRuntime().addShutdownHook(new Thread(running::shutdown, "shutdown-hook"));
            }
            if (arguments.clearCache()) {
                app.clearCache();
            }

            final RunReport report = app.analyze(targets);
            if (arguments.outputFile() != null) {
                ReportWriter.write(report, arguments.outputFile());
            } else {
                ReportWriter.write(report, System.out);
            }
            return report.complete() ? EXIT_COMPLETE : EXIT_PARTIAL;

        } catch (final AccessException e) {
            logger.error("Cannot analyze {}: {}", e.getPath(), e.getMessage());
            System.err.println("Cannot analyze: " + e.getMessage());
            return EXIT_ERROR;
        } catch (final Exception e) {
            logger.error("File quality check failed", e);
            System.err.println("File quality check failed: " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            if (app != null) {
                app.shutdown();
            }
        }
    }

    private static List<Path> resolveTargets(final CommandLineArguments arguments, final ApplicationConfig baseConfig) {
        if (!arguments.targets().isEmpty()) {
            return arguments.targets();
        }
        final String configuredRoot = baseConfig.getRoot();
        return List.of(Path.of(configuredRoot != null ? configuredRoot : "."));
    }

    private static @Nullable Path projectConfig(final CommandLineArguments arguments, final List<Path> targets) {
        if (arguments.configFile() != null) {
            return arguments.configFile();
        }
        if (targets.size() == 1 && Files.isDirectory(targets.get(0))) {
            final Path candidate = targets.get(0).resolve(ApplicationConfig.PROJECT_CONFIG_FILE);
            return Files.isRegularFile(candidate) ? candidate : null;
        }
        return null;
    }
}

package de.mirkosertic.filequality;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line of {@link FileQualityApplication}.
 *
 * @param configFile project configuration file given with {@code --config}
 * @param outputFile report file given with {@code --output}; null writes the report to stdout
 * @param targets    root directory or explicit files; empty means the configured root or the working directory
 */
public record CommandLineArguments(
        @Nullable Path configFile,
        @Nullable Path outputFile,
        boolean noCache,
        boolean clearCache,
        boolean version,
        boolean help,
        List<Path> targets
) {

    static final String USAGE = """
            Usage: file-quality-check [options] [root | file...]

              --config <file>   project configuration (default: <root>/.filequality.yaml)
              --output <file>   write the JSON report to a file instead of stdout
              --no-cache        do not read or write the result cache
              --clear-cache     delete all cached results before the run
              --version         print the version and exit
              --help            print this help and exit

            Exit codes: 0 complete report, 2 partial report, 1 error
            """;

    public CommandLineArguments {
        targets = List.copyOf(targets);
    }

    /**
     * @throws IllegalArgumentException on unknown options or missing option values
     */
    public static CommandLineArguments parse(final String[] args) {
        Path configFile = null;
        Path outputFile = null;
        boolean noCache = false;
        boolean clearCache = false;
        boolean version = false;
        boolean help = false;
        final List<Path> targets = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "--config" -> configFile = Path.of(valueOf(args, ++i, arg));
                case "--output" -> outputFile = Path.of(valueOf(args, ++i, arg));
                case "--no-cache" -> noCache = true;
                case "--clear-cache" -> clearCache = true;
                case "--version" -> version = true;
                case "--help", "-h" -> help = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    targets.add(Path.of(arg));
                }
            }
        }
        return new CommandLineArguments(configFile, outputFile, noCache, clearCache, version, help, targets);
    }

    public boolean reportOnStdout() {
        return outputFile == null;
    }

    private static String valueOf(final String[] args, final int index, final String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}

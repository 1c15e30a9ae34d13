package de.mirkosertic.filequality.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the analysis engine, read from the Maven-filtered build-info.properties.
 * <p>
 * The version takes part in the rule-set version, so cached results of an older engine
 * are never served by a newer one. Falls back to "dev"/"unknown" when running from an IDE.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String NAME = "file-quality-check";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("Build info file not found, using defaults (IDE/dev mode)");
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        version = filteredOrDefault(props.getProperty("build.version"), "dev");
        buildTimestamp = filteredOrDefault(props.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    /**
     * One-line description for {@code --version} output and log banners.
     */
    public static String describe() {
        return NAME + " " + version + " (built " + buildTimestamp + ")";
    }

    // An unfiltered resource still contains the ${...} placeholder
    private static String filteredOrDefault(final String value, final String defaultValue) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return defaultValue;
        }
        return value;
    }
}

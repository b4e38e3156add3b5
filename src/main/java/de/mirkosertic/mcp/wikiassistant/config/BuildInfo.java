package de.mirkosertic.mcp.wikiassistant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, from the Maven-filtered build-info.properties.
 * Running from an IDE without a filtered resource reports {@code dev}/{@code unknown}.
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String VERSION_KEY = "build.version";
    private static final String TIMESTAMP_KEY = "build.timestamp";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final BuildInfo CURRENT = loadFromClasspath();

    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo fromProperties(final Properties props) {
        final String version = props.getProperty(VERSION_KEY, DEV_VERSION);
        final String timestamp = props.getProperty(TIMESTAMP_KEY, UNKNOWN_TIMESTAMP);
        // Unfiltered placeholders mean the resource was copied without Maven filtering
        return new BuildInfo(
                version.startsWith("${") ? DEV_VERSION : version,
                timestamp.startsWith("${") ? UNKNOWN_TIMESTAMP : timestamp);
    }

    private static BuildInfo loadFromClasspath() {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("Build info file not found, using defaults (IDE/dev mode)");
                return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
            }
            final Properties props = new Properties();
            props.load(input);
            final BuildInfo info = fromProperties(props);
            logger.debug("Loaded build info: version={}, timestamp={}", info.version(), info.buildTimestamp());
            return info;
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
            return new BuildInfo(DEV_VERSION, UNKNOWN_TIMESTAMP);
        }
    }
}

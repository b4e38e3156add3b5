package de.mirkosertic.mcp.wikiassistant.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches logging to file output when running as an MCP STDIO server.
 * <p>
 * STDOUT carries the JSON-RPC stream in deployed mode, so logback-deployed.xml writes to
 * {@code ~/.wikiassistant/log} (or {@code -Dwiki.log.dir}) instead. Outside deployed mode the
 * classpath logback.xml stays in effect.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "wiki.log.dir";
    private static final String LOG_DIR_CONTEXT_KEY = "LOG_DIR";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDir = logDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
        loadConfiguration(DEPLOYED_CONFIG, logDir);
    }

    /**
     * Directory the deployed configuration writes its log files to.
     */
    public static Path logDirectory() {
        final String override = System.getProperty(LOG_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override);
        }
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void loadConfiguration(final String configFile, final Path logDir) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        context.putProperty(LOG_DIR_CONTEXT_KEY, logDir.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}

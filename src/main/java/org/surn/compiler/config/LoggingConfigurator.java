package org.surn.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"  # "PLAIN" (pattern layout) or "JSON" (one JSON object per event)
 *   default-level = "WARN"
 *   levels {
 *     "org.surn.compiler.cli" = "INFO"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    /** Context and system property read by logback.xml to pick the appender. */
    public static final String FORMAT_PROPERTY = "surn.logging.format";
    private static final String LOGBACK_RESOURCE = "logback.xml";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            loggingConfigured = true;
            LOGGER.debug("Logging configuration applied successfully.");

        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
            loggingConfigured = true;
        }
    }

    /**
     * Selects the appender for the format and reloads {@code logback.xml}, which picks the root
     * appender from {@link #FORMAT_PROPERTY}. Levels are applied afterwards, since the reload resets them.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY)
            ? loggingConfig.getString(FORMAT_KEY)
            : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
        System.setProperty(FORMAT_PROPERTY, appender);
        reconfigureLogback(context, appender);
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static void reconfigureLogback(final LoggerContext context, final String appender) {
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (configUrl == null) {
            context.putProperty(FORMAT_PROPERTY, appender);
            LOGGER.warn("{} not found on the classpath, keeping the current appenders.", LOGBACK_RESOURCE);
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            context.putProperty(FORMAT_PROPERTY, appender);
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            throw new IllegalStateException("Failed to reload " + configUrl, e);
        }
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    /**
     * Applies the per-logger levels. An unknown level name falls back to DEBUG, as Logback does.
     */
    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final Level level = Level.toLevel(entry.getValue().unwrapped().toString());
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured flag so that the next call applies the configuration again. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }

    /**
     * @return {@code true} once {@link #configure(Config)} has run.
     */
    public static boolean isConfigured() {
        return loggingConfigured;
    }
}

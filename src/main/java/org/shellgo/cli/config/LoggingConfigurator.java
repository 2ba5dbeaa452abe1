package org.shellgo.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the logging section of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "INFO"  # Level of the root logger
 *   levels {
 *     # Specific logger levels
 *     "org.shellgo.compiler.backend.build" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private LoggingConfigurator() {}

    /**
     * Configures Logback from the given configuration. Missing keys leave the
     * levels of {@code logback.xml} untouched.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                setLevel(entry.getKey(), entry.getValue().unwrapped().toString());
            }
        }
    }

    /**
     * Sets the level of one logger.
     *
     * @param loggerName The logger name, usually a package.
     * @param levelName The level name; unknown names mean {@code DEBUG}.
     */
    public static void setLevel(final String loggerName, final String levelName) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Level level = Level.toLevel(levelName);
        context.getLogger(loggerName).setLevel(level);
        LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
    }
}

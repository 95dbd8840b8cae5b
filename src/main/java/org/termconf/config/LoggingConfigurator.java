package org.termconf.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.termconf.language.parser.ConfigParser" = "DEBUG"
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
     * Applies the logging settings found in the configuration. Missing settings leave the
     * Logback defaults in place.
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
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            configureSpecificLevels(loggingConfig.getConfig(LEVELS_KEY), context);
        }
    }

    private static void configureSpecificLevels(final Config levelsConfig, final LoggerContext context) {
        int configuredCount = 0;

        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);

            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }

            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }

        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }
}

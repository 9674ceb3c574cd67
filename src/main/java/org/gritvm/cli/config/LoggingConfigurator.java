package org.gritvm.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.gritvm.runtime.VirtualMachine" = "INFO"
 *   }
 * }
 * </pre>
 *
 * Unknown level names are reported and leave the logger as it was.
 */
public final class LoggingConfigurator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies the logging settings once. Later calls are ignored until {@link #reset()}.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging block, keeping Logback defaults.");
            return;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            final Config logging = config.getConfig(LOGGING_CONFIG_PATH);
            if (logging.hasPath(DEFAULT_LEVEL_KEY)) {
                applyLevel(context, Logger.ROOT_LOGGER_NAME, logging.getString(DEFAULT_LEVEL_KEY));
            }
            if (logging.hasPath(LEVELS_KEY)) {
                for (final Map.Entry<String, ConfigValue> entry : logging.getObject(LEVELS_KEY).entrySet()) {
                    applyLevel(context, entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
                }
            }
        } catch (final ConfigException e) {
            LOGGER.error("Malformed logging configuration, keeping Logback defaults.", e);
        }
    }

    private static void applyLevel(final LoggerContext context, final String loggerName, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(level);
        LOGGER.debug("Logger '{}' set to {}", loggerName, level);
    }

    /**
     * Allows {@link #configure(Config)} to apply settings again. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}

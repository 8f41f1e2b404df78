package org.sparkworld.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} block:
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.sparkworld.runtime.oracle" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config The root configuration. Missing keys leave the logback.xml levels in place.
     * @throws IllegalArgumentException if a level name is not a logback level.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging")) {
            return;
        }
        Config logging = config.getConfig("logging");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (logging.hasPath("default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(parse(logging.getString("default-level")));
        }
        if (logging.hasPath("levels")) {
            // Keys contain dots, so walk the object instead of the flattened paths.
            for (Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(parse(String.valueOf(entry.getValue().unwrapped())));
            }
        }
    }

    private static Level parse(String name) {
        Level level = Level.toLevel(name, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level: " + name);
        }
        return level;
    }
}

package org.glslregen.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging.levels} section of the configuration to Logback loggers.
 * <pre>
 * logging.levels {
 *   "org.glslregen" = DEBUG
 * }
 * </pre>
 * Quoted keys are required for logger names containing dots. A no-op when SLF4J is bound to
 * something other than Logback.
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            log.debug("Logging backend is not Logback, ignoring logging.levels");
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
            String loggerName = entry.getKey();
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                log.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
        }
    }
}

package org.czar.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging.levels} block of the configuration to Logback, e.g.
 * <pre>
 * logging.levels { "org.czar" = "DEBUG", "org.czar.compiler.frontend.lowering" = "TRACE" }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private static final String LEVELS_PATH = "logging.levels";

    private LoggingConfigurator() {
    }

    /**
     * @param config The resolved application configuration.
     */
    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logging backend is not Logback, ignoring '{}'", LEVELS_PATH);
            return;
        }
        for (Map.Entry<String, Object> entry : config.getObject(LEVELS_PATH).unwrapped().entrySet()) {
            String loggerName = entry.getKey();
            Level level = Level.toLevel(String.valueOf(entry.getValue()), null);
            if (level == null) {
                log.warn("Unknown log level '{}' for logger '{}'", entry.getValue(), loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
        }
    }
}

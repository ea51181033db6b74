package work.shellformats.toml.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.shellformats.toml.api.LogLevel;

/**
 * Applies the requested threshold to the Logback root logger.
 */
final class LogConfigurator {
    private LogConfigurator() {}

    static void apply(LogLevel level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level.name()));
        }
    }
}

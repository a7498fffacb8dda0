package org.cpoanalyzer.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;

/**
 * Applies the {@code logging} section to Logback:
 * <pre>
 * logging {
 *   format = "PLAIN"     # or "COLOR"
 *   level = "INFO"
 *   loggers { "org.cpoanalyzer.data" = "DEBUG" }
 * }
 * </pre>
 * The format swaps the encoder of the {@code CONSOLE} appender declared in {@code logback.xml}.
 */
public final class LoggingConfigurator {

    static final String CONSOLE_APPENDER = "CONSOLE";

    static final String PLAIN_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%thread] %logger{20} - %msg%n";
    static final String COLOR_PATTERN = "%d{HH:mm:ss.SSS} %levelColor(%-5level) [%thread] %logger{20} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (config.hasPath("logging.format")) {
            applyFormat(context, root, config.getString("logging.format"));
        }
        if (config.hasPath("logging.level")) {
            root.setLevel(Level.toLevel(config.getString("logging.level"), Level.INFO));
        }
        if (config.hasPath("logging.loggers")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.loggers").entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }

    static String patternFor(String format) {
        return "COLOR".equalsIgnoreCase(format) ? COLOR_PATTERN : PLAIN_PATTERN;
    }

    private static void applyFormat(LoggerContext context, Logger root, String format) {
        Appender<ILoggingEvent> appender = root.getAppender(CONSOLE_APPENDER);
        if (!(appender instanceof ConsoleAppender<ILoggingEvent> console)) {
            return;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(patternFor(format));
        encoder.start();

        console.stop();
        console.setEncoder(encoder);
        console.start();
    }
}

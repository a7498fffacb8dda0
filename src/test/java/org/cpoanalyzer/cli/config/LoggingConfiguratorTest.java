package org.cpoanalyzer.cli.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restore() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging { format = "PLAIN", level = "INFO", loggers { "org.cpoanalyzer.data" = "INFO" } }
                """));
    }

    private String consolePattern() {
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ConsoleAppender<ILoggingEvent> console =
                (ConsoleAppender<ILoggingEvent>) root.getAppender(LoggingConfigurator.CONSOLE_APPENDER);
        return ((PatternLayoutEncoder) console.getEncoder()).getPattern();
    }

    @Test
    void configure_colorFormatSwapsConsoleEncoder() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"COLOR\""));

        assertThat(consolePattern()).isEqualTo(LoggingConfigurator.COLOR_PATTERN);

        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"PLAIN\""));

        assertThat(consolePattern()).isEqualTo(LoggingConfigurator.PLAIN_PATTERN);
    }

    @Test
    void configure_appliesRootAndLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  level = "WARN"
                  loggers { "org.cpoanalyzer.data" = "DEBUG" }
                }
                """));

        assertThat(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger("org.cpoanalyzer.data").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void patternFor_unknownFormatIsPlain() {
        assertThat(LoggingConfigurator.patternFor("color")).isEqualTo(LoggingConfigurator.COLOR_PATTERN);
        assertThat(LoggingConfigurator.patternFor("fancy")).isEqualTo(LoggingConfigurator.PLAIN_PATTERN);
    }
}

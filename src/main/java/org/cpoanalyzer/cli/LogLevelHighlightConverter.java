package org.cpoanalyzer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the wrapped pattern by log level when {@code logging.format = COLOR}:
 * errors red, missing particles and other warnings yellow, progress blue, debug timing dimmed.
 * TRACE is left as is.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT -> ANSI_DIM;
            default -> null;
        };
    }
}

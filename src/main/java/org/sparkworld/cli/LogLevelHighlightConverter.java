package org.sparkworld.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the log level in console output: ERROR red, WARN yellow, INFO green,
 * DEBUG cyan, TRACE unchanged.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.INFO_INT -> ANSI_GREEN + in + ANSI_RESET;
            case Level.DEBUG_INT -> ANSI_CYAN + in + ANSI_RESET;
            default -> in;
        };
    }
}

package com.browsermux.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Map;

/**
 * Logger for one browsermux subsystem. Lines are prefixed with the
 * subsystem and followed by their fields:
 *
 * <pre>
 * [relay/router] dropping unattributed notification method=Page.loaded session=3
 * </pre>
 *
 * The SLF4J logger is named {@code browsermux.<subsystem>}, so each
 * subsystem can be tuned on its own in logback.xml.
 */
public final class SubsystemLogger {

    public static final String LOGGER_PREFIX = "browsermux.";

    private final String subsystem;
    private final Logger delegate;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.delegate = LoggerFactory.getLogger(LOGGER_PREFIX + subsystem);
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    public boolean isTraceEnabled() {
        return delegate.isTraceEnabled();
    }

    public void trace(String message) {
        log(Level.TRACE, message, Map.of(), null);
    }

    public void debug(String message) {
        log(Level.DEBUG, message, Map.of(), null);
    }

    public void debug(String message, Map<String, ?> fields) {
        log(Level.DEBUG, message, fields, null);
    }

    public void info(String message, Map<String, ?> fields) {
        log(Level.INFO, message, fields, null);
    }

    public void warn(String message, Map<String, ?> fields) {
        log(Level.WARN, message, fields, null);
    }

    public void error(String message, Map<String, ?> fields) {
        log(Level.ERROR, message, fields, null);
    }

    public void error(String message, Throwable cause) {
        log(Level.ERROR, message, Map.of(), cause);
    }

    private void log(Level level, String message, Map<String, ?> fields, Throwable cause) {
        if (!delegate.isEnabledForLevel(level)) {
            return;
        }
        delegate.atLevel(level).setCause(cause).log(render(subsystem, message, fields));
    }

    static String render(String subsystem, String message, Map<String, ?> fields) {
        StringBuilder line = new StringBuilder()
                .append('[').append(subsystem).append("] ").append(message);
        fields.forEach((key, value) -> line.append(' ').append(key).append('=').append(value));
        return line.toString();
    }
}

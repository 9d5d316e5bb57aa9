package com.browsermux.common.logging;

import java.util.Locale;

/**
 * The {@code logging.level} config value.
 */
public enum LogLevel {
    SILENT("OFF", "silent", "off"),
    ERROR("ERROR", "error", "fatal"),
    WARN("WARN", "warn", "warning"),
    INFO("INFO", "info"),
    DEBUG("DEBUG", "debug"),
    TRACE("TRACE", "trace");

    private final String logbackName;
    private final String[] names;

    LogLevel(String logbackName, String... names) {
        this.logbackName = logbackName;
        this.names = names;
    }

    /**
     * Parse a config value, case-insensitively. Unknown or blank values mean INFO.
     */
    public static LogLevel normalize(String value) {
        if (value == null) {
            return INFO;
        }
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        for (LogLevel level : values()) {
            for (String name : level.names) {
                if (name.equals(wanted)) {
                    return level;
                }
            }
        }
        return INFO;
    }

    /** Level name for Logback's {@code Level.toLevel}. */
    public String logbackName() {
        return logbackName;
    }
}

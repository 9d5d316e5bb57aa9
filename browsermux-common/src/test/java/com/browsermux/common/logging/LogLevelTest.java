package com.browsermux.common.logging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void normalize_acceptsAliases() {
        assertEquals(LogLevel.WARN, LogLevel.normalize("warning"));
        assertEquals(LogLevel.SILENT, LogLevel.normalize("off"));
        assertEquals(LogLevel.ERROR, LogLevel.normalize("fatal"));
        assertEquals(LogLevel.DEBUG, LogLevel.normalize(" DEBUG "));
    }

    @Test
    void normalize_unknownOrBlank_isInfo() {
        assertEquals(LogLevel.INFO, LogLevel.normalize("verbose"));
        assertEquals(LogLevel.INFO, LogLevel.normalize(null));
        assertEquals(LogLevel.INFO, LogLevel.normalize(""));
    }

    @Test
    void logbackName_turnsSilentOff() {
        assertEquals("OFF", LogLevel.SILENT.logbackName());
        assertEquals("TRACE", LogLevel.TRACE.logbackName());
    }
}

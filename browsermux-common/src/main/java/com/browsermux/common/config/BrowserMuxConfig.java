package com.browsermux.common.config;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Root configuration type, bound from the JSON config file.
 * Every field is nullable; unset values fall back to defaults when the
 * browser options are resolved.
 */
@Data
public class BrowserMuxConfig {

    /** Browser process settings. */
    private BrowserConfig browser;

    /** Relay listener settings. */
    private RelayConfig relay;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class BrowserConfig {
        /** Absolute path (or PATH-resolvable name) of the browser binary. */
        private String executablePath;
        private Boolean headless;
        /** Extra arguments appended after the default ones. */
        private List<String> args;
        /** When true only {@link #args} are passed to the browser. */
        private Boolean ignoreDefaultArgs;
        /** Default arguments to leave out, when not ignoring all of them. */
        private List<String> ignoredDefaultArgs;
        /** Persistent profile directory; a temporary one is used when unset. */
        private String userDataDir;
        private String downloadsPath;
        private Boolean handleSigint;
        private Boolean handleSigterm;
        private Boolean handleSighup;
        /** How long to wait for a voluntary exit before killing the process. */
        private Integer gracefulCloseTimeoutMs;
        /** Extra environment variables for the browser process. */
        private Map<String, String> env;
    }

    @Data
    public static class RelayConfig {
        private String host;
        /** 0 picks a free port. */
        private Integer port;
        /** Upper bound for one protocol message, on the pipe and on sockets. */
        private Integer maxFrameBytes;
    }

    @Data
    public static class LoggingConfig {
        private String level;
    }
}

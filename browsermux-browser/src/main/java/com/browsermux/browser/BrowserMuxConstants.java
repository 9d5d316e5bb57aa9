package com.browsermux.browser;

/**
 * Browser module constants: relay defaults, timeouts and directory prefixes.
 */
public final class BrowserMuxConstants {

    private BrowserMuxConstants() {}

    // ==================== Relay ====================

    /** Default relay listener host (loopback). */
    public static final String DEFAULT_RELAY_HOST = "127.0.0.1";

    /** Port 0 lets the OS pick a free port. */
    public static final int DEFAULT_RELAY_PORT = 0;

    /** Largest protocol message accepted from the pipe or a socket. */
    public static final int DEFAULT_MAX_FRAME_BYTES = 256 * 1024 * 1024;

    // ==================== Timeouts ====================

    /** Time the browser gets to exit on its own before it is killed. */
    public static final int DEFAULT_GRACEFUL_CLOSE_TIMEOUT_MS = 30_000;

    // ==================== Profiles ====================

    /** Prefix of the temporary profile directory created per launch. */
    public static final String TEMP_PROFILE_PREFIX = "browsermux_dev_profile-";

    /** Prefix of the temporary downloads directory. */
    public static final String DOWNLOADS_DIR_PREFIX = "browsermux_downloads-";

    /** Environment variable naming the browser's cookie jar file. */
    public static final String COOKIE_JAR_ENV = "CURL_COOKIE_JAR_PATH";

    /** Cookie jar file name inside the profile directory. */
    public static final String COOKIE_JAR_FILE = "cookiejar.db";

    // ==================== Config ====================

    /** Default config file location. */
    public static final String DEFAULT_CONFIG_PATH = "~/.browsermux/config.json";
}

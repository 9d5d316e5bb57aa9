package com.browsermux.browser;

import com.browsermux.browser.process.GracefulCloseHook;
import com.browsermux.browser.process.SignalPolicy;
import com.browsermux.common.config.BrowserMuxConfig;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Typed, validated launch options, resolved from {@link BrowserMuxConfig}
 * or built directly.
 */
@Data
@Builder
@Slf4j
public class BrowserLaunchOptions {

    private String executablePath;
    @Builder.Default
    private boolean headless = true;
    @Builder.Default
    private List<String> args = List.of();
    /** Pass only {@link #args}. */
    private boolean ignoreAllDefaultArgs;
    /** Default arguments to leave out. */
    @Builder.Default
    private List<String> ignoredDefaultArgs = List.of();
    /** Profile directory; null means a temporary one. */
    private Path userDataDir;
    /** Downloads directory; null means a temporary one. */
    private Path downloadsPath;
    @Builder.Default
    private SignalPolicy signalPolicy = SignalPolicy.all();
    @Builder.Default
    private long gracefulCloseTimeoutMs = BrowserMuxConstants.DEFAULT_GRACEFUL_CLOSE_TIMEOUT_MS;
    @Builder.Default
    private Map<String, String> env = Map.of();
    @Builder.Default
    private String relayHost = BrowserMuxConstants.DEFAULT_RELAY_HOST;
    /** Relay port, only valid for server launches. 0 picks a free port. */
    @Builder.Default
    private int port = BrowserMuxConstants.DEFAULT_RELAY_PORT;
    @Builder.Default
    private int maxFrameBytes = BrowserMuxConstants.DEFAULT_MAX_FRAME_BYTES;
    /** Runs before the close request is sent to the browser. Used by tests. */
    private GracefulCloseHook beforeGracefulClose;

    // ==================== Resolution ====================

    /**
     * Resolve launch options from the raw config. Missing values take the
     * defaults in {@link BrowserMuxConstants}.
     */
    public static BrowserLaunchOptions resolve(BrowserMuxConfig config) {
        BrowserMuxConfig.BrowserConfig browser = config != null ? config.getBrowser() : null;
        BrowserMuxConfig.RelayConfig relay = config != null ? config.getRelay() : null;

        BrowserLaunchOptionsBuilder builder = BrowserLaunchOptions.builder();
        if (browser != null) {
            builder.executablePath(blankToNull(browser.getExecutablePath()));
            if (browser.getHeadless() != null) builder.headless(browser.getHeadless());
            if (browser.getArgs() != null) builder.args(List.copyOf(browser.getArgs()));
            builder.ignoreAllDefaultArgs(Boolean.TRUE.equals(browser.getIgnoreDefaultArgs()));
            if (browser.getIgnoredDefaultArgs() != null) {
                builder.ignoredDefaultArgs(List.copyOf(browser.getIgnoredDefaultArgs()));
            }
            String userDataDir = blankToNull(browser.getUserDataDir());
            if (userDataDir != null) builder.userDataDir(Path.of(userDataDir));
            String downloadsPath = blankToNull(browser.getDownloadsPath());
            if (downloadsPath != null) builder.downloadsPath(Path.of(downloadsPath));
            builder.signalPolicy(new SignalPolicy(
                    !Boolean.FALSE.equals(browser.getHandleSigint()),
                    !Boolean.FALSE.equals(browser.getHandleSigterm()),
                    !Boolean.FALSE.equals(browser.getHandleSighup())));
            builder.gracefulCloseTimeoutMs(normalizeTimeoutMs(browser.getGracefulCloseTimeoutMs(),
                    BrowserMuxConstants.DEFAULT_GRACEFUL_CLOSE_TIMEOUT_MS));
            if (browser.getEnv() != null) builder.env(Map.copyOf(browser.getEnv()));
        }
        if (relay != null) {
            String host = blankToNull(relay.getHost());
            if (host != null) builder.relayHost(host);
            if (relay.getPort() != null) {
                if (relay.getPort() < 0 || relay.getPort() > 65535) {
                    log.warn("Ignoring invalid relay port {}", relay.getPort());
                } else {
                    builder.port(relay.getPort());
                }
            }
            if (relay.getMaxFrameBytes() != null && relay.getMaxFrameBytes() > 0) {
                builder.maxFrameBytes(relay.getMaxFrameBytes());
            }
        }
        return builder.build();
    }

    public static int normalizeTimeoutMs(Integer raw, int fallback) {
        if (raw == null || raw <= 0) {
            return fallback;
        }
        return raw;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

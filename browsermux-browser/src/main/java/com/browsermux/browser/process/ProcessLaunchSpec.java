package com.browsermux.browser.process;

import com.browsermux.browser.BrowserMuxConstants;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start and supervise one browser process.
 */
@Data
@Builder
public class ProcessLaunchSpec {
    /** Absolute path, or a name looked up on PATH. */
    private final String executable;
    @Builder.Default
    private final List<String> args = List.of();
    /** Added on top of the inherited environment. */
    @Builder.Default
    private final Map<String, String> env = Map.of();
    @Builder.Default
    private final SignalPolicy signalPolicy = SignalPolicy.none();
    @Builder.Default
    private final long gracefulCloseTimeoutMs = BrowserMuxConstants.DEFAULT_GRACEFUL_CLOSE_TIMEOUT_MS;
    /** Null means a plain terminate request. */
    private final GracefulCloseHook closeHook;
    /** Deleted recursively once the process has exited. */
    private final Path tempProfileDir;
    private final Path downloadsDir;
    /** Whether {@link #downloadsDir} is temporary and removed with the profile. */
    private final boolean ownsDownloadsDir;
}

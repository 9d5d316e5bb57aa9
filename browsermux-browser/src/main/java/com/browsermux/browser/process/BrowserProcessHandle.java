package com.browsermux.browser.process;

import lombok.Builder;
import lombok.Data;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * A running browser process and the two halves of its pipe.
 */
@Data
@Builder
public class BrowserProcessHandle {
    /** OS process ID. */
    private final long pid;
    /** Bytes the browser writes on descriptor 4. */
    private final InputStream fromBrowser;
    /** Bytes the browser reads on descriptor 3. */
    private final OutputStream toBrowser;
    private final Path downloadsDir;
    /** Null for a caller-supplied profile. */
    private final Path tempProfileDir;
    /** Timestamp when the process was started (epoch millis). */
    private final long startedAt;
    /** The underlying OS process handle. */
    private final Process process;

    public boolean isAlive() {
        return process != null && process.isAlive();
    }
}

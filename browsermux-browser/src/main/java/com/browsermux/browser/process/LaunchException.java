package com.browsermux.browser.process;

import java.io.IOException;

/**
 * The browser process could not be started.
 */
public class LaunchException extends IOException {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}

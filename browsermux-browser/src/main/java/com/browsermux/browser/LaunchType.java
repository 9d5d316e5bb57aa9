package com.browsermux.browser;

/**
 * How a browser is launched and who talks to it.
 */
public enum LaunchType {
    /** In-process client on the pipe, no listener. */
    LOCAL,
    /** Pipe shared through a WebSocket relay. */
    SERVER,
    /** Like {@link #LOCAL}, with a caller-owned profile directory. */
    PERSISTENT
}

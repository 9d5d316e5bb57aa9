package com.browsermux.browser.process;

/**
 * Lifecycle of a supervised process. Transitions only move forward;
 * a process can reach {@link #TERMINATED} from any state.
 */
public enum ShutdownState {
    RUNNING,
    /** Close hook issued, waiting for the process to exit on its own. */
    GRACEFUL_WAIT,
    /** Forceful termination sent. */
    FORCED_KILL,
    TERMINATED
}

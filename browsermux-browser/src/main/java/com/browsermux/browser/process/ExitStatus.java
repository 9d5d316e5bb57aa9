package com.browsermux.browser.process;

/**
 * How a browser process ended. Exactly one of the two fields is set.
 *
 * @param exitCode the exit code for a normal exit, otherwise null
 * @param signal   the terminating signal name (for example {@code SIGKILL}), otherwise null
 */
public record ExitStatus(Integer exitCode, String signal) {

    private static final int SIGNAL_EXIT_BASE = 128;

    /**
     * Decode a {@link Process#exitValue()}. The JDK reports death by signal N
     * as 128 + N, which is indistinguishable from a process that called
     * {@code exit(128 + N)} itself.
     */
    public static ExitStatus fromExitValue(int exitValue) {
        if (exitValue > SIGNAL_EXIT_BASE && exitValue <= SIGNAL_EXIT_BASE + 64) {
            return new ExitStatus(null, signalName(exitValue - SIGNAL_EXIT_BASE));
        }
        return new ExitStatus(exitValue, null);
    }

    static String signalName(int signal) {
        return switch (signal) {
            case 1 -> "SIGHUP";
            case 2 -> "SIGINT";
            case 3 -> "SIGQUIT";
            case 6 -> "SIGABRT";
            case 9 -> "SIGKILL";
            case 11 -> "SIGSEGV";
            case 13 -> "SIGPIPE";
            case 15 -> "SIGTERM";
            default -> "SIG" + signal;
        };
    }

    public boolean isSignaled() {
        return signal != null;
    }
}

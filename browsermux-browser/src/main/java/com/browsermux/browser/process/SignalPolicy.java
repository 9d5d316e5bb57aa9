package com.browsermux.browser.process;

/**
 * Which host signals close the browser gracefully before the host exits
 * with {@code 128 + signal}.
 */
public record SignalPolicy(boolean handleSigint, boolean handleSigterm, boolean handleSighup) {

    public static SignalPolicy all() {
        return new SignalPolicy(true, true, true);
    }

    public static SignalPolicy none() {
        return new SignalPolicy(false, false, false);
    }
}

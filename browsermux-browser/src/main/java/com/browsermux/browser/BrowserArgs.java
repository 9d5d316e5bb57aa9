package com.browsermux.browser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the browser's command line.
 */
public final class BrowserArgs {

    private BrowserArgs() {}

    public static final String INSPECTOR_PIPE = "--inspector-pipe";
    public static final String HEADLESS = "--headless";
    public static final String NO_STARTUP_WINDOW = "--no-startup-window";
    public static final String USER_DATA_DIR_PREFIX = "--user-data-dir=";
    public static final String BLANK_PAGE = "about:blank";

    /**
     * The full argument list, honoring {@code ignoreAllDefaultArgs} and
     * {@code ignoredDefaultArgs}.
     */
    public static List<String> build(BrowserLaunchOptions options, LaunchType launchType, Path userDataDir) {
        if (options.isIgnoreAllDefaultArgs()) {
            return List.copyOf(options.getArgs());
        }
        List<String> args = defaultArgs(options, launchType, userDataDir);
        if (!options.getIgnoredDefaultArgs().isEmpty()) {
            args.removeIf(options.getIgnoredDefaultArgs()::contains);
        }
        return args;
    }

    /**
     * Default arguments followed by the user's.
     *
     * @throws IllegalArgumentException if the user's arguments set the profile
     *                                  directory or name a page to open
     */
    public static List<String> defaultArgs(BrowserLaunchOptions options, LaunchType launchType, Path userDataDir) {
        List<String> userArgs = options.getArgs();
        if (userArgs.stream().anyMatch(arg -> arg.startsWith(USER_DATA_DIR_PREFIX))) {
            throw new IllegalArgumentException("Pass userDataDir parameter instead of specifying --user-data-dir argument");
        }
        if (userArgs.stream().anyMatch(arg -> !arg.startsWith("-"))) {
            throw new IllegalArgumentException("Arguments can not specify page to be opened");
        }

        List<String> args = new ArrayList<>();
        args.add(INSPECTOR_PIPE);
        if (options.isHeadless()) {
            args.add(HEADLESS);
        }
        if (launchType == LaunchType.PERSISTENT) {
            args.add(USER_DATA_DIR_PREFIX + userDataDir);
        } else {
            args.add(NO_STARTUP_WINDOW);
        }
        args.addAll(userArgs);
        if (launchType == LaunchType.PERSISTENT) {
            args.add(BLANK_PAGE);
        }
        return args;
    }
}

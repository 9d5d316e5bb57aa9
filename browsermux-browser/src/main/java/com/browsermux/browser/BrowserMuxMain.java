package com.browsermux.browser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.browsermux.browser.process.ExitStatus;
import com.browsermux.browser.process.LaunchException;
import com.browsermux.common.config.BrowserMuxConfig;
import com.browsermux.common.config.ConfigService;
import com.browsermux.common.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Launches a browser as a relay server and prints its endpoint.
 *
 * <pre>
 *   java -jar browsermux-browser.jar [config.json]
 * </pre>
 */
@Slf4j
public final class BrowserMuxMain {

    private BrowserMuxMain() {
    }

    public static void main(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : BrowserMuxConstants.DEFAULT_CONFIG_PATH);
        BrowserMuxConfig config = new ConfigService(configPath).loadConfig();
        applyLogLevel(LogLevel.normalize(config.getLogging().getLevel()));

        BrowserServer server;
        try {
            server = BrowserServer.launch(BrowserLaunchOptions.resolve(config), LaunchType.SERVER);
        } catch (LaunchException | IllegalArgumentException e) {
            log.error("Failed to launch browser: {}", e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println(server.wsEndpoint());
        ExitStatus status = server.exitFuture().join();
        System.exit(status.exitCode() != null ? status.exitCode() : 1);
    }

    /**
     * Apply the configured level to every browsermux logger.
     */
    static void applyLogLevel(LogLevel level) {
        Level logbackLevel = Level.toLevel(level.logbackName(), Level.INFO);
        for (String name : List.of("com.browsermux", "browsermux")) {
            if (LoggerFactory.getLogger(name) instanceof Logger logger) {
                logger.setLevel(logbackLevel);
            }
        }
    }
}

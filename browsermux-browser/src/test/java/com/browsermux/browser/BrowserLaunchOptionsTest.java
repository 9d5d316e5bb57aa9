package com.browsermux.browser;

import com.browsermux.browser.process.SignalPolicy;
import com.browsermux.common.config.BrowserMuxConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserLaunchOptionsTest {

    @Test
    void resolve_nullConfig_usesDefaults() {
        BrowserLaunchOptions options = BrowserLaunchOptions.resolve(null);

        assertNull(options.getExecutablePath());
        assertTrue(options.isHeadless());
        assertEquals(List.of(), options.getArgs());
        assertEquals(SignalPolicy.all(), options.getSignalPolicy());
        assertEquals(BrowserMuxConstants.DEFAULT_GRACEFUL_CLOSE_TIMEOUT_MS, options.getGracefulCloseTimeoutMs());
        assertEquals(BrowserMuxConstants.DEFAULT_RELAY_HOST, options.getRelayHost());
        assertEquals(0, options.getPort());
        assertEquals(BrowserMuxConstants.DEFAULT_MAX_FRAME_BYTES, options.getMaxFrameBytes());
    }

    @Test
    void resolve_readsEverySection() {
        BrowserMuxConfig config = new BrowserMuxConfig();
        BrowserMuxConfig.BrowserConfig browser = new BrowserMuxConfig.BrowserConfig();
        browser.setExecutablePath(" /opt/wk/browser ");
        browser.setHeadless(false);
        browser.setArgs(List.of("--foo"));
        browser.setIgnoreDefaultArgs(true);
        browser.setUserDataDir("/data/profile");
        browser.setDownloadsPath("/data/downloads");
        browser.setHandleSigint(false);
        browser.setGracefulCloseTimeoutMs(2500);
        browser.setEnv(Map.of("A", "1"));
        config.setBrowser(browser);
        BrowserMuxConfig.RelayConfig relay = new BrowserMuxConfig.RelayConfig();
        relay.setHost("0.0.0.0");
        relay.setPort(9300);
        relay.setMaxFrameBytes(1024);
        config.setRelay(relay);

        BrowserLaunchOptions options = BrowserLaunchOptions.resolve(config);

        assertEquals("/opt/wk/browser", options.getExecutablePath());
        assertFalse(options.isHeadless());
        assertEquals(List.of("--foo"), options.getArgs());
        assertTrue(options.isIgnoreAllDefaultArgs());
        assertEquals(Path.of("/data/profile"), options.getUserDataDir());
        assertEquals(Path.of("/data/downloads"), options.getDownloadsPath());
        assertEquals(new SignalPolicy(false, true, true), options.getSignalPolicy());
        assertEquals(2500, options.getGracefulCloseTimeoutMs());
        assertEquals(Map.of("A", "1"), options.getEnv());
        assertEquals("0.0.0.0", options.getRelayHost());
        assertEquals(9300, options.getPort());
        assertEquals(1024, options.getMaxFrameBytes());
    }

    @Test
    void resolve_invalidValuesFallBack() {
        BrowserMuxConfig config = new BrowserMuxConfig();
        BrowserMuxConfig.BrowserConfig browser = new BrowserMuxConfig.BrowserConfig();
        browser.setExecutablePath("   ");
        browser.setGracefulCloseTimeoutMs(-5);
        config.setBrowser(browser);
        BrowserMuxConfig.RelayConfig relay = new BrowserMuxConfig.RelayConfig();
        relay.setPort(70000);
        relay.setMaxFrameBytes(0);
        config.setRelay(relay);

        BrowserLaunchOptions options = BrowserLaunchOptions.resolve(config);

        assertNull(options.getExecutablePath());
        assertEquals(BrowserMuxConstants.DEFAULT_GRACEFUL_CLOSE_TIMEOUT_MS, options.getGracefulCloseTimeoutMs());
        assertEquals(0, options.getPort());
        assertEquals(BrowserMuxConstants.DEFAULT_MAX_FRAME_BYTES, options.getMaxFrameBytes());
    }
}

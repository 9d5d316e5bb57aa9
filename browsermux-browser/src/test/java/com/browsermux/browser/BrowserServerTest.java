package com.browsermux.browser;

import com.browsermux.browser.process.ExitStatus;
import com.browsermux.browser.process.LaunchException;
import com.browsermux.browser.process.SignalPolicy;
import com.browsermux.browser.relay.RelayClient;
import com.browsermux.browser.transport.ProtocolMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class BrowserServerTest {

    /** Echoes every frame back, so requests come back as responses with the same id. */
    private static final String ECHO_BROWSER = "exec cat <&3 >&4";

    @TempDir
    Path tempDir;

    private Path script(String name, String body) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body + "\n");
        assertTrue(file.toFile().setExecutable(true));
        return file;
    }

    private BrowserLaunchOptions.BrowserLaunchOptionsBuilder options(Path executable) {
        return BrowserLaunchOptions.builder()
                .executablePath(executable.toString())
                .signalPolicy(SignalPolicy.none())
                .downloadsPath(tempDir.resolve("downloads"));
    }

    @Test
    void portWithoutServerLaunch_isRejected() {
        BrowserLaunchOptions options = BrowserLaunchOptions.builder().executablePath("/bin/true").port(9222).build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BrowserServer.launch(options, LaunchType.LOCAL));
        assertEquals("Cannot specify a port without launching as a server.", e.getMessage());
    }

    @Test
    void missingExecutable_failsLaunch() {
        BrowserLaunchOptions options = BrowserLaunchOptions.builder()
                .userDataDir(tempDir.resolve("profile"))
                .downloadsPath(tempDir.resolve("downloads"))
                .build();

        LaunchException e = assertThrows(LaunchException.class,
                () -> BrowserServer.launch(options, LaunchType.LOCAL));
        assertEquals("No executable path is specified.", e.getMessage());
    }

    @Test
    void failedLaunch_removesCreatedDirectories() throws Exception {
        Set<Path> before = browsermuxTempEntries();

        assertThrows(IllegalArgumentException.class, () -> BrowserServer.launch(BrowserLaunchOptions.builder()
                .executablePath("/bin/true")
                .args(List.of("--user-data-dir=/x"))
                .build(), LaunchType.LOCAL));
        assertThrows(LaunchException.class, () -> BrowserServer.launch(BrowserLaunchOptions.builder().build(),
                LaunchType.LOCAL));
        assertThrows(LaunchException.class, () -> BrowserServer.launch(BrowserLaunchOptions.builder()
                .executablePath(tempDir.resolve("missing-browser").toString())
                .build(), LaunchType.LOCAL));

        Set<Path> leaked = browsermuxTempEntries();
        leaked.removeAll(before);
        assertEquals(Set.of(), leaked);
    }

    @Test
    void launch_passesArgumentsAndCookieJar() throws Exception {
        Path argsOut = tempDir.resolve("args.txt");
        Path envOut = tempDir.resolve("env.txt");
        Path exe = script("record.sh",
                "echo \"$@\" > \"$ARGS_OUT\"\necho \"$CURL_COOKIE_JAR_PATH\" > \"$ENV_OUT\"\n" + ECHO_BROWSER);
        Path profile = Files.createDirectory(tempDir.resolve("profile"));

        BrowserServer server = BrowserServer.launch(options(exe)
                .args(List.of("--foo"))
                .userDataDir(profile)
                .env(Map.of("ARGS_OUT", argsOut.toString(), "ENV_OUT", envOut.toString()))
                .build(), LaunchType.PERSISTENT);
        try {
            assertNull(server.wsEndpoint());
            assertNull(server.relayServer());
            assertEquals(profile, server.userDataDir());
            waitForFile(envOut);

            assertEquals("--inspector-pipe --headless --user-data-dir=" + profile + " --foo about:blank",
                    Files.readString(argsOut, StandardCharsets.UTF_8).trim());
            assertEquals(profile.resolve("cookiejar.db").toString(),
                    Files.readString(envOut, StandardCharsets.UTF_8).trim());
        } finally {
            server.kill().get(10, TimeUnit.SECONDS);
        }
        assertTrue(Files.isDirectory(profile), "a caller-provided profile is kept");
    }

    @Test
    void serverLaunch_relaysRequestsWithOriginalIds() throws Exception {
        BrowserServer server = BrowserServer.launch(options(script("echo.sh", ECHO_BROWSER)).build(),
                LaunchType.SERVER);
        try (RelayClient client = RelayClient.connect(server.wsEndpoint())) {
            assertTrue(server.wsEndpoint().startsWith("ws://127.0.0.1:"));
            assertEquals(LaunchType.SERVER, server.launchType());

            ObjectNode params = ProtocolMessage.newObject().put("value", 42);
            JsonNode first = client.send("Test.echo", params);
            JsonNode second = client.send("Test.echo", params);

            assertTrue(first.isObject());
            assertTrue(second.isObject());
        } finally {
            server.kill().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void closingThePipe_letsTheBrowserExitCleanly() throws Exception {
        BrowserServer server = BrowserServer.launch(options(script("echo.sh", ECHO_BROWSER)).build(),
                LaunchType.LOCAL);
        Path profile = server.userDataDir();
        CompletableFuture<Object[]> closed = new CompletableFuture<>();
        server.onClose((code, signal) -> closed.complete(new Object[]{code, signal}));

        server.transport().close();

        Object[] result = closed.get(10, TimeUnit.SECONDS);
        assertEquals(0, result[0]);
        assertNull(result[1]);
        assertEquals(new ExitStatus(0, null), server.exitFuture().get(1, TimeUnit.SECONDS));
        assertFalse(Files.exists(profile), "temporary profile is removed on exit");
    }

    @Test
    void gracefulClose_killsAfterTimeout() throws Exception {
        AtomicInteger hookCalls = new AtomicInteger();
        BrowserServer server = BrowserServer.launch(options(script("echo.sh", ECHO_BROWSER))
                .gracefulCloseTimeoutMs(300)
                .beforeGracefulClose(() -> {
                    hookCalls.incrementAndGet();
                    return CompletableFuture.completedFuture(null);
                })
                .build(), LaunchType.SERVER);

        ExitStatus status = server.close().get(10, TimeUnit.SECONDS);

        assertEquals(1, hookCalls.get());
        assertEquals("SIGKILL", status.signal());
        assertFalse(server.process().isAlive());
        waitUntil(() -> !server.relayServer().isListening());
    }

    @Test
    void killingTheBrowser_disconnectsRelayClients() throws Exception {
        BrowserServer server = BrowserServer.launch(options(script("echo.sh", ECHO_BROWSER)).build(),
                LaunchType.SERVER);
        try (RelayClient client = RelayClient.connect(server.wsEndpoint())) {
            server.kill().get(10, TimeUnit.SECONDS);

            RelayClient.CloseInfo info = client.closeFuture().get(10, TimeUnit.SECONDS);
            assertEquals("Browser disconnected", info.reason());
        }
    }

    private static Set<Path> browsermuxTempEntries() throws IOException {
        try (Stream<Path> entries = Files.list(Path.of(System.getProperty("java.io.tmpdir")))) {
            return entries.filter(p -> p.getFileName().toString().startsWith("browsermux_"))
                    .collect(Collectors.toCollection(HashSet::new));
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met in time");
            }
            Thread.sleep(20);
        }
    }

    private static void waitForFile(Path file) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (Files.exists(file)) {
                try {
                    if (Files.size(file) > 0) return;
                } catch (IOException ignored) {
                    // not written yet
                }
            }
            Thread.sleep(20);
        }
        fail("timed out waiting for " + file);
    }
}

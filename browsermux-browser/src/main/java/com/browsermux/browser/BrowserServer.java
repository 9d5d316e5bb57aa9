package com.browsermux.browser;

import com.browsermux.browser.process.BrowserProcessHandle;
import com.browsermux.browser.process.ExitStatus;
import com.browsermux.browser.process.GracefulCloseHook;
import com.browsermux.browser.process.LaunchException;
import com.browsermux.browser.process.ProcessLaunchSpec;
import com.browsermux.browser.process.ProcessSupervisor;
import com.browsermux.browser.relay.RelayServer;
import com.browsermux.browser.transport.BrowserProtocol;
import com.browsermux.browser.transport.MessageTransport;
import com.browsermux.browser.transport.PipeTransport;
import com.browsermux.browser.transport.ProtocolMessage;
import com.browsermux.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * A launched browser: the supervised process, the pipe transport to it and,
 * for {@link LaunchType#SERVER} launches, the relay that shares the pipe.
 *
 * <p>For local and persistent launches the transport is handed out
 * unstarted; the in-process client starts it with its own listener.
 */
@Slf4j
public class BrowserServer {

    private final LaunchType launchType;
    private final ProcessSupervisor supervisor;
    private final PipeTransport transport;
    private final RelayServer relayServer;
    private final Path userDataDir;

    private BrowserServer(LaunchType launchType, ProcessSupervisor supervisor, PipeTransport transport,
                          RelayServer relayServer, Path userDataDir) {
        this.launchType = launchType;
        this.supervisor = supervisor;
        this.transport = transport;
        this.relayServer = relayServer;
        this.userDataDir = userDataDir;
    }

    /**
     * Launch a browser.
     *
     * @throws IllegalArgumentException if a port is given for a non-server launch,
     *                                  or the arguments are invalid
     * @throws LaunchException          if the process or the relay cannot be started
     */
    public static BrowserServer launch(BrowserLaunchOptions options, LaunchType launchType) throws LaunchException {
        if (options.getPort() != 0 && launchType != LaunchType.SERVER) {
            throw new IllegalArgumentException("Cannot specify a port without launching as a server.");
        }

        Path tempProfileDir = null;
        Path userDataDir = options.getUserDataDir();
        Path downloadsDir = options.getDownloadsPath();
        boolean ownsDownloadsDir = false;
        AtomicReference<MessageTransport> transportRef = new AtomicReference<>();
        ProcessSupervisor supervisor;
        try {
            if (userDataDir == null) {
                tempProfileDir = Files.createTempDirectory(BrowserMuxConstants.TEMP_PROFILE_PREFIX);
                userDataDir = tempProfileDir;
            }
            if (downloadsDir == null) {
                downloadsDir = Files.createTempDirectory(BrowserMuxConstants.DOWNLOADS_DIR_PREFIX);
                ownsDownloadsDir = true;
            }

            List<String> args = BrowserArgs.build(options, launchType, userDataDir);
            if (options.getExecutablePath() == null) {
                throw new LaunchException("No executable path is specified.");
            }

            Map<String, String> env = new HashMap<>(options.getEnv());
            env.put(BrowserMuxConstants.COOKIE_JAR_ENV,
                    userDataDir.resolve(BrowserMuxConstants.COOKIE_JAR_FILE).toString());

            supervisor = ProcessSupervisor.launch(ProcessLaunchSpec.builder()
                    .executable(options.getExecutablePath())
                    .args(args)
                    .env(env)
                    .signalPolicy(options.getSignalPolicy())
                    .gracefulCloseTimeoutMs(options.getGracefulCloseTimeoutMs())
                    .closeHook(closeHook(options, transportRef))
                    .tempProfileDir(tempProfileDir)
                    .downloadsDir(downloadsDir)
                    .ownsDownloadsDir(ownsDownloadsDir)
                    .build());
        } catch (IOException e) {
            discardCreatedDirs(tempProfileDir, ownsDownloadsDir ? downloadsDir : null);
            if (e instanceof LaunchException le) {
                throw le;
            }
            throw new LaunchException("Failed to create browser profile directory: "
                    + ErrorUtils.formatErrorMessage(e), e);
        } catch (RuntimeException e) {
            discardCreatedDirs(tempProfileDir, ownsDownloadsDir ? downloadsDir : null);
            throw e;
        }

        BrowserProcessHandle handle = supervisor.handle();
        PipeTransport transport = new PipeTransport(handle.getFromBrowser(), handle.getToBrowser(),
                options.getMaxFrameBytes());
        transportRef.set(transport);

        RelayServer relayServer = null;
        if (launchType == LaunchType.SERVER) {
            relayServer = new RelayServer(options.getRelayHost(), options.getPort(),
                    options.getMaxFrameBytes(), transport);
            try {
                relayServer.start();
            } catch (Exception e) {
                relayServer.stop();
                supervisor.kill();
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                throw new LaunchException("Failed to start relay on " + options.getRelayHost() + ":"
                        + options.getPort() + ": " + ErrorUtils.formatErrorMessage(e), e);
            }
            transport.start(relayServer);
        }

        BrowserServer server = new BrowserServer(launchType, supervisor, transport, relayServer, userDataDir);
        supervisor.onExit(status -> server.onProcessExit());
        return server;
    }

    /**
     * Runs the optional test hook, then asks the browser to close over the pipe.
     */
    private static GracefulCloseHook closeHook(BrowserLaunchOptions options,
                                               AtomicReference<MessageTransport> transportRef) {
        return () -> {
            GracefulCloseHook before = options.getBeforeGracefulClose();
            CompletableFuture<Void> ready = before != null
                    ? before.attempt()
                    : CompletableFuture.completedFuture(null);
            return ready.thenRun(() -> {
                MessageTransport t = transportRef.get();
                if (t != null) {
                    t.send(ProtocolMessage.request(BrowserProtocol.BROWSER_CLOSE_MESSAGE_ID,
                            BrowserProtocol.CLOSE, null));
                }
            });
        };
    }

    private static void discardCreatedDirs(Path tempProfileDir, Path ownedDownloadsDir) {
        if (tempProfileDir != null) {
            ProcessSupervisor.deleteRecursively(tempProfileDir);
        }
        if (ownedDownloadsDir != null) {
            ProcessSupervisor.deleteRecursively(ownedDownloadsDir);
        }
    }

    private void onProcessExit() {
        transport.close();
        if (relayServer != null) {
            relayServer.stop();
        }
    }

    // ==================== Accessors ====================

    /**
     * {@code ws://host:port/<token>} for server launches, otherwise null.
     */
    public String wsEndpoint() {
        return relayServer != null ? relayServer.getWsEndpoint() : null;
    }

    public BrowserProcessHandle process() {
        return supervisor.handle();
    }

    public MessageTransport transport() {
        return transport;
    }

    /** Null for non-server launches. */
    public RelayServer relayServer() {
        return relayServer;
    }

    public LaunchType launchType() {
        return launchType;
    }

    public Path userDataDir() {
        return userDataDir;
    }

    public Path downloadsPath() {
        return supervisor.handle().getDownloadsDir();
    }

    // ==================== Lifecycle ====================

    /**
     * Called once with {@code (exitCode, signal)} when the browser process
     * exits, whether closed, killed or crashed.
     */
    public void onClose(BiConsumer<Integer, String> listener) {
        supervisor.onExit(status -> listener.accept(status.exitCode(), status.signal()));
    }

    public CompletableFuture<ExitStatus> exitFuture() {
        return supervisor.exitFuture();
    }

    /**
     * Ask the browser to close, killing it after the grace period.
     */
    public CompletableFuture<ExitStatus> close() {
        return supervisor.close();
    }

    public CompletableFuture<ExitStatus> kill() {
        return supervisor.kill();
    }
}

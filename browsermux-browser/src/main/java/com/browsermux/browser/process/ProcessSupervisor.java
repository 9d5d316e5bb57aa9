package com.browsermux.browser.process;

import com.browsermux.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Starts a browser process with its pipe pair on descriptors 3 and 4 and
 * owns it until it exits.
 *
 * <p>The JVM cannot hand extra descriptors to a child, so the browser is
 * started through {@code /bin/sh}, which moves the stdin/stdout pipes to
 * descriptors 3 and 4 before exec'ing the browser. The browser's own
 * stdout and stderr are both drained into the debug log.
 *
 * <p>Closing is two-phase: the close hook asks the browser to exit and a
 * timer kills it if it has not exited within the grace period. Host signals
 * enabled in the {@link SignalPolicy} trigger that close; a shutdown hook
 * kills any browser still running when the JVM exits.
 */
@Slf4j
public class ProcessSupervisor {

    private static final String SHELL = "/bin/sh";
    private static final String PIPE_WIRING = "exec \"$0\" \"$@\" 3<&0 4>&1 0</dev/null 1>&2";

    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "browsermux-process-timer");
        t.setDaemon(true);
        return t;
    });

    private final ProcessLaunchSpec spec;
    private final Process process;
    private final SignalInterceptor signals;
    private final BrowserProcessHandle handle;
    private final AtomicReference<ShutdownState> state = new AtomicReference<>(ShutdownState.RUNNING);
    private final AtomicBoolean exited = new AtomicBoolean();
    private final CompletableFuture<ExitStatus> exitFuture = new CompletableFuture<>();
    private volatile ScheduledFuture<?> killTimer;
    private Thread shutdownHook;

    private ProcessSupervisor(ProcessLaunchSpec spec, Process process, SignalInterceptor signals) {
        this.spec = spec;
        this.process = process;
        this.signals = signals;
        this.handle = BrowserProcessHandle.builder()
                .pid(process.pid())
                .fromBrowser(process.getInputStream())
                .toBrowser(process.getOutputStream())
                .downloadsDir(spec.getDownloadsDir())
                .tempProfileDir(spec.getTempProfileDir())
                .startedAt(System.currentTimeMillis())
                .process(process)
                .build();
    }

    /**
     * Start the process described by {@code spec}.
     *
     * @throws LaunchException if the executable is missing or cannot be started
     */
    public static ProcessSupervisor launch(ProcessLaunchSpec spec) throws LaunchException {
        return launch(spec, SignalInterceptor.host());
    }

    static ProcessSupervisor launch(ProcessLaunchSpec spec, SignalInterceptor signals) throws LaunchException {
        String executable = resolveExecutable(spec.getExecutable());
        ProcessBuilder pb = new ProcessBuilder(pipeCommand(executable, spec.getArgs()));
        pb.environment().putAll(spec.getEnv());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new LaunchException("Failed to launch browser " + executable + ": "
                    + ErrorUtils.formatErrorMessage(e), e);
        }

        ProcessSupervisor supervisor = new ProcessSupervisor(spec, process, signals);
        supervisor.startOutputPump(process.getErrorStream());
        supervisor.installShutdownHook();
        signals.register(supervisor, spec.getSignalPolicy());
        process.onExit().whenComplete((p, err) -> supervisor.handleExit());
        log.info("browser started (pid {}): {}", process.pid(), executable);
        return supervisor;
    }

    public BrowserProcessHandle handle() {
        return handle;
    }

    public ShutdownState state() {
        return state.get();
    }

    long gracefulCloseTimeoutMs() {
        return spec.getGracefulCloseTimeoutMs();
    }

    /**
     * Completes once, after the process has exited and its temporary profile
     * has been removed.
     */
    public CompletableFuture<ExitStatus> exitFuture() {
        return exitFuture;
    }

    /**
     * Run {@code listener} exactly once when the process exits, whatever
     * the reason.
     */
    public void onExit(Consumer<ExitStatus> listener) {
        exitFuture.thenAccept(status -> {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("exit listener failed: {}", ErrorUtils.formatErrorMessage(e), e);
            }
        });
    }

    /**
     * Ask the browser to exit and kill it if it has not done so within the
     * grace period. Repeated calls return the same future.
     */
    public CompletableFuture<ExitStatus> close() {
        if (!state.compareAndSet(ShutdownState.RUNNING, ShutdownState.GRACEFUL_WAIT)) {
            return exitFuture;
        }
        log.debug("closing browser (pid {}), grace period {} ms", process.pid(), spec.getGracefulCloseTimeoutMs());
        killTimer = TIMER.schedule(this::forceKill, spec.getGracefulCloseTimeoutMs(), TimeUnit.MILLISECONDS);

        GracefulCloseHook hook = spec.getCloseHook();
        if (hook == null) {
            process.destroy();
            return exitFuture;
        }
        try {
            hook.attempt().whenComplete((v, err) -> {
                if (err != null) {
                    log.warn("graceful close attempt failed: {}",
                            ErrorUtils.formatErrorMessage(ErrorUtils.unwrap(err)));
                }
            });
        } catch (Exception e) {
            log.warn("graceful close attempt failed: {}", ErrorUtils.formatErrorMessage(e));
        }
        return exitFuture;
    }

    /**
     * Kill the process immediately.
     */
    public CompletableFuture<ExitStatus> kill() {
        forceKill();
        return exitFuture;
    }

    private void forceKill() {
        ShutdownState current = state.get();
        while (current != ShutdownState.TERMINATED && current != ShutdownState.FORCED_KILL) {
            if (state.compareAndSet(current, ShutdownState.FORCED_KILL)) {
                log.warn("killing browser (pid {})", process.pid());
                process.destroyForcibly();
                return;
            }
            current = state.get();
        }
    }

    // ==================== Exit ====================

    private void handleExit() {
        if (!exited.compareAndSet(false, true)) {
            return;
        }
        state.set(ShutdownState.TERMINATED);
        ScheduledFuture<?> timer = killTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        removeShutdownHook();
        signals.unregister(this);

        ExitStatus status = ExitStatus.fromExitValue(process.exitValue());
        log.info("browser exited (pid {}): {}", process.pid(),
                status.isSignaled() ? status.signal() : "code " + status.exitCode());

        if (spec.getTempProfileDir() != null) {
            deleteRecursively(spec.getTempProfileDir());
        }
        if (spec.isOwnsDownloadsDir() && spec.getDownloadsDir() != null) {
            deleteRecursively(spec.getDownloadsDir());
        }
        exitFuture.complete(status);
    }

    // ==================== Host shutdown ====================

    private void installShutdownHook() {
        shutdownHook = new Thread(this::onHostShutdown, "browsermux-shutdown-" + process.pid());
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private void removeShutdownHook() {
        Thread hook = shutdownHook;
        if (hook == null || hook == Thread.currentThread()) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // already shutting down
            log.debug("shutdown hook not removed: {}", e.getMessage());
        }
    }

    private void onHostShutdown() {
        if (!exited.get()) {
            log.warn("host exiting, killing browser (pid {})", process.pid());
            process.destroyForcibly();
        }
    }

    // ==================== Helpers ====================

    private void startOutputPump(InputStream output) {
        Thread pump = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(output, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[pid={}] {}", process.pid(), line);
                }
            } catch (IOException e) {
                log.debug("browser output closed: {}", e.getMessage());
            }
        }, "browsermux-browser-output-" + process.pid());
        pump.setDaemon(true);
        pump.start();
    }

    static List<String> pipeCommand(String executable, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(SHELL);
        command.add("-c");
        command.add(PIPE_WIRING);
        command.add(executable);
        command.addAll(args);
        return command;
    }

    static String resolveExecutable(String executable) throws LaunchException {
        if (executable == null || executable.isBlank()) {
            throw new LaunchException("No executable path is specified.");
        }
        if (executable.contains(File.separator)) {
            Path path = Path.of(executable);
            if (!Files.isRegularFile(path) || !Files.isExecutable(path)) {
                throw new LaunchException("Failed to launch browser: " + executable + " is not an executable file");
            }
            return path.toAbsolutePath().toString();
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isEmpty()) continue;
                Path candidate = Path.of(dir, executable);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate.toString();
                }
            }
        }
        throw new LaunchException("Failed to launch browser: " + executable + " not found on PATH");
    }

    /**
     * Best-effort recursive delete; failures are logged.
     */
    public static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("failed to delete temporary profile {}: {}", dir, e.getMessage());
        }
    }
}

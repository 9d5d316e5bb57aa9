package com.browsermux.browser.process;

import com.browsermux.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;

/**
 * Host signal handling for supervised browsers. A handler is installed for
 * a signal the first time a browser asks for it; when the signal arrives
 * every browser registered for it is closed gracefully and the host exits
 * with {@code 128 + signal}.
 */
@Slf4j
final class SignalInterceptor {

    static final String SIGINT = "INT";
    static final String SIGTERM = "TERM";
    static final String SIGHUP = "HUP";

    private static final int SIGNAL_EXIT_BASE = 128;
    private static final long CLOSE_SLACK_MS = 1000;

    /** Installs {@code onSignal} for the named signal; it receives the signal number. */
    @FunctionalInterface
    interface Installer {
        void install(String signalName, IntConsumer onSignal);
    }

    private static final SignalInterceptor HOST = new SignalInterceptor(
            SignalInterceptor::installJdkHandler, code -> Runtime.getRuntime().exit(code));

    private final Installer installer;
    private final IntConsumer exit;
    private final Set<String> installed = ConcurrentHashMap.newKeySet();
    private final Map<String, Set<ProcessSupervisor>> watchers = new ConcurrentHashMap<>();

    SignalInterceptor(Installer installer, IntConsumer exit) {
        this.installer = installer;
        this.exit = exit;
    }

    static SignalInterceptor host() {
        return HOST;
    }

    static List<String> signalNames(SignalPolicy policy) {
        List<String> names = new ArrayList<>(3);
        if (policy.handleSigint()) names.add(SIGINT);
        if (policy.handleSigterm()) names.add(SIGTERM);
        if (policy.handleSighup()) names.add(SIGHUP);
        return names;
    }

    void register(ProcessSupervisor supervisor, SignalPolicy policy) {
        for (String name : signalNames(policy)) {
            watchers.computeIfAbsent(name, k -> ConcurrentHashMap.newKeySet()).add(supervisor);
            if (installed.add(name)) {
                try {
                    installer.install(name, number -> onSignal(name, number));
                } catch (IllegalArgumentException e) {
                    installed.remove(name);
                    log.warn("cannot handle SIG{}: {}", name, ErrorUtils.formatErrorMessage(e));
                }
            }
        }
    }

    void unregister(ProcessSupervisor supervisor) {
        for (Set<ProcessSupervisor> set : watchers.values()) {
            set.remove(supervisor);
        }
    }

    Set<String> installedSignals() {
        return Set.copyOf(installed);
    }

    void onSignal(String name, int number) {
        List<ProcessSupervisor> targets = new ArrayList<>(watchers.getOrDefault(name, Set.of()));
        log.info("received SIG{}, closing {} browser(s)", name, targets.size());
        List<CompletableFuture<ExitStatus>> closing = new ArrayList<>();
        long waitMs = 0;
        for (ProcessSupervisor supervisor : targets) {
            closing.add(supervisor.close());
            waitMs = Math.max(waitMs, supervisor.gracefulCloseTimeoutMs());
        }
        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                    .get(waitMs + CLOSE_SLACK_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("browsers still running after SIG{}", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("closing browsers on SIG{} failed: {}", name, ErrorUtils.formatErrorMessage(e));
        }
        exit.accept(SIGNAL_EXIT_BASE + number);
    }

    private static void installJdkHandler(String name, IntConsumer onSignal) {
        Signal.handle(new Signal(name), signal -> onSignal.accept(signal.getNumber()));
    }
}

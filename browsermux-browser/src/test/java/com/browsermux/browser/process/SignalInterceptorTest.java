package com.browsermux.browser.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class SignalInterceptorTest {

    private final List<String> installs = new ArrayList<>();
    private final Map<String, IntConsumer> handlers = new ConcurrentHashMap<>();
    private final AtomicInteger exitCode = new AtomicInteger(-1);
    private final SignalInterceptor interceptor = new SignalInterceptor((name, onSignal) -> {
        installs.add(name);
        handlers.put(name, onSignal);
    }, exitCode::set);

    @TempDir
    Path tempDir;

    @Test
    void signalNames_followFlags() {
        assertEquals(List.of("INT", "TERM", "HUP"), SignalInterceptor.signalNames(SignalPolicy.all()));
        assertEquals(List.of(), SignalInterceptor.signalNames(SignalPolicy.none()));
        assertEquals(List.of("TERM"), SignalInterceptor.signalNames(new SignalPolicy(false, true, false)));
        assertEquals(List.of("INT", "HUP"), SignalInterceptor.signalNames(new SignalPolicy(true, false, true)));
    }

    @Test
    void handlersInstalledOncePerEnabledSignal() throws Exception {
        ProcessSupervisor first = sleeper(new SignalPolicy(false, true, false));
        ProcessSupervisor second = sleeper(new SignalPolicy(false, true, true));
        try {
            assertEquals(List.of("TERM", "HUP"), installs);
            assertEquals(Set.of("TERM", "HUP"), interceptor.installedSignals());
        } finally {
            first.kill().get(10, TimeUnit.SECONDS);
            second.kill().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void noFlags_installsNothing() throws Exception {
        ProcessSupervisor supervisor = sleeper(SignalPolicy.none());
        try {
            assertTrue(installs.isEmpty());
        } finally {
            supervisor.kill().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void signal_closesRegisteredBrowsersThenExits() throws Exception {
        ProcessSupervisor interrupted = sleeper(new SignalPolicy(true, false, false));
        ProcessSupervisor untouched = sleeper(new SignalPolicy(false, true, false));
        try {
            handlers.get("INT").accept(2);

            assertEquals(130, exitCode.get());
            assertTrue(interrupted.exitFuture().isDone());
            assertEquals(ShutdownState.RUNNING, untouched.state());
        } finally {
            untouched.kill().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void failedInstall_isNotRecorded() throws Exception {
        SignalInterceptor refusing = new SignalInterceptor((name, onSignal) -> {
            throw new IllegalArgumentException("Signal already used by VM: " + name);
        }, exitCode::set);

        ProcessSupervisor supervisor = sleeper(refusing, new SignalPolicy(false, false, true));
        try {
            assertTrue(refusing.installedSignals().isEmpty());
        } finally {
            supervisor.kill().get(10, TimeUnit.SECONDS);
        }
    }

    private ProcessSupervisor sleeper(SignalPolicy policy) throws Exception {
        return sleeper(interceptor, policy);
    }

    private ProcessSupervisor sleeper(SignalInterceptor signals, SignalPolicy policy) throws Exception {
        Path exe = tempDir.resolve("sleep-" + installs.size() + "-" + System.nanoTime() + ".sh");
        Files.writeString(exe, "#!/bin/sh\nexec sleep 30\n");
        assertTrue(exe.toFile().setExecutable(true));
        return ProcessSupervisor.launch(ProcessLaunchSpec.builder()
                .executable(exe.toString())
                .signalPolicy(policy)
                .gracefulCloseTimeoutMs(200)
                .build(), signals);
    }
}

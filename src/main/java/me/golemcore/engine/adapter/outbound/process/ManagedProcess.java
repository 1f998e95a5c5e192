package me.golemcore.engine.adapter.outbound.process;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.ProcessSpec;
import me.golemcore.engine.port.outbound.ProcessSpawnPort.ProcessListener;
import me.golemcore.engine.port.outbound.ProcessSpawnPort.SupervisedProcess;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Child process with line-pumped output and escalating shutdown.
 *
 * <p>
 * Stdin is closed right after spawn. Stdout and stderr are read on daemon
 * threads line by line; empty lines are skipped. A waiter thread reports the
 * exit code once, after both pumps have drained.
 *
 * <p>
 * {@link #stop(Duration)} sends a terminate signal to the process and its
 * descendants, waits for the grace period and then force-kills whatever is
 * still alive.
 */
@Slf4j
public class ManagedProcess implements SupervisedProcess {

    static final String STDOUT = "stdout";
    static final String STDERR = "stderr";
    private static final long PUMP_DRAIN_TIMEOUT_MS = 1000;

    private final String name;
    private final Process process;
    private final ProcessListener listener;
    private final Executor stopExecutor;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CompletableFuture<Integer> exited = new CompletableFuture<>();

    private ManagedProcess(String name, Process process, ProcessListener listener, Executor stopExecutor) {
        this.name = name;
        this.process = process;
        this.listener = listener;
        this.stopExecutor = stopExecutor;
    }

    /**
     * Spawns the process and starts its pump and waiter threads.
     */
    public static ManagedProcess start(ProcessSpec spec, ProcessListener listener, Executor stopExecutor)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(spec.command());
        if (spec.workingDirectory() != null) {
            pb.directory(spec.workingDirectory().toFile());
        }
        pb.environment().putAll(spec.environment());
        pb.redirectErrorStream(false);

        log.info("[Process:{}] Starting: {}", spec.name(), String.join(" ", spec.command()));
        Process process = pb.start();
        process.getOutputStream().close();

        ManagedProcess managed = new ManagedProcess(spec.name(), process, listener, stopExecutor);
        managed.startThreads();
        return managed;
    }

    @Override
    public Long pid() {
        return process.isAlive() ? process.pid() : null;
    }

    @Override
    public boolean isRunning() {
        return !exited.isDone();
    }

    /**
     * Completes with the exit code once the process has exited and its output
     * has been delivered.
     */
    public CompletableFuture<Integer> onExit() {
        return exited;
    }

    @Override
    public CompletableFuture<Void> stop(Duration grace) {
        if (!isRunning()) {
            return CompletableFuture.completedFuture(null);
        }
        if (!stopping.compareAndSet(false, true)) {
            return exited.thenAccept(code -> {
            });
        }

        return CompletableFuture.runAsync(() -> terminate(grace), stopExecutor)
                .thenCompose(ignored -> exited)
                .thenAccept(code -> log.info("[Process:{}] Stopped (exit code {})", name, code));
    }

    private void terminate(Duration grace) {
        log.debug("[Process:{}] Sending terminate signal", name);
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Process:{}] Still alive after {} ms, killing", name, grace.toMillis());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void startThreads() {
        Thread stdoutPump = daemon(() -> pump(process.getInputStream(), STDOUT), "proc-" + name + "-stdout");
        Thread stderrPump = daemon(() -> pump(process.getErrorStream(), STDERR), "proc-" + name + "-stderr");
        stdoutPump.start();
        stderrPump.start();

        Thread waiter = daemon(() -> awaitExit(stdoutPump, stderrPump), "proc-" + name + "-exit");
        waiter.start();
    }

    private void awaitExit(Thread stdoutPump, Thread stderrPump) {
        int code;
        try {
            code = process.waitFor();
            stdoutPump.join(PUMP_DRAIN_TIMEOUT_MS);
            stderrPump.join(PUMP_DRAIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        if (!stopping.get()) {
            log.warn("[Process:{}] Exited with code {}", name, code);
        }
        try {
            listener.onExit(code);
        } catch (RuntimeException e) { // NOSONAR - listener failures must not hide the exit
            log.warn("[Process:{}] Exit listener failed: {}", name, e.getMessage());
        }
        exited.complete(code);
    }

    private void pump(InputStream stream, String streamName) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                log.debug("[{}] {}", name, line);
                deliver(streamName, line);
            }
        } catch (IOException e) {
            log.debug("[Process:{}] {} pump ended: {}", name, streamName, e.getMessage());
        }
    }

    private void deliver(String streamName, String line) {
        try {
            listener.onLine(streamName, line);
        } catch (RuntimeException e) { // NOSONAR - keep draining output
            log.warn("[Process:{}] Line listener failed: {}", name, e.getMessage());
        }
    }

    private static Thread daemon(Runnable task, String threadName) {
        Thread thread = new Thread(task, threadName);
        thread.setDaemon(true);
        return thread;
    }
}

package me.golemcore.engine.domain.service;

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
import me.golemcore.engine.domain.exception.ServiceNotConfiguredException;
import me.golemcore.engine.domain.exception.ServiceStartException;
import me.golemcore.engine.domain.model.HealthProbeResult;
import me.golemcore.engine.domain.model.ProcessSpec;
import me.golemcore.engine.domain.model.ServiceEvent;
import me.golemcore.engine.domain.model.ServiceLaunchConfig;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ServiceState;
import me.golemcore.engine.domain.model.ServiceStatus;
import me.golemcore.engine.port.outbound.HealthProbePort;
import me.golemcore.engine.port.outbound.ProcessSpawnPort;
import me.golemcore.engine.port.outbound.ProcessSpawnPort.SupervisedProcess;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Lifecycle state machine of a single backend process.
 *
 * <p>
 * All state transitions happen under one lock and every transition emits a
 * {@link ServiceEvent.Status} while the lock is held, so listeners observe
 * transitions in order. Listeners must not block.
 *
 * <p>
 * Startup runs on the scheduler: an already answering health endpoint is
 * adopted as an external instance, otherwise the process is spawned and its
 * health endpoint polled until it answers or the ready timeout expires.
 */
@Slf4j
public class BackendSupervisor {

    static final String DETAIL_STARTING = "Starting...";
    static final String DETAIL_WAITING = "Waiting for readiness...";
    static final String DETAIL_RUNNING = "Running";
    static final String DETAIL_EXTERNAL = "Running (external)";
    static final String DETAIL_FAILED = "Failed to start";
    static final String DETAIL_STOPPING = "Stopping...";
    static final String DETAIL_STOPPED = "Stopped";
    static final String DETAIL_EXITED = "Exited";

    private final ServiceName name;
    private final Supplier<ServiceLaunchConfig> configSupplier;
    private final Supplier<String> notConfiguredMessage;
    private final ProcessSpawnPort spawner;
    private final HealthProbePort healthProbe;
    private final ScheduledExecutorService scheduler;
    private final Timing timing;
    private final Consumer<ServiceEvent> emitter;

    private final Object lock = new Object();
    private ServiceState state;
    private SupervisedProcess process;
    private CompletableFuture<Void> pendingStart;
    private CompletableFuture<Void> pendingStop;
    private String failedStartError;

    /**
     * Polling and probe timings.
     */
    public record Timing(long pollIntervalMs, long probeTimeoutMs, long externalProbeTimeoutMs, long stopGraceMs) {
    }

    public BackendSupervisor(ServiceName name, Supplier<ServiceLaunchConfig> configSupplier,
            Supplier<String> notConfiguredMessage, ProcessSpawnPort spawner, HealthProbePort healthProbe,
            ScheduledExecutorService scheduler, Timing timing, Consumer<ServiceEvent> emitter) {
        this.name = name;
        this.configSupplier = configSupplier;
        this.notConfiguredMessage = notConfiguredMessage;
        this.spawner = spawner;
        this.healthProbe = healthProbe;
        this.scheduler = scheduler;
        this.timing = timing;
        this.emitter = emitter;
        this.state = ServiceState.stopped(name);
    }

    public ServiceName getName() {
        return name;
    }

    public ServiceState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean canStart() {
        return configSupplier.get().isConfigured();
    }

    public boolean isHealthy(long timeoutMs) {
        ServiceLaunchConfig config = configSupplier.get();
        if (config.healthUrl() == null) {
            return false;
        }
        return healthProbe.probe(config.healthUrl(), timeoutMs).healthy();
    }

    /**
     * Starts the backend. Completes once it is running, exceptionally with
     * {@link ServiceNotConfiguredException} or {@link ServiceStartException}.
     * Calling it while running completes immediately; calling it while a start
     * is in flight returns that start. A start issued during a stop spawns only
     * after the old process has exited.
     */
    public CompletableFuture<Void> start() {
        ServiceLaunchConfig config = configSupplier.get();
        CompletableFuture<Void> future;
        CompletableFuture<Void> previousStop;
        synchronized (lock) {
            if (state.getStatus() == ServiceStatus.RUNNING) {
                return CompletableFuture.completedFuture(null);
            }
            if (pendingStart != null) {
                return pendingStart;
            }
            if (config.configError() != null) {
                transition(state.toBuilder()
                        .status(ServiceStatus.ERROR)
                        .detail("Invalid configuration")
                        .lastError(config.configError())
                        .build());
                return CompletableFuture.failedFuture(new ServiceNotConfiguredException(config.configError()));
            }
            if (!config.isConfigured()) {
                return CompletableFuture.failedFuture(new ServiceNotConfiguredException(notConfiguredMessage.get()));
            }
            future = new CompletableFuture<>();
            pendingStart = future;
            failedStartError = null;
            previousStop = pendingStop;
        }

        if (previousStop != null) {
            log.info("[Supervisor:{}] Waiting for the previous process to stop", name);
            previousStop.whenComplete((ignored, error) -> launch(config, future));
        } else {
            launch(config, future);
        }
        return future;
    }

    private void launch(ServiceLaunchConfig config, CompletableFuture<Void> future) {
        try {
            scheduler.execute(() -> runStart(config, future));
        } catch (RejectedExecutionException e) {
            finishStart(future, new ServiceStartException("Engine is shutting down", e));
        }
    }

    /**
     * Stops the owned process: terminate, grace period, then kill. Without an
     * owned process the state is simply marked stopped.
     */
    public CompletableFuture<Void> stop() {
        SupervisedProcess target;
        synchronized (lock) {
            if (process == null) {
                if (state.getStatus() != ServiceStatus.STOPPED) {
                    transition(state.toBuilder()
                            .status(ServiceStatus.STOPPED)
                            .detail(DETAIL_STOPPED)
                            .pid(null)
                            .build());
                }
                return CompletableFuture.completedFuture(null);
            }
            if (pendingStop != null) {
                return pendingStop;
            }
            target = process;
            transition(state.toBuilder()
                    .status(ServiceStatus.STOPPING)
                    .detail(DETAIL_STOPPING)
                    .build());
            CompletableFuture<Void> stopping = target.stop(Duration.ofMillis(timing.stopGraceMs()))
                    .handle((ignored, error) -> {
                        if (error != null) {
                            log.warn("[Supervisor:{}] Stop failed: {}", name, error.getMessage());
                        }
                        markStoppedAfter(target);
                        return null;
                    });
            if (!stopping.isDone()) {
                pendingStop = stopping;
            }
            return stopping;
        }
    }

    private void markStoppedAfter(SupervisedProcess target) {
        synchronized (lock) {
            pendingStop = null;
            if (process == target) {
                process = null;
            }
            if (process == null && state.getStatus() != ServiceStatus.STOPPED) {
                transition(state.toBuilder()
                        .status(ServiceStatus.STOPPED)
                        .detail(DETAIL_STOPPED)
                        .pid(null)
                        .lastError(failedStartError)
                        .build());
            }
        }
    }

    private void runStart(ServiceLaunchConfig config, CompletableFuture<Void> future) {
        if (config.healthUrl() != null
                && healthProbe.probe(config.healthUrl(), timing.externalProbeTimeoutMs()).healthy()) {
            log.info("[Supervisor:{}] Found external instance at {}", name, config.healthUrl());
            synchronized (lock) {
                transition(state.toBuilder()
                        .status(ServiceStatus.RUNNING)
                        .detail(DETAIL_EXTERNAL)
                        .pid(null)
                        .lastError(null)
                        .build());
            }
            finishStart(future, null);
            return;
        }

        SupervisedProcess spawned;
        synchronized (lock) {
            transition(state.toBuilder()
                    .status(ServiceStatus.STARTING)
                    .detail(DETAIL_STARTING)
                    .pid(null)
                    .lastError(null)
                    .build());
            try {
                ProcessSpec spec = new ProcessSpec(name.getValue(), config.command(), config.workingDirectory(),
                        Map.of());
                Listener listener = new Listener();
                spawned = spawner.spawn(spec, listener);
                listener.owner = spawned;
            } catch (IOException | RuntimeException e) { // NOSONAR - any spawn failure ends the start
                log.warn("[Supervisor:{}] Spawn failed: {}", name, e.getMessage());
                failStartLocked(String.valueOf(e.getMessage()));
                stop();
                finishStart(future, new ServiceStartException("Failed to start " + name + ": " + e.getMessage(), e));
                return;
            }
            process = spawned;
            if (config.healthUrl() == null) {
                transition(state.toBuilder()
                        .status(ServiceStatus.RUNNING)
                        .detail(DETAIL_RUNNING)
                        .pid(spawned.pid())
                        .build());
                finishStart(future, null);
                return;
            }
            transition(state.toBuilder()
                    .pid(spawned.pid())
                    .detail(DETAIL_WAITING)
                    .build());
        }

        long deadline = System.currentTimeMillis() + config.readyTimeoutMs();
        poll(config, spawned, deadline, null, future);
    }

    private void poll(ServiceLaunchConfig config, SupervisedProcess spawned, long deadline, String lastProbeError,
            CompletableFuture<Void> future) {
        synchronized (lock) {
            if (process != spawned || state.getStatus() != ServiceStatus.STARTING) {
                String reason = state.getLastError() != null ? state.getLastError() : "start interrupted";
                finishStart(future, new ServiceStartException(name + " did not start: " + reason));
                return;
            }
        }

        HealthProbeResult result = healthProbe.probe(config.healthUrl(), timing.probeTimeoutMs());
        synchronized (lock) {
            if (process != spawned || state.getStatus() != ServiceStatus.STARTING) {
                String reason = state.getLastError() != null ? state.getLastError() : "start interrupted";
                finishStart(future, new ServiceStartException(name + " did not start: " + reason));
                return;
            }
            if (result.healthy()) {
                log.info("[Supervisor:{}] Ready", name);
                transition(state.toBuilder()
                        .status(ServiceStatus.RUNNING)
                        .detail(DETAIL_RUNNING)
                        .lastError(null)
                        .build());
                finishStart(future, null);
                return;
            }
        }

        String probeError = result.detail() != null ? result.detail() : lastProbeError;
        if (System.currentTimeMillis() >= deadline) {
            String message = "Health check failed (" + config.healthUrl() + "): "
                    + (probeError != null ? probeError : "timeout");
            log.warn("[Supervisor:{}] {}", name, message);
            synchronized (lock) {
                failStartLocked(message);
            }
            stop().whenComplete((ignored, error) -> finishStart(future, new ServiceStartException(message)));
            return;
        }

        try {
            scheduler.schedule(() -> poll(config, spawned, deadline, probeError, future),
                    timing.pollIntervalMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            finishStart(future, new ServiceStartException("Engine is shutting down", e));
        }
    }

    private void failStartLocked(String message) {
        failedStartError = message;
        transition(state.toBuilder()
                .status(ServiceStatus.ERROR)
                .detail(DETAIL_FAILED)
                .lastError(message)
                .build());
    }

    private void finishStart(CompletableFuture<Void> future, Throwable error) {
        synchronized (lock) {
            if (pendingStart == future) {
                pendingStart = null;
            }
        }
        if (error == null) {
            future.complete(null);
        } else {
            future.completeExceptionally(error);
        }
    }

    private void onExit(SupervisedProcess exitedProcess, int exitCode) {
        synchronized (lock) {
            if (process != exitedProcess) {
                return;
            }
            process = null;
            boolean expected = state.getStatus() == ServiceStatus.STOPPING;
            if (!expected) {
                log.warn("[Supervisor:{}] Process exited unexpectedly with code {}", name, exitCode);
            }
            transition(state.toBuilder()
                    .status(ServiceStatus.STOPPED)
                    .detail(expected ? DETAIL_STOPPED : DETAIL_EXITED)
                    .pid(null)
                    .lastExitCode(exitCode)
                    .lastError(expected ? failedStartError : "Exited with code " + exitCode)
                    .build());
        }
    }

    private void transition(ServiceState next) {
        state = next;
        log.debug("[Supervisor:{}] {} ({})", name, next.getStatus(), next.getDetail());
        emit(new ServiceEvent.Status(next));
    }

    private void emit(ServiceEvent event) {
        try {
            emitter.accept(event);
        } catch (RuntimeException e) { // NOSONAR - listeners must not break the state machine
            log.warn("[Supervisor:{}] Event listener failed: {}", name, e.getMessage());
        }
    }

    private final class Listener implements ProcessSpawnPort.ProcessListener {

        private SupervisedProcess owner;

        @Override
        public void onLine(String stream, String line) {
            emit(new ServiceEvent.Log(name, stream, line));
        }

        @Override
        public void onExit(int exitCode) {
            SupervisedProcess target;
            synchronized (lock) {
                target = owner != null ? owner : process;
            }
            BackendSupervisor.this.onExit(target, exitCode);
        }
    }
}

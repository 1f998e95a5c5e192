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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.ServiceDescriptor;
import me.golemcore.engine.domain.model.ServiceEvent;
import me.golemcore.engine.domain.model.ServiceLaunchConfig;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ServiceState;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.HealthProbePort;
import me.golemcore.engine.port.outbound.ProcessSpawnPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Owns the lifecycle of the kokomo, chatterbox, mlx and vlm backends.
 *
 * <p>
 * Each backend has its own {@link BackendSupervisor}. Status transitions and
 * output lines of all backends are fanned out to the registered listeners.
 */
@Service
@Slf4j
public class ServiceSupervisor {

    private static final long STOP_ALL_TIMEOUT_SECONDS = 10;

    private final Map<ServiceName, BackendSupervisor> backends = new EnumMap<>(ServiceName.class);
    private final Set<Consumer<ServiceEvent>> listeners = new CopyOnWriteArraySet<>();
    private final ServiceLaunchResolver launchResolver;
    private final EngineProperties.SupervisorProperties settings;

    public ServiceSupervisor(EngineProperties properties, ServiceLaunchResolver launchResolver,
            ProcessSpawnPort spawner, HealthProbePort healthProbe, EngineExecutors executors) {
        this.launchResolver = launchResolver;
        this.settings = properties.getSupervisor();
        BackendSupervisor.Timing timing = new BackendSupervisor.Timing(settings.getHealthPollIntervalMs(),
                settings.getProbeTimeoutMs(), settings.getExternalProbeTimeoutMs(), settings.getStopGraceMs());
        for (ServiceDescriptor descriptor : ServiceDescriptor.ALL) {
            ServiceName name = descriptor.name();
            backends.put(name, new BackendSupervisor(name,
                    () -> launchResolver.resolve(name),
                    () -> launchResolver.notConfiguredMessage(name),
                    spawner, healthProbe, executors.healthPolling(), timing, this::publish));
        }
    }

    /**
     * Registers a listener for status and log events.
     *
     * @return handle that unregisters the listener
     */
    public Runnable addListener(Consumer<ServiceEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public CompletableFuture<Void> start(ServiceName name) {
        log.info("[Supervisor:{}] Start requested", name);
        return backend(name).start();
    }

    public CompletableFuture<Void> stop(ServiceName name) {
        log.info("[Supervisor:{}] Stop requested", name);
        return backend(name).stop();
    }

    public ServiceState getState(ServiceName name) {
        return backend(name).getState();
    }

    public List<ServiceState> listStates() {
        List<ServiceState> states = new ArrayList<>();
        for (BackendSupervisor backend : backends.values()) {
            states.add(backend.getState());
        }
        return states;
    }

    public boolean canStart(ServiceName name) {
        return backend(name).canStart();
    }

    public boolean isHealthy(ServiceName name) {
        return isHealthy(name, settings.getProbeTimeoutMs());
    }

    public boolean isHealthy(ServiceName name, long timeoutMs) {
        return backend(name).isHealthy(timeoutMs);
    }

    public ServiceLaunchConfig launchConfig(ServiceName name) {
        return launchResolver.resolve(name);
    }

    public String notConfiguredMessage(ServiceName name) {
        return launchResolver.notConfiguredMessage(name);
    }

    /**
     * Starts, one after another, every backend whose auto-start policy is on.
     * Failures are logged and do not prevent the remaining backends from
     * starting.
     */
    public void autoStartIfConfigured() {
        if (!settings.isAutoStart()) {
            log.info("[Supervisor] Auto-start disabled");
            return;
        }
        for (ServiceDescriptor descriptor : ServiceDescriptor.ALL) {
            ServiceName name = descriptor.name();
            if (!launchResolver.resolve(name).autoStart()) {
                continue;
            }
            log.info("[Supervisor:{}] Auto-starting", name);
            try {
                backend(name).start().join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("[Supervisor:{}] Auto-start failed: {}", name, cause.getMessage());
            }
        }
    }

    /**
     * Stops every owned backend process and waits for them to exit.
     */
    @PreDestroy
    public void stopAll() {
        List<CompletableFuture<Void>> stops = new ArrayList<>();
        for (BackendSupervisor backend : backends.values()) {
            stops.add(backend.stop());
        }
        try {
            CompletableFuture.allOf(stops.toArray(CompletableFuture[]::new))
                    .get(STOP_ALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException | ExecutionException e) {
            log.warn("[Supervisor] Not all backends stopped cleanly: {}", e.getMessage());
        }
    }

    private BackendSupervisor backend(ServiceName name) {
        BackendSupervisor backend = backends.get(name);
        if (backend == null) {
            throw new IllegalArgumentException("Unknown service: " + name);
        }
        return backend;
    }

    private void publish(ServiceEvent event) {
        for (Consumer<ServiceEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) { // NOSONAR - one failing listener must not starve the others
                log.warn("[Supervisor] Listener failed: {}", e.getMessage());
            }
        }
    }
}

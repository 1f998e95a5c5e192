package me.golemcore.engine.infrastructure.config;

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
import me.golemcore.engine.domain.model.ServiceName;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the engine.
 *
 * <ul>
 * <li>{@link #sessionOwner()} - single thread that owns the session table; all
 * session reads and writes are submitted to it</li>
 * <li>{@link #worker()} - request pipelines, service commands and detached
 * work such as workbench runs and backend auto-start; may block</li>
 * <li>{@link #healthPolling()} - backend start and readiness ticks only;
 * tasks submitted here must not block beyond a short health probe</li>
 * </ul>
 */
@Component
@Slf4j
public class EngineExecutors {

    private final ExecutorService sessionOwner = Executors.newSingleThreadExecutor(daemonFactory("session-owner"));
    private final ExecutorService worker = Executors.newCachedThreadPool(daemonFactory("engine-worker"));
    private final ScheduledExecutorService healthPolling = Executors.newScheduledThreadPool(
            ServiceName.values().length, daemonFactory("service-health"));

    public ExecutorService sessionOwner() {
        return sessionOwner;
    }

    public ExecutorService worker() {
        return worker;
    }

    public ScheduledExecutorService healthPolling() {
        return healthPolling;
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Executors] Shutting down engine thread pools");
        healthPolling.shutdownNow();
        worker.shutdownNow();
        sessionOwner.shutdown();
        try {
            if (!sessionOwner.awaitTermination(2, TimeUnit.SECONDS)) {
                sessionOwner.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sessionOwner.shutdownNow();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

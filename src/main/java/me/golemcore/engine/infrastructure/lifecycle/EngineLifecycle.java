package me.golemcore.engine.infrastructure.lifecycle;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.service.ServiceSupervisor;
import me.golemcore.engine.domain.service.WorkspacePaths;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;

/**
 * Starts configured backends once the server accepts connections. Backends
 * are stopped by {@link ServiceSupervisor} on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineLifecycle {

    private final ServiceSupervisor supervisor;
    private final EngineExecutors executors;
    private final WorkspacePaths paths;
    private final Environment environment;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("[Engine] Listening on {}:{} (repo root {})",
                environment.getProperty("server.address", "127.0.0.1"),
                environment.getProperty("local.server.port", environment.getProperty("server.port", "7777")),
                paths.repoRoot());
        try {
            executors.worker().execute(this::autoStart);
        } catch (RejectedExecutionException e) {
            log.debug("[Engine] Auto-start skipped, shutting down");
        }
    }

    void autoStart() {
        try {
            supervisor.autoStartIfConfigured();
        } catch (RuntimeException e) { // NOSONAR - a broken backend must not take the server down
            log.error("[Engine] Failed to auto-start services", e);
        }
    }
}

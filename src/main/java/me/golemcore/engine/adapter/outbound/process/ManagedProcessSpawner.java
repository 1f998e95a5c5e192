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

import jakarta.annotation.PreDestroy;
import me.golemcore.engine.domain.model.ProcessSpec;
import me.golemcore.engine.port.outbound.ProcessSpawnPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link ProcessSpawnPort} backed by {@link ProcessBuilder}.
 */
@Component
public class ManagedProcessSpawner implements ProcessSpawnPort {

    private final ExecutorService stopExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-stop");
        t.setDaemon(true);
        return t;
    });

    @Override
    public SupervisedProcess spawn(ProcessSpec spec, ProcessListener listener) throws IOException {
        return ManagedProcess.start(spec, listener, stopExecutor);
    }

    @PreDestroy
    public void shutdown() {
        stopExecutor.shutdown();
    }
}

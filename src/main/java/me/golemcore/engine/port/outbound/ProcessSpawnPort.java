package me.golemcore.engine.port.outbound;

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

import me.golemcore.engine.domain.model.ProcessSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Spawns child processes for backends and hands back a handle that only the
 * supervisor may signal.
 */
public interface ProcessSpawnPort {

    /**
     * Starts the process described by {@code spec}. Output lines and the exit
     * code are delivered to {@code listener} from reader threads.
     *
     * @throws IOException
     *             if the executable cannot be started
     */
    SupervisedProcess spawn(ProcessSpec spec, ProcessListener listener) throws IOException;

    interface SupervisedProcess {

        /**
         * Operating system process id, or {@code null} once the process has
         * exited.
         */
        Long pid();

        boolean isRunning();

        /**
         * Sends a terminate signal, waits up to {@code grace}, then force-kills.
         * Completes once the process has exited. Repeated calls while a stop is
         * in flight are no-ops.
         */
        CompletableFuture<Void> stop(Duration grace);
    }

    interface ProcessListener {

        void onLine(String stream, String line);

        void onExit(int exitCode);
    }
}

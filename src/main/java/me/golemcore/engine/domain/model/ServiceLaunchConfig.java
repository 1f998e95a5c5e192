package me.golemcore.engine.domain.model;

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

import java.nio.file.Path;
import java.util.List;

/**
 * Launch settings of a backend, resolved from configuration and the workspace
 * at the moment of use.
 *
 * @param command
 *            argv; empty when the backend is not configured
 * @param healthUrl
 *            readiness endpoint, {@code null} when there is nothing to probe
 * @param baseUrl
 *            {@code http://host:port} of the backend
 * @param configError
 *            set when the configured command could not be parsed
 */
public record ServiceLaunchConfig(
        ServiceName name,
        List<String> command,
        String healthUrl,
        String baseUrl,
        long readyTimeoutMs,
        boolean autoStart,
        String configError,
        Path workingDirectory) {

    public ServiceLaunchConfig {
        command = command != null ? List.copyOf(command) : List.of();
    }

    public boolean isConfigured() {
        return !command.isEmpty();
    }
}

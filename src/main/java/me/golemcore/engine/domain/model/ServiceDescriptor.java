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

import java.util.List;

/**
 * Static description of a backend: where it listens by default, how it is
 * health-checked and which bundled wrapper launches it.
 *
 * @param wrapperScript
 *            repo-relative launch script used when no command is configured
 * @param venvPython
 *            repo-relative interpreter whose presence marks the backend as
 *            installed
 * @param autoStartWhenInstalled
 *            whether the backend starts with the engine once its wrapper is
 *            installed and no explicit policy is configured
 */
public record ServiceDescriptor(
        ServiceName name,
        String title,
        String summary,
        ServiceKind kind,
        String defaultHost,
        int defaultPort,
        String healthPath,
        String wrapperScript,
        String venvPython,
        long defaultReadyTimeoutMs,
        boolean autoStartWhenInstalled) {

    private static final String DEFAULT_HOST = "127.0.0.1";
    private static final String HEALTH_PATH = "/health";

    public static final List<ServiceDescriptor> ALL = List.of(
            new ServiceDescriptor(ServiceName.KOKOMO, "Kokomo TTS", "local TTS (mlx-audio[tts])",
                    ServiceKind.TTS, DEFAULT_HOST, 8880, HEALTH_PATH,
                    "scripts/services/kokomo/run-server.sh", "external/kokomo-mlx/.venv/bin/python",
                    15_000, false),
            new ServiceDescriptor(ServiceName.CHATTERBOX, "Chatterbox TTS", "local TTS (voice cloning)",
                    ServiceKind.TTS, DEFAULT_HOST, 8890, HEALTH_PATH,
                    "scripts/services/chatterbox/run-server.sh", "external/chatterbox-tts/.venv/bin/python",
                    30_000, false),
            new ServiceDescriptor(ServiceName.MLX, "MLX LLM", "local LLM (mlx-lm)",
                    ServiceKind.LLM, DEFAULT_HOST, 12345, HEALTH_PATH,
                    "scripts/services/mlx/run-server.sh", "external/mlx-llm/.venv/bin/python",
                    30_000, true),
            new ServiceDescriptor(ServiceName.VLM, "MLX VLM", "local VLM (mlx-vlm)",
                    ServiceKind.VLM, DEFAULT_HOST, 12346, HEALTH_PATH,
                    "scripts/services/vlm/run-server.sh", "external/mlx-vlm/.venv/bin/python",
                    30_000, false));

    public static ServiceDescriptor of(ServiceName name) {
        return ALL.stream()
                .filter(descriptor -> descriptor.name() == name)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown service: " + name));
    }
}

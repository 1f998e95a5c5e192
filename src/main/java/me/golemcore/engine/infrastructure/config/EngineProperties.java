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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code engine.*} prefix. Every value
 * can be overridden from the environment through Spring relaxed binding, e.g.
 * {@code ENGINE_SERVICES_MLX_COMMAND} or {@code ENGINE_LLM_MODEL}.
 * <ul>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link WorkspaceProperties} - repo root, agent packs, workspace prompt</li>
 * <li>{@link LlmProperties} - text model defaults</li>
 * <li>{@link QuickProperties} / {@link FollowupProperties} - quick chat path</li>
 * <li>{@link WorkbenchProperties} - background strategy comparison</li>
 * <li>{@link VlmProperties} - vision model defaults</li>
 * <li>{@link SupervisorProperties} / {@link ServiceProperties} - backend
 * supervision</li>
 * <li>{@link ToolsProperties} - tool limits</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    private HttpProperties http = new HttpProperties();
    private WorkspaceProperties workspace = new WorkspaceProperties();
    private LlmProperties llm = new LlmProperties();
    private QuickProperties quick = new QuickProperties();
    private FollowupProperties followup = new FollowupProperties();
    private WorkbenchProperties workbench = new WorkbenchProperties();
    private VlmProperties vlm = new VlmProperties();
    private SupervisorProperties supervisor = new SupervisorProperties();
    private Map<String, ServiceProperties> services = new LinkedHashMap<>();
    private ToolsProperties tools = new ToolsProperties();

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== WORKSPACE ====================

    @Data
    public static class WorkspaceProperties {
        /** Repository root used for tools, agent packs and service wrappers. */
        private String root = ".";
        /** Directory under the root holding agents, workspace prompts and caches. */
        private String stateDir = ".agentloop";
        private long promptCacheTtlMs = 2000;
        /** Extra system prompt appended after the composed prompt stack. */
        private String systemPrompt;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** Always try the local mlx backend, even when it looks uninstalled. */
        private boolean preferLocal = false;
        private String baseUrl = "http://127.0.0.1:12345";
        private String model = "mlx-community/Llama-3.2-3B-Instruct-4bit";
        private long timeoutMs = 120000;
        private int maxTokens = 256;
        private double temperature = 0.2;
        private double topP = 0.9;
    }

    @Data
    public static class QuickProperties {
        private String baseUrl;
        private String model = "mlx-community/Llama-3.2-1B-Instruct-4bit";
        private int maxTokens = 128;
        /** Falls back to the agent temperature when unset. */
        private Double temperature;
        private int maxChars = 220;
        private int maxWords = 60;
    }

    @Data
    public static class FollowupProperties {
        private boolean enabled = true;
        private int minChars = 140;
        private int minPromptChars = 12;
        private int minHistoryTurns = 12;
        private String model;
        private int maxTokens = 256;
        private Double temperature;
    }

    @Data
    public static class WorkbenchProperties {
        /**
         * Comma separated strategy ids ({@code quick,balanced,full}); {@code true}
         * enables all of them, empty or {@code false} disables the workbench.
         */
        private String strategies = "";
        private int balancedMaxTokens = 192;
    }

    // ==================== VLM ====================

    @Data
    public static class VlmProperties {
        /** Derived from the vlm service host and port when unset. */
        private String baseUrl;
        private String model = "mlx-community/Qwen2-VL-2B-Instruct-4bit";
        private long timeoutMs = 120000;
        private int maxTokens = 256;
        private double temperature = 0.2;
        private String defaultPrompt = "Describe the image.";
    }

    // ==================== SUPERVISOR ====================

    @Data
    public static class SupervisorProperties {
        private long healthPollIntervalMs = 250;
        private long probeTimeoutMs = 250;
        private long externalProbeTimeoutMs = 300;
        private long stopGraceMs = 2000;
        private boolean autoStart = true;
    }

    @Data
    public static class ServiceProperties {
        /** Launch command, split with shell-like quoting rules. */
        private String command;
        /** Launch command as a JSON array of strings; wins over {@link #command}. */
        private String commandJson;
        private String host;
        private Integer port;
        private String healthUrl;
        private Long readyTimeoutMs;
        /** Tri-state: unset falls back to the backend's default policy. */
        private Boolean autoStart;
        /** Use the bundled wrapper script even before its venv exists. */
        private boolean useDefaults = false;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int readMaxBytes = 65536;
        private String logoBaseUrl = "https://logo.clearbit.com";
        private long logoTimeoutMs = 10000;
    }
}

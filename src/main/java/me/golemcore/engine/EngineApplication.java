package me.golemcore.engine;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Engine.
 *
 * <p>
 * GolemCore Engine is a local-first runtime that lets an interactive client
 * talk to swappable local model backends over a WebSocket JSON protocol.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Session Protocol</b> - session lifecycle, agent routing and token
 * streaming over one WebSocket per client</li>
 * <li><b>Service Supervisor</b> - starts, health-checks and stops the kokomo,
 * chatterbox, mlx and vlm backends as child processes</li>
 * <li><b>Tool Loop</b> - text-protocol tool calls against a sandboxed
 * repository</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → EngineWebSocketHandler
 * Domain Layer       → SessionProtocolEngine, ServiceSupervisor, ToolLoopSystem
 * Infrastructure     → OkHttp LLM client, process spawner, health probe
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code engine.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngineApplication.class, args);
    }

}

package me.golemcore.engine.domain.model.protocol;

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

import me.golemcore.engine.domain.model.RoutingMode;
import me.golemcore.engine.domain.model.ServiceName;

import java.util.List;

/**
 * Commands accepted from clients. The set is closed: every wire {@code type}
 * maps to exactly one variant.
 */
public interface EngineCommand {

    String SESSION_CREATE = "session.create";
    String SESSION_SEND = "session.send";
    String SESSION_CONFIGURE = "session.configure";
    String SESSION_CANCEL = "session.cancel";
    String AGENT_LIST = "agent.list";
    String SERVICE_START = "service.start";
    String SERVICE_STOP = "service.stop";
    String SERVICE_STATUS = "service.status";

    String type();

    /**
     * @param sessionId
     *            requested id, or {@code null} to generate one
     */
    record SessionCreate(String sessionId) implements EngineCommand {
        @Override
        public String type() {
            return SESSION_CREATE;
        }
    }

    /**
     * @param images
     *            local image file paths attached to the message
     */
    record SessionSend(String sessionId, String content, List<String> images) implements EngineCommand {
        public SessionSend {
            images = images != null ? List.copyOf(images) : List.of();
        }

        @Override
        public String type() {
            return SESSION_SEND;
        }
    }

    /**
     * Partial update of a session's routing settings. The {@code *Provided}
     * flags distinguish an absent field (keep) from an explicit {@code null}
     * (clear).
     */
    record SessionConfigure(String sessionId, RoutingMode routingMode, boolean agentProvided, String agent,
            boolean sessionPromptProvided, String sessionPrompt) implements EngineCommand {
        @Override
        public String type() {
            return SESSION_CONFIGURE;
        }
    }

    record SessionCancel(String sessionId) implements EngineCommand {
        @Override
        public String type() {
            return SESSION_CANCEL;
        }
    }

    record AgentList() implements EngineCommand {
        @Override
        public String type() {
            return AGENT_LIST;
        }
    }

    record ServiceStart(ServiceName name) implements EngineCommand {
        @Override
        public String type() {
            return SERVICE_START;
        }
    }

    record ServiceStop(ServiceName name) implements EngineCommand {
        @Override
        public String type() {
            return SERVICE_STOP;
        }
    }

    /**
     * @param name
     *            backend to report, or {@code null} for every non-quiet backend
     */
    record ServiceStatusQuery(ServiceName name) implements EngineCommand {
        @Override
        public String type() {
            return SERVICE_STATUS;
        }
    }
}

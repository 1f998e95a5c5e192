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

import com.fasterxml.jackson.annotation.JsonInclude;
import me.golemcore.engine.domain.model.RoutingMode;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ServiceState;
import me.golemcore.engine.domain.model.SessionStatus;
import me.golemcore.engine.domain.model.ToolCall;

import java.util.List;
import java.util.Map;

/**
 * Events pushed to clients. Serialized flat, with the wire {@code type} next to
 * the record components.
 */
public interface EngineEvent {

    String type();

    record SessionCreated(String sessionId) implements EngineEvent {
        @Override
        public String type() {
            return "session.created";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SessionStatusChanged(String sessionId, SessionStatus status, String detail) implements EngineEvent {
        @Override
        public String type() {
            return "session.status";
        }
    }

    record AssistantToken(String sessionId, String token) implements EngineEvent {
        @Override
        public String type() {
            return "assistant.token";
        }
    }

    record AssistantMessage(String sessionId, String messageId, String content) implements EngineEvent {
        @Override
        public String type() {
            return "assistant.message";
        }
    }

    record ToolCallStarted(String sessionId, ToolCall tool) implements EngineEvent {
        @Override
        public String type() {
            return "tool.call";
        }
    }

    record ToolCallFinished(String sessionId, String toolId, Object result) implements EngineEvent {
        @Override
        public String type() {
            return "tool.result";
        }
    }

    record RouterDecision(String sessionId, RoutingMode routingMode, String agent, List<String> toolsAllowed,
            String reason, long durationMs) implements EngineEvent {
        @Override
        public String type() {
            return "router.decision";
        }
    }

    record AgentListed(List<AgentSummary> agents) implements EngineEvent {
        @Override
        public String type() {
            return "agent.list";
        }
    }

    record AgentSummary(String name, String description, List<String> tools) {
    }

    record ServiceStatusChanged(ServiceState service) implements EngineEvent {
        @Override
        public String type() {
            return "service.status";
        }
    }

    record ServiceLog(ServiceName name, String stream, String line) implements EngineEvent {
        @Override
        public String type() {
            return "service.log";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PerfMetric(String sessionId, String name, long durationMs, Map<String, Object> meta)
            implements EngineEvent {
        @Override
        public String type() {
            return "perf.metric";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorReported(String sessionId, String error) implements EngineEvent {
        @Override
        public String type() {
            return "error";
        }

        public static ErrorReported of(String error) {
            return new ErrorReported(null, error);
        }
    }
}

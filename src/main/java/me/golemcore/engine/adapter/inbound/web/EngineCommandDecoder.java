package me.golemcore.engine.adapter.inbound.web;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.exception.ProtocolException;
import me.golemcore.engine.domain.model.RoutingMode;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.protocol.EngineCommand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Parses the {@code {type, payload}} command envelope. Validation is strict:
 * wrong types, missing required fields and unknown fields are all rejected
 * with a {@link ProtocolException}.
 */
@Component
public class EngineCommandDecoder {

    private static final Set<String> ENVELOPE_FIELDS = Set.of("type", "payload");

    private final ObjectMapper objectMapper;

    public EngineCommandDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EngineCommand decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to parse message: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid("expected a JSON object");
        }
        checkFields(root, ENVELOPE_FIELDS, "command");
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw invalid("type must be a string");
        }
        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) {
            payload = objectMapper.createObjectNode();
        } else if (!payload.isObject()) {
            throw invalid("payload must be an object");
        }

        String type = typeNode.asText();
        switch (type) {
            case EngineCommand.SESSION_CREATE:
                checkFields(payload, Set.of("sessionId"), type);
                return new EngineCommand.SessionCreate(optionalString(payload, "sessionId"));
            case EngineCommand.SESSION_SEND:
                checkFields(payload, Set.of("sessionId", "content", "images"), type);
                return new EngineCommand.SessionSend(requiredString(payload, "sessionId"),
                        requiredString(payload, "content"), images(payload));
            case EngineCommand.SESSION_CONFIGURE:
                return configure(payload);
            case EngineCommand.SESSION_CANCEL:
                checkFields(payload, Set.of("sessionId"), type);
                return new EngineCommand.SessionCancel(requiredString(payload, "sessionId"));
            case EngineCommand.AGENT_LIST:
                checkFields(payload, Set.of(), type);
                return new EngineCommand.AgentList();
            case EngineCommand.SERVICE_START:
                checkFields(payload, Set.of("name"), type);
                return new EngineCommand.ServiceStart(serviceName(payload, true));
            case EngineCommand.SERVICE_STOP:
                checkFields(payload, Set.of("name"), type);
                return new EngineCommand.ServiceStop(serviceName(payload, true));
            case EngineCommand.SERVICE_STATUS:
                checkFields(payload, Set.of("name"), type);
                return new EngineCommand.ServiceStatusQuery(serviceName(payload, false));
            default:
                throw invalid("unknown command type '" + type + "'");
        }
    }

    private EngineCommand configure(JsonNode payload) {
        checkFields(payload, Set.of("sessionId", "routingMode", "agent", "sessionPrompt"),
                EngineCommand.SESSION_CONFIGURE);
        RoutingMode routingMode = null;
        String rawMode = optionalString(payload, "routingMode");
        if (rawMode != null) {
            routingMode = RoutingMode.fromValue(rawMode)
                    .orElseThrow(() -> invalid("routingMode must be 'auto' or 'pinned'"));
        }
        return new EngineCommand.SessionConfigure(requiredString(payload, "sessionId"), routingMode,
                payload.has("agent"), nullableString(payload, "agent"),
                payload.has("sessionPrompt"), nullableString(payload, "sessionPrompt"));
    }

    private List<String> images(JsonNode payload) {
        JsonNode node = payload.get("images");
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw invalid("images must be an array of strings");
        }
        List<String> images = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw invalid("images must be an array of strings");
            }
            images.add(item.asText());
        }
        return images;
    }

    private ServiceName serviceName(JsonNode payload, boolean required) {
        String raw = required ? requiredString(payload, "name") : optionalString(payload, "name");
        if (raw == null) {
            return null;
        }
        return ServiceName.fromValue(raw)
                .orElseThrow(() -> invalid("unknown service '" + raw + "'"));
    }

    private static void checkFields(JsonNode node, Set<String> allowed, String where) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw invalid("unrecognized field '" + name + "' in " + where);
            }
        }
    }

    private static String requiredString(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual()) {
            throw invalid(field + " must be a string");
        }
        return node.asText();
    }

    private static String optionalString(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null) {
            return null;
        }
        if (!node.isTextual()) {
            throw invalid(field + " must be a string");
        }
        return node.asText();
    }

    private static String nullableString(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw invalid(field + " must be a string or null");
        }
        return node.asText();
    }

    private static ProtocolException invalid(String reason) {
        return new ProtocolException("Invalid command: " + reason);
    }
}

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.engine.domain.model.protocol.EngineEvent;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Serializes events as flat JSON objects: {@code type} first, then the record
 * components. Null components are left out.
 */
@Component
public class EngineEventEncoder {

    private final ObjectMapper objectMapper;

    public EngineEventEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(EngineEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.type());
        JsonNode fields = objectMapper.valueToTree(event);
        Iterator<Map.Entry<String, JsonNode>> entries = fields.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isNull() && !"type".equals(entry.getKey())) {
                node.set(entry.getKey(), entry.getValue());
            }
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}

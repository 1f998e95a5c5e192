package me.golemcore.engine.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;

/**
 * Extracts text deltas from the lines of an OpenAI-style server-sent event
 * stream.
 *
 * <p>
 * Only {@code data:} lines carry content. {@code [DONE]}, comments, blank
 * lines and payloads that are not valid JSON yield nothing.
 */
@Slf4j
final class EventStreamLineParser {

    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final ObjectMapper objectMapper;

    EventStreamLineParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Optional<String> parseDelta(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith(DATA_PREFIX)) {
            return Optional.empty();
        }
        String payload = trimmed.substring(DATA_PREFIX.length()).trim();
        if (payload.isEmpty() || DONE.equals(payload)) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            log.debug("[LLM] Skipping malformed stream line: {}", payload);
            return Optional.empty();
        }

        JsonNode choice = root.path("choices").path(0);
        JsonNode content = choice.path("delta").path("content");
        if (!content.isTextual()) {
            content = choice.path("message").path("content");
        }
        if (!content.isTextual()) {
            content = choice.path("text");
        }
        if (!content.isTextual() || content.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(content.asText());
    }

    String parseModel(String line, String fallback) {
        if (line == null || !line.trim().startsWith(DATA_PREFIX)) {
            return fallback;
        }
        try {
            JsonNode model = objectMapper.readTree(line.trim().substring(DATA_PREFIX.length()).trim()).path("model");
            return model.isTextual() ? model.asText() : fallback;
        } catch (IOException e) {
            return fallback;
        }
    }
}

package me.golemcore.engine.domain.system.toolloop;

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
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolResult;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Line-oriented tool protocol spoken with the model.
 *
 * <pre>
 * TOOL_CALL: {"name":"fs.read","args":{"path":"README.md"}}
 * TOOL_RESULT: {"name":"fs.read","ok":true,"result":{...}}
 * </pre>
 */
public class ToolCallProtocol {

    public static final String TOOL_CALL_PREFIX = "TOOL_CALL:";
    public static final String TOOL_RESULT_PREFIX = "TOOL_RESULT:";

    private static final String LINE_SPLIT = "\\r?\\n";

    private final ObjectMapper objectMapper;

    public ToolCallProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A well-formed call of an allowed tool.
     */
    public record ParsedCall(ToolComponent tool, Map<String, Object> arguments, JsonNode rawArguments) {
    }

    /**
     * Finds the first {@code TOOL_CALL:} line and validates it against the
     * allowed tools.
     *
     * @return empty when there is no call line, its JSON is malformed, the tool is
     *         not allowed or the arguments have the wrong shape
     */
    public Optional<ParsedCall> parse(String text, Map<String, ToolComponent> allowedTools) {
        if (text == null) {
            return Optional.empty();
        }
        Optional<String> callLine = Arrays.stream(text.split(LINE_SPLIT))
                .filter(line -> line.stripLeading().startsWith(TOOL_CALL_PREFIX))
                .findFirst();
        if (callLine.isEmpty()) {
            return Optional.empty();
        }

        String line = callLine.get();
        String json = line.substring(line.indexOf(TOOL_CALL_PREFIX) + TOOL_CALL_PREFIX.length()).trim();
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject() || !root.path("name").isTextual()) {
            return Optional.empty();
        }

        ToolComponent tool = allowedTools.get(root.get("name").asText());
        if (tool == null) {
            return Optional.empty();
        }
        JsonNode args = root.get("args");
        return tool.parseArguments(args).map(params -> new ParsedCall(tool, params, args));
    }

    /**
     * Event payload for a tool outcome: {@code {ok, result}} or
     * {@code {ok, error}}.
     */
    public Map<String, Object> outcome(ToolResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ok", result.isSuccess());
        if (result.isSuccess()) {
            payload.put("result", result.getData());
        } else {
            payload.put("error", result.getError());
        }
        return payload;
    }

    public String formatResult(String toolName, Map<String, Object> outcome) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("name", toolName);
        line.putAll(outcome);
        try {
            return TOOL_RESULT_PREFIX + " " + objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            return TOOL_RESULT_PREFIX + " {\"name\":\"" + toolName + "\",\"ok\":false,\"error\":\"unserializable result\"}";
        }
    }

    /**
     * Removes protocol lines from model output.
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        return Arrays.stream(text.split(LINE_SPLIT))
                .filter(line -> {
                    String trimmed = line.stripLeading();
                    return !trimmed.startsWith(TOOL_CALL_PREFIX) && !trimmed.startsWith(TOOL_RESULT_PREFIX);
                })
                .collect(Collectors.joining("\n"))
                .trim();
    }

    /**
     * System prompt teaching the protocol and listing the given tools.
     */
    public static String catalogPrompt(List<ToolDefinition> definitions) {
        String lines = definitions.stream()
                .map(ToolDefinition::toCatalogLine)
                .collect(Collectors.joining("\n"));
        return "You may call tools when helpful. To call a tool, output a single line:\n"
                + "TOOL_CALL: {\"name\":\"...\",\"args\":{...}}\n"
                + "\n"
                + "Available tools:\n"
                + lines + "\n"
                + "\n"
                + "Rules:\n"
                + "- Only use repo-relative paths for fs.* tools.\n"
                + "- Call at most one tool at a time; wait for TOOL_RESULT in the next message before continuing.";
    }
}

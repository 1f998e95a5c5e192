package me.golemcore.engine.domain.service;

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
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentCatalog;
import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.ToolNames;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads agent packs and the workspace prompt from the state directory.
 *
 * <p>
 * Every {@code agents/*.md} file may start with YAML frontmatter
 * ({@code name}, {@code description}, {@code tools}, {@code max_tool_calls},
 * {@code max_history_turns}, {@code temperature}); the body is the prompt. A
 * file named like a built-in agent overrides it field by field. Unknown tool
 * names are dropped.
 */
@Component
@Slf4j
public class AgentPackLoader {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n(.*))?$", Pattern.DOTALL);
    private static final String DEFAULT_DESCRIPTION = "Custom agent pack.";
    private static final int DEFAULT_MAX_TOOL_CALLS = 3;
    private static final int DEFAULT_MAX_HISTORY_TURNS = 20;

    private final WorkspacePaths workspacePaths;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public AgentPackLoader(WorkspacePaths workspacePaths) {
        this.workspacePaths = workspacePaths;
    }

    public AgentCatalog load() {
        return new AgentCatalog(loadAgents(), loadWorkspacePrompt());
    }

    List<AgentPack> loadAgents() {
        Map<String, AgentPack> byName = new LinkedHashMap<>();
        for (AgentPack agent : BuiltInAgents.ALL) {
            byName.put(agent.getName(), agent);
        }

        Path dir = workspacePaths.agentsDir();
        if (Files.isDirectory(dir)) {
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.md")) {
                stream.forEach(files::add);
            } catch (IOException e) {
                log.warn("[Agents] Failed to list {}: {}", dir, e.getMessage());
            }
            files.sort(Comparator.comparing(Path::toString));
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                AgentPack parsed = parseAgentFile(file, byName);
                if (parsed != null) {
                    byName.put(parsed.getName(), parsed);
                }
            }
        }

        List<AgentPack> agents = new ArrayList<>(byName.values());
        agents.sort(Comparator.comparing(AgentPack::getName));
        return List.copyOf(agents);
    }

    /**
     * Shared and local workspace prompts joined by a blank line.
     */
    String loadWorkspacePrompt() {
        List<String> parts = new ArrayList<>();
        for (Path file : List.of(workspacePaths.workspacePrompt(), workspacePaths.workspaceLocalPrompt())) {
            String text = readOptional(file).trim();
            if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        return String.join("\n\n", parts);
    }

    private AgentPack parseAgentFile(Path file, Map<String, AgentPack> known) {
        String content = readOptional(file);
        if (content.isBlank()) {
            return null;
        }
        String fileName = file.getFileName().toString();
        String baseName = fileName.substring(0, fileName.length() - ".md".length());

        JsonNode meta = yamlMapper.createObjectNode();
        String body = content.trim();
        Matcher matcher = FRONTMATTER_PATTERN.matcher(content.stripLeading());
        if (matcher.matches()) {
            body = matcher.group(2) != null ? matcher.group(2).trim() : "";
            try {
                JsonNode parsed = yamlMapper.readTree(matcher.group(1));
                if (parsed != null && parsed.isObject()) {
                    meta = parsed;
                }
            } catch (JsonProcessingException e) {
                log.warn("[Agents] Invalid frontmatter in {}: {}", file, e.getOriginalMessage());
            }
        }

        String name = text(meta, "name");
        if (name == null) {
            name = baseName.trim();
        }
        if (name.isEmpty()) {
            return null;
        }

        AgentPack builtIn = known.get(name);
        List<String> tools = tools(meta.get("tools"));
        String description = text(meta, "description");

        return AgentPack.builder()
                .name(name)
                .description(description != null ? description
                        : builtIn != null ? builtIn.getDescription() : DEFAULT_DESCRIPTION)
                .prompt(!body.isEmpty() ? body : builtIn != null ? builtIn.getPrompt() : "")
                .tools(!tools.isEmpty() ? tools : builtIn != null ? builtIn.getTools() : List.of())
                .maxToolCalls(integer(meta, "max_tool_calls",
                        builtIn != null ? builtIn.getMaxToolCalls() : DEFAULT_MAX_TOOL_CALLS))
                .maxHistoryTurns(integer(meta, "max_history_turns",
                        builtIn != null ? builtIn.getMaxHistoryTurns() : DEFAULT_MAX_HISTORY_TURNS))
                .temperature(decimal(meta, "temperature", builtIn != null ? builtIn.getTemperature() : null))
                .build();
    }

    private static List<String> tools(JsonNode node) {
        List<String> raw = new ArrayList<>();
        if (node == null || node.isNull()) {
            return raw;
        }
        if (node.isArray()) {
            node.forEach(item -> raw.add(item.asText().trim()));
        } else {
            raw.addAll(Arrays.asList(node.asText().split(",")));
        }
        return raw.stream()
                .map(String::trim)
                .filter(ToolNames::isKnown)
                .distinct()
                .toList();
    }

    private static String text(JsonNode meta, String field) {
        JsonNode node = meta.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static int integer(JsonNode meta, String field, int fallback) {
        Double value = number(meta.get(field));
        return value != null ? value.intValue() : fallback;
    }

    private static Double decimal(JsonNode meta, String field, Double fallback) {
        Double value = number(meta.get(field));
        return value != null ? value : fallback;
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            double parsed = Double.parseDouble(node.asText().trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String readOptional(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[Agents] Failed to read {}: {}", file, e.getMessage());
            return "";
        }
    }
}

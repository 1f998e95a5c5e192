package me.golemcore.engine.tools;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.exception.PathEscapeException;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the head of a repo-relative file.
 *
 * <p>
 * At most {@code maxBytes} bytes are decoded as UTF-8; {@code bytes} in the
 * result is always the full file size.
 */
@Component
@Slf4j
public class FsReadTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_MAX_BYTES = "maxBytes";

    private final RepoPathResolver pathResolver;
    private final int defaultMaxBytes;

    public FsReadTool(RepoPathResolver pathResolver, EngineProperties properties) {
        this.pathResolver = pathResolver;
        this.defaultMaxBytes = properties.getTools().getReadMaxBytes();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolNames.FS_READ)
                .argsExample("{\"path\":\"<repo-relative>\",\"maxBytes\":" + defaultMaxBytes + "}")
                .returns("{ path, bytes, content }")
                .description("repo root: " + pathResolver.root())
                .build();
    }

    @Override
    public Optional<Map<String, Object>> parseArguments(JsonNode args) {
        if (args == null || !args.isObject() || !args.path(PARAM_PATH).isTextual()) {
            return Optional.empty();
        }
        Map<String, Object> params = new HashMap<>();
        params.put(PARAM_PATH, args.get(PARAM_PATH).asText());

        JsonNode maxBytes = args.get(PARAM_MAX_BYTES);
        if (maxBytes != null && !maxBytes.isNull()) {
            if (!maxBytes.isNumber() || !Double.isFinite(maxBytes.asDouble()) || maxBytes.asDouble() <= 0) {
                return Optional.empty();
            }
            params.put(PARAM_MAX_BYTES, (long) Math.ceil(maxBytes.asDouble()));
        }
        return Optional.of(params);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String relativePath = (String) parameters.get(PARAM_PATH);
            Object limit = parameters.get(PARAM_MAX_BYTES);
            long maxBytes = limit instanceof Number number ? number.longValue() : defaultMaxBytes;
            try {
                Path file = pathResolver.resolve(relativePath);
                if (!Files.isRegularFile(file)) {
                    return ToolResult.failure("file does not exist");
                }
                long size = Files.size(file);
                byte[] head;
                try (InputStream in = Files.newInputStream(file)) {
                    head = in.readNBytes((int) Math.min(size, Math.min(maxBytes, Integer.MAX_VALUE)));
                }

                Map<String, Object> data = new LinkedHashMap<>();
                data.put(PARAM_PATH, relativePath);
                data.put("bytes", size);
                data.put("content", new String(head, StandardCharsets.UTF_8));
                return ToolResult.success(data);
            } catch (PathEscapeException e) {
                return ToolResult.failure(e.getMessage());
            } catch (IOException e) {
                log.debug("[Tools] fs.read failed for {}: {}", relativePath, e.getMessage());
                return ToolResult.failure("read failed: " + e.getMessage());
            }
        });
    }
}

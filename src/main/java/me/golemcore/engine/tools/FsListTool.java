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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lists a repo-relative directory. Entries are typed {@code dir}, {@code file}
 * or {@code other} and sorted by name.
 */
@Component
@Slf4j
public class FsListTool implements ToolComponent {

    private static final String PARAM_PATH = "path";

    private final RepoPathResolver pathResolver;

    public FsListTool(RepoPathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolNames.FS_LIST)
                .argsExample("{\"path\":\"<repo-relative>\"}")
                .returns("{ path, entries:[{name,type}] }")
                .build();
    }

    @Override
    public Optional<Map<String, Object>> parseArguments(JsonNode args) {
        if (args == null || !args.isObject() || !args.path(PARAM_PATH).isTextual()) {
            return Optional.empty();
        }
        return Optional.of(Map.of(PARAM_PATH, args.get(PARAM_PATH).asText()));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String relativePath = (String) parameters.get(PARAM_PATH);
            try {
                Path dir = pathResolver.resolve(relativePath);
                if (!Files.exists(dir)) {
                    return ToolResult.failure("directory does not exist");
                }
                if (!Files.isDirectory(dir)) {
                    return ToolResult.failure("not a directory");
                }

                List<Map<String, Object>> entries = new ArrayList<>();
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                    for (Path entry : stream) {
                        Map<String, Object> item = new LinkedHashMap<>();
                        item.put("name", entry.getFileName().toString());
                        item.put("type", typeOf(entry));
                        entries.add(item);
                    }
                }
                entries.sort(Comparator.comparing(item -> (String) item.get("name")));

                Map<String, Object> data = new LinkedHashMap<>();
                data.put(PARAM_PATH, relativePath);
                data.put("entries", entries);
                return ToolResult.success(data);
            } catch (PathEscapeException e) {
                return ToolResult.failure(e.getMessage());
            } catch (IOException e) {
                log.debug("[Tools] fs.list failed for {}: {}", relativePath, e.getMessage());
                return ToolResult.failure("list failed: " + e.getMessage());
            }
        });
    }

    private static String typeOf(Path entry) {
        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
            return "dir";
        }
        if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
            return "file";
        }
        return "other";
    }
}

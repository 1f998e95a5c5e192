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
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Tool returning the current time as an ISO-8601 string and epoch millis.
 */
@Component
public class TimeNowTool implements ToolComponent {

    private final Clock clock;

    public TimeNowTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolNames.TIME_NOW)
                .argsExample("{}")
                .returns("{ iso, epochMs }")
                .build();
    }

    @Override
    public Optional<Map<String, Object>> parseArguments(JsonNode args) {
        if (args == null || args.isNull() || args.isObject()) {
            return Optional.of(Map.of());
        }
        return Optional.empty();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Instant now = clock.instant();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("iso", now.toString());
        data.put("epochMs", now.toEpochMilli());
        return CompletableFuture.completedFuture(ToolResult.success(data));
    }
}

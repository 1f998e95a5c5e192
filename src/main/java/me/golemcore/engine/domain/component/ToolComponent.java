package me.golemcore.engine.domain.component;

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
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a tool the model may call through the
 * {@code TOOL_CALL:} text protocol. Tools describe themselves with a catalog
 * line, validate the argument shape of a call and implement the execution
 * logic.
 */
public interface ToolComponent {

    /**
     * Returns the catalog entry shown to the model.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Checks the structural shape of the {@code args} value of a tool call.
     *
     * @param args
     *            the raw {@code args} node, possibly {@code null}
     * @return normalized parameters, or empty when the shape is wrong and the
     *         call must be treated as plain text
     */
    Optional<Map<String, Object>> parseArguments(JsonNode args);

    /**
     * Executes the tool. Failures are reported as {@link ToolResult#failure}
     * rather than exceptions.
     *
     * @param parameters
     *            parameters previously returned by {@link #parseArguments}
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}

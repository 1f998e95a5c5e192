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

/**
 * Text-protocol tool loop: the model asks for tools with a {@code TOOL_CALL:}
 * line and receives {@code TOOL_RESULT:} lines until it answers in plain text
 * or the agent's tool budget is spent.
 */
public interface ToolLoopSystem {

    /**
     * Runs the loop to completion on the calling thread.
     *
     * @throws me.golemcore.engine.domain.exception.LlmRequestException
     *             if a model request fails
     */
    ToolLoopResult run(ToolLoopRequest request, ToolLoopListener listener);
}

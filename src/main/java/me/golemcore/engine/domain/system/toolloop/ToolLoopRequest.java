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

import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.LlmOptions;
import me.golemcore.engine.domain.model.Message;

import java.util.List;

/**
 * Input of one tool loop run.
 *
 * @param systemPrompt
 *            composed system prompt of the selected agent
 * @param transcript
 *            session messages; only the last user and assistant turns are sent
 * @param agent
 *            agent supplying the tool allow-list, budget and history window
 */
public record ToolLoopRequest(String systemPrompt, List<Message> transcript, AgentPack agent, LlmOptions options) {

    public ToolLoopRequest {
        transcript = List.copyOf(transcript);
        options = options != null ? options : LlmOptions.defaults();
    }
}

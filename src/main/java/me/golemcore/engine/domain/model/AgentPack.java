package me.golemcore.engine.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Named bundle of a system prompt fragment, the tools it may call and its
 * sampling and iteration limits.
 */
@Value
@Builder(toBuilder = true)
public class AgentPack {

    public static final String CHAT_QUICK = "chat.quick";

    String name;
    String description;
    String prompt;
    List<String> tools;
    int maxToolCalls;
    int maxHistoryTurns;
    Double temperature;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}

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

import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.ToolNames;

import java.util.List;

/**
 * Agent packs shipped with the engine. Workspace agent files override them by
 * name.
 */
public final class BuiltInAgents {

    public static final String DEBUG_TRIAGE = "debug.triage";
    public static final String CODE_ARCH = "code.arch";
    public static final String CODE_CHANGE = "code.change";
    public static final String TOOL_USE = "tool.use";

    public static final List<AgentPack> ALL = List.of(
            AgentPack.builder()
                    .name(AgentPack.CHAT_QUICK)
                    .description("Fast, conversational replies (no tools).")
                    .prompt("""
                            You are in `chat.quick` mode.
                            Answer directly and briefly. Do not plan unless asked.
                            Do not call tools.""")
                    .tools(List.of())
                    .maxToolCalls(0)
                    .maxHistoryTurns(10)
                    .temperature(0.2)
                    .build(),
            AgentPack.builder()
                    .name(DEBUG_TRIAGE)
                    .description("Debugging triage (ask for evidence, minimal changes).")
                    .prompt("""
                            You are in `debug.triage` mode.
                            Ask for logs/errors/repro steps, then propose the smallest next action.
                            Keep the conversation clean; details belong in logs.""")
                    .tools(List.of(ToolNames.FS_READ, ToolNames.FS_LIST, ToolNames.SERVICE_STATUS))
                    .maxToolCalls(3)
                    .maxHistoryTurns(20)
                    .temperature(0.1)
                    .build(),
            AgentPack.builder()
                    .name(CODE_ARCH)
                    .description("Architecture discussion and planning (tools optional).")
                    .prompt("""
                            You are in `code.arch` mode.
                            Focus on architecture, tradeoffs, and a clear plan.
                            Avoid making changes unless explicitly asked.""")
                    .tools(List.of(ToolNames.FS_READ, ToolNames.FS_LIST))
                    .maxToolCalls(2)
                    .maxHistoryTurns(20)
                    .temperature(0.2)
                    .build(),
            AgentPack.builder()
                    .name(CODE_CHANGE)
                    .description("Small, surgical code changes (tools enabled).")
                    .prompt("""
                            You are in `code.change` mode.
                            Prefer small, focused patches and verify with typecheck if relevant.
                            Avoid unrelated refactors and keep output concise.""")
                    .tools(List.of(ToolNames.FS_READ, ToolNames.FS_LIST, ToolNames.SERVICE_STATUS,
                            ToolNames.LOGO_FETCH))
                    .maxToolCalls(4)
                    .maxHistoryTurns(30)
                    .temperature(0.1)
                    .build(),
            AgentPack.builder()
                    .name(TOOL_USE)
                    .description("Explicit tool loop for multi-step tasks.")
                    .prompt("""
                            You are in `tool.use` mode.
                            Use tools when necessary; otherwise respond normally.
                            Be deliberate: one tool call at a time, then proceed.""")
                    .tools(ToolNames.ALL)
                    .maxToolCalls(6)
                    .maxHistoryTurns(30)
                    .temperature(0.2)
                    .build());

    private BuiltInAgents() {
    }
}

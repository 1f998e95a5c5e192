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
import me.golemcore.engine.domain.model.LlmMessage;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the layered system prompt and the chat request messages.
 *
 * <p>
 * Layers, joined by blank lines: core prompt, agent prompt, workspace prompt,
 * session prompt and the configured extra system prompt. Blank layers are
 * skipped.
 */
@Service
public class PromptStackService {

    static final String CORE_SYSTEM_PROMPT = """
            You are GolemCore, a local-first agent for builders and thinkers.

            Style:
            - Be concise and information-dense by default.
            - Ask 1–2 clarifying questions when requirements are ambiguous.
            - Prefer actionable steps and concrete commands when relevant.
            - Do not spam background/status chatter into the conversation.

            Safety + local-first:
            - Prefer local tools/services over network calls.
            - Ask before destructive actions (delete/reset/overwrite).

            Tool protocol:
            - Only call tools when needed.
            - Never include TOOL_CALL/TOOL_RESULT in user-facing output.""";

    private static final String SEPARATOR = "\n\n";

    private final EngineProperties.WorkspaceProperties workspace;

    public PromptStackService(EngineProperties properties) {
        this.workspace = properties.getWorkspace();
    }

    public String composeSystemPrompt(AgentPack agent, String workspacePrompt, String sessionPrompt) {
        return join(CORE_SYSTEM_PROMPT, agent.getPrompt(), workspacePrompt, sessionPrompt,
                workspace.getSystemPrompt());
    }

    /**
     * System message followed by the last {@code maxHistoryTurns} user and
     * assistant turns.
     */
    public List<LlmMessage> buildChatMessages(String system, List<Message> transcript, int maxHistoryTurns) {
        List<Message> history = transcript.stream()
                .filter(Message::isConversational)
                .toList();
        int window = Math.max(0, maxHistoryTurns) * 2;

        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.system(system.trim()));
        for (Message message : history.subList(Math.max(0, history.size() - window), history.size())) {
            messages.add(LlmMessage.builder().role(message.getRole()).content(message.getContent()).build());
        }
        return messages;
    }

    /**
     * Joins the non-blank parts, trimmed, with blank lines.
     */
    public static String join(String... parts) {
        List<String> kept = new ArrayList<>();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                kept.add(part.trim());
            }
        }
        return String.join(SEPARATOR, kept);
    }
}

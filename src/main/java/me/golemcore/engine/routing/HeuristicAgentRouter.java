package me.golemcore.engine.routing;

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
import me.golemcore.engine.domain.model.RoutingDecision;
import me.golemcore.engine.domain.service.BuiltInAgents;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword router choosing an agent pack for a message.
 *
 * <p>
 * Checked in order: debug signals, architecture signals, then a change verb
 * together with a code-scope noun. Everything else goes to
 * {@code chat.quick}. Matching is case-insensitive substring search.
 */
@Component
public class HeuristicAgentRouter {

    static final String REASON_EMPTY = "empty";
    static final String REASON_DEBUG = "debug_keywords";
    static final String REASON_ARCH = "arch_keywords";
    static final String REASON_EDIT = "edit_keywords";
    static final String REASON_DEFAULT = "default";
    public static final String REASON_PINNED = "pinned";

    private static final List<String> DEBUG_KEYWORDS = List.of(
            "stack trace", "traceback", "exception", "panic", "segfault", "hang", "stuck", "timeout",
            "not working", "doesn't work", "error:", "failed");
    private static final List<String> ARCH_KEYWORDS = List.of(
            "architecture", "design", "tradeoffs", "roadmap", "plan", "milestones", "spec", "strategy");
    private static final List<String> CHANGE_VERBS = List.of(
            "implement", "refactor", "fix", "add", "remove", "rename", "update", "change");
    private static final List<String> CODE_SCOPES = List.of(
            "file", "repo", "package", "function", "type", "test", "tui", "engine", "docs", "readme");

    /**
     * @param agents
     *            non-empty agent list; a missing target falls back to the first
     *            agent
     */
    public RoutingDecision route(String message, List<AgentPack> agents) {
        String text = message == null ? "" : message.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return pick(AgentPack.CHAT_QUICK, REASON_EMPTY, agents);
        }
        if (containsAny(text, DEBUG_KEYWORDS)) {
            return pick(BuiltInAgents.DEBUG_TRIAGE, REASON_DEBUG, agents);
        }
        if (containsAny(text, ARCH_KEYWORDS)) {
            return pick(BuiltInAgents.CODE_ARCH, REASON_ARCH, agents);
        }
        if (containsAny(text, CHANGE_VERBS) && containsAny(text, CODE_SCOPES)) {
            return pick(BuiltInAgents.CODE_CHANGE, REASON_EDIT, agents);
        }
        return pick(AgentPack.CHAT_QUICK, REASON_DEFAULT, agents);
    }

    /**
     * Decision for a session pinned to an existing agent.
     */
    public RoutingDecision pinned(AgentPack agent) {
        return new RoutingDecision(agent.getName(), agent.getTools(), REASON_PINNED);
    }

    private static RoutingDecision pick(String name, String reason, List<AgentPack> agents) {
        AgentPack agent = agents.stream()
                .filter(candidate -> candidate.getName().equals(name))
                .findFirst()
                .orElseGet(() -> agents.get(0));
        return new RoutingDecision(agent.getName(), agent.getTools(), reason);
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}

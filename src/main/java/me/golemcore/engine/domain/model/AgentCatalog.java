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

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of loaded agent packs plus the workspace prompt text.
 */
public record AgentCatalog(List<AgentPack> agents, String workspacePrompt) {

    public Optional<AgentPack> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return agents.stream()
                .filter(agent -> agent.getName().equals(name))
                .findFirst();
    }

    /**
     * Resolves a name to a pack, falling back to {@code chat.quick} and then to
     * the first pack.
     */
    public AgentPack resolve(String name) {
        return find(name)
                .or(() -> find(AgentPack.CHAT_QUICK))
                .orElseGet(() -> agents.get(0));
    }
}

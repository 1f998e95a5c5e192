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

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory chat session.
 *
 * <p>
 * Not thread-safe: sessions are only touched from the session owner thread of
 * {@link me.golemcore.engine.domain.service.SessionTable}.
 */
@Data
public class Session {

    private final String id;
    private final Instant createdAt;
    private SessionStatus status = SessionStatus.IDLE;
    private final List<Message> messages = new ArrayList<>();
    private final List<ToolCall> toolCalls = new ArrayList<>();
    private RoutingMode routingMode = RoutingMode.AUTO;
    private String agent;
    private String sessionPrompt;

    public Session(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public void appendMessage(Message message) {
        messages.add(message);
    }

    public List<Message> snapshotMessages() {
        return List.copyOf(messages);
    }
}

package me.golemcore.engine.adapter.inbound.web;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.exception.ProtocolException;
import me.golemcore.engine.domain.model.protocol.EngineCommand;
import me.golemcore.engine.domain.model.protocol.EngineEvent;
import me.golemcore.engine.domain.service.SessionProtocolEngine;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Reactive WebSocket endpoint for engine clients. Each text frame carries one
 * {@code {type, payload}} command; outbound frames are the events produced by
 * {@link SessionProtocolEngine}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineWebSocketHandler implements WebSocketHandler {

    private final WebSocketBroadcaster broadcaster;
    private final EngineCommandDecoder decoder;
    private final SessionProtocolEngine engine;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Client connected: connectionId={}", connectionId);

        Mono<Void> outbound = session.send(broadcaster.register(connectionId).map(session::textMessage));
        engine.onConnect(connectionId);

        Mono<Void> inbound = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(message -> handleIncoming(connectionId, message.getPayloadAsText()))
                .then()
                .doFinally(signal -> broadcaster.deregister(connectionId));

        return inbound.and(outbound)
                .doFinally(signal -> log.info("[WebSocket] Client disconnected: connectionId={}, signal={}",
                        connectionId, signal));
    }

    void handleIncoming(String connectionId, String payload) {
        EngineCommand command;
        try {
            command = decoder.decode(payload);
        } catch (ProtocolException e) {
            log.debug("[WebSocket] Rejected frame from {}: {}", connectionId, e.getMessage());
            broadcaster.send(connectionId, EngineEvent.ErrorReported.of(e.getMessage()));
            return;
        }
        try {
            engine.handle(connectionId, command);
        } catch (RuntimeException e) { // NOSONAR - one bad command must not close the socket
            log.error("[WebSocket] Failed to handle {} from {}", command.type(), connectionId, e);
            broadcaster.send(connectionId, EngineEvent.ErrorReported.of("Failed to handle " + command.type()
                    + ": " + e.getMessage()));
        }
    }
}

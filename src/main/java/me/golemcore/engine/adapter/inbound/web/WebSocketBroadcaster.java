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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.protocol.EngineEvent;
import me.golemcore.engine.port.outbound.EngineEventPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link EngineEventPort} backed by one outbound sink per WebSocket
 * connection. Emissions to a connection are serialized, so every client sees
 * events in the order they were produced.
 */
@Component
@Slf4j
public class WebSocketBroadcaster implements EngineEventPort {

    private final EngineEventEncoder encoder;
    private final Map<String, Sinks.Many<String>> connections = new ConcurrentHashMap<>();

    public WebSocketBroadcaster(EngineEventEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * Registers a connection and returns the stream of JSON frames to write to
     * it.
     */
    public Flux<String> register(String connectionId) {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        connections.put(connectionId, sink);
        return sink.asFlux();
    }

    public void deregister(String connectionId) {
        Sinks.Many<String> sink = connections.remove(connectionId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    public int connectionCount() {
        return connections.size();
    }

    @Override
    public void broadcast(EngineEvent event) {
        if (connections.isEmpty()) {
            return;
        }
        String json = encode(event);
        if (json == null) {
            return;
        }
        connections.forEach((connectionId, sink) -> emit(connectionId, sink, json));
    }

    @Override
    public void send(String connectionId, EngineEvent event) {
        Sinks.Many<String> sink = connections.get(connectionId);
        if (sink == null) {
            log.debug("[WebSocket] No active connection {}", connectionId);
            return;
        }
        String json = encode(event);
        if (json != null) {
            emit(connectionId, sink, json);
        }
    }

    private String encode(EngineEvent event) {
        try {
            return encoder.encode(event);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[WebSocket] Failed to serialize {} event: {}", event.type(), e.getMessage());
            return null;
        }
    }

    private static void emit(String connectionId, Sinks.Many<String> sink, String json) {
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(json);
        }
        if (result.isFailure()) {
            log.debug("[WebSocket] Dropped frame for {}: {}", connectionId, result);
        }
    }
}

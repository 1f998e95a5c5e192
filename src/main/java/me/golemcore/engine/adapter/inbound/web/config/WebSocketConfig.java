package me.golemcore.engine.adapter.inbound.web.config;

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
import me.golemcore.engine.adapter.inbound.web.EngineWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * WebFlux WebSocket configuration. Clients may upgrade on {@code /} or
 * {@code /ws}; plain HTTP requests fall through to the banner routes. The
 * mapping sits ahead of the router function mapping, which also claims
 * {@code GET /}.
 */
@Configuration
@RequiredArgsConstructor
public class WebSocketConfig {

    private final EngineWebSocketHandler engineWebSocketHandler;

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping() {
            @Override
            public Mono<Object> getHandlerInternal(ServerWebExchange exchange) {
                if (!isUpgrade(exchange)) {
                    return Mono.empty();
                }
                return super.getHandlerInternal(exchange);
            }
        };
        mapping.setUrlMap(Map.of("/", engineWebSocketHandler, "/ws", engineWebSocketHandler));
        mapping.setOrder(-2);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }

    static boolean isUpgrade(ServerWebExchange exchange) {
        String upgrade = exchange.getRequest().getHeaders().getFirst(HttpHeaders.UPGRADE);
        return upgrade != null && "websocket".equalsIgnoreCase(upgrade.trim());
    }
}

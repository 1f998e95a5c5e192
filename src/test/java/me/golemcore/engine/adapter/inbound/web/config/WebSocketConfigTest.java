package me.golemcore.engine.adapter.inbound.web.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSocketConfigTest {

    @Test
    void shouldDetectWebSocketUpgrade() {
        MockServerWebExchange upgrade = MockServerWebExchange.from(MockServerHttpRequest.get("/")
                .header("Upgrade", "WebSocket")
                .header("Connection", "Upgrade"));

        assertTrue(WebSocketConfig.isUpgrade(upgrade));
    }

    @Test
    void shouldTreatPlainRequestAsHttp() {
        assertFalse(WebSocketConfig.isUpgrade(MockServerWebExchange.from(MockServerHttpRequest.get("/"))));
        assertFalse(WebSocketConfig.isUpgrade(MockServerWebExchange.from(MockServerHttpRequest.get("/ws")
                .header("Upgrade", "h2c"))));
    }
}

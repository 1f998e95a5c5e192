package me.golemcore.engine.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.protocol.EngineEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WebSocketBroadcasterTest {

    private static final String CREATED = "{\"type\":\"session.created\",\"sessionId\":\"s1\"}";

    private WebSocketBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new WebSocketBroadcaster(new EngineEventEncoder(new ObjectMapper()));
    }

    @Test
    void shouldBroadcastToAllAndSendToOne() {
        Flux<String> first = broadcaster.register("a");
        Flux<String> second = broadcaster.register("b");
        assertEquals(2, broadcaster.connectionCount());

        broadcaster.broadcast(new EngineEvent.SessionCreated("s1"));
        broadcaster.send("a", EngineEvent.ErrorReported.of("only for a"));
        broadcaster.deregister("a");
        broadcaster.deregister("b");

        StepVerifier.create(first)
                .expectNext(CREATED)
                .expectNext("{\"type\":\"error\",\"error\":\"only for a\"}")
                .verifyComplete();
        StepVerifier.create(second)
                .expectNext(CREATED)
                .verifyComplete();
        assertEquals(0, broadcaster.connectionCount());
    }

    @Test
    void shouldIgnoreUnknownConnection() {
        Flux<String> stream = broadcaster.register("a");

        broadcaster.send("ghost", new EngineEvent.SessionCreated("s1"));
        broadcaster.deregister("ghost");
        broadcaster.deregister("a");

        StepVerifier.create(stream).verifyComplete();
    }

    @Test
    void shouldStopDeliveringAfterDeregister() {
        Flux<String> stream = broadcaster.register("a");
        broadcaster.deregister("a");

        broadcaster.broadcast(new EngineEvent.SessionCreated("s1"));

        StepVerifier.create(stream).verifyComplete();
    }
}

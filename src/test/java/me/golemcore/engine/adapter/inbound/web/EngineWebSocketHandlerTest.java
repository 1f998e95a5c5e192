package me.golemcore.engine.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.protocol.EngineCommand;
import me.golemcore.engine.domain.service.SessionProtocolEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EngineWebSocketHandlerTest {

    private WebSocketBroadcaster broadcaster;
    private SessionProtocolEngine engine;
    private EngineWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        broadcaster = new WebSocketBroadcaster(new EngineEventEncoder(objectMapper));
        engine = mock(SessionProtocolEngine.class);
        handler = new EngineWebSocketHandler(broadcaster, new EngineCommandDecoder(objectMapper), engine);
    }

    @Test
    void shouldDispatchCommandsAndReportProtocolErrors() {
        List<String> sent = new ArrayList<>();
        WebSocketSession session = mockSession(sent,
                textMessage("{broken"),
                textMessage("{\"type\":\"agent.list\"}"),
                textMessage("{\"type\":\"session.pause\"}"));

        StepVerifier.create(handler.handle(session))
                .verifyComplete();

        verify(engine).onConnect(anyString());
        verify(engine).handle(anyString(), eq(new EngineCommand.AgentList()));
        assertEquals(2, sent.size());
        assertTrue(sent.get(0).startsWith("{\"type\":\"error\",\"error\":\"Failed to parse message: "));
        assertEquals("{\"type\":\"error\",\"error\":\"Invalid command: unknown command type 'session.pause'\"}",
                sent.get(1));
        assertEquals(0, broadcaster.connectionCount());
    }

    @Test
    void shouldReportEngineFailureWithoutClosing() {
        doThrow(new IllegalStateException("boom")).when(engine).handle(anyString(), any());
        List<String> sent = new ArrayList<>();
        WebSocketSession session = mockSession(sent,
                textMessage("{\"type\":\"session.cancel\",\"payload\":{\"sessionId\":\"s1\"}}"),
                textMessage("{\"type\":\"agent.list\"}"));

        StepVerifier.create(handler.handle(session))
                .verifyComplete();

        assertEquals(List.of(
                "{\"type\":\"error\",\"error\":\"Failed to handle session.cancel: boom\"}",
                "{\"type\":\"error\",\"error\":\"Failed to handle agent.list: boom\"}"), sent);
    }

    @Test
    void shouldIgnoreBinaryFrames() {
        List<String> sent = new ArrayList<>();
        WebSocketMessage binary = mock(WebSocketMessage.class);
        when(binary.getType()).thenReturn(WebSocketMessage.Type.BINARY);
        WebSocketSession session = mockSession(sent, binary);

        StepVerifier.create(handler.handle(session))
                .verifyComplete();

        assertEquals(List.of(), sent);
    }

    private static WebSocketMessage textMessage(String payload) {
        WebSocketMessage message = mock(WebSocketMessage.class);
        when(message.getType()).thenReturn(WebSocketMessage.Type.TEXT);
        when(message.getPayloadAsText()).thenReturn(payload);
        return message;
    }

    private static WebSocketSession mockSession(List<String> sent, WebSocketMessage... inbound) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.receive()).thenReturn(Flux.just(inbound));
        when(session.textMessage(anyString())).thenAnswer(invocation -> {
            String payload = invocation.getArgument(0, String.class);
            WebSocketMessage message = mock(WebSocketMessage.class);
            when(message.getPayloadAsText()).thenReturn(payload);
            return message;
        });
        when(session.send(any(Publisher.class))).thenAnswer(invocation -> {
            @SuppressWarnings("unchecked")
            Publisher<WebSocketMessage> publisher = invocation.getArgument(0, Publisher.class);
            return Flux.from(publisher)
                    .doOnNext(message -> sent.add(message.getPayloadAsText()))
                    .then();
        });
        return session;
    }
}

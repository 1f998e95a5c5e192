package me.golemcore.engine.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.exception.ProtocolException;
import me.golemcore.engine.domain.model.RoutingMode;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.protocol.EngineCommand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineCommandDecoderTest {

    private final EngineCommandDecoder decoder = new EngineCommandDecoder(new ObjectMapper());

    @Test
    void shouldDecodeSessionCreateWithAndWithoutId() {
        assertEquals(new EngineCommand.SessionCreate("s1"),
                decoder.decode("{\"type\":\"session.create\",\"payload\":{\"sessionId\":\"s1\"}}"));
        assertEquals(new EngineCommand.SessionCreate(null), decoder.decode("{\"type\":\"session.create\"}"));
        assertEquals(new EngineCommand.SessionCreate(null),
                decoder.decode("{\"type\":\"session.create\",\"payload\":null}"));
    }

    @Test
    void shouldDecodeSendWithImages() {
        EngineCommand command = decoder.decode("{\"type\":\"session.send\",\"payload\":"
                + "{\"sessionId\":\"s1\",\"content\":\"look\",\"images\":[\"a.png\",\"b.jpg\"]}}");

        assertEquals(new EngineCommand.SessionSend("s1", "look", List.of("a.png", "b.jpg")), command);
    }

    @Test
    void shouldRequireSendContent() {
        ProtocolException error = assertThrows(ProtocolException.class,
                () -> decoder.decode("{\"type\":\"session.send\",\"payload\":{\"sessionId\":\"s1\"}}"));

        assertEquals("Invalid command: content must be a string", error.getMessage());
    }

    @Test
    void shouldRejectNonStringImages() {
        ProtocolException error = assertThrows(ProtocolException.class, () -> decoder.decode(
                "{\"type\":\"session.send\",\"payload\":{\"sessionId\":\"s1\",\"content\":\"x\",\"images\":[1]}}"));

        assertEquals("Invalid command: images must be an array of strings", error.getMessage());
    }

    @Test
    void shouldDistinguishAbsentAndNullConfigureFields() {
        EngineCommand.SessionConfigure clear = (EngineCommand.SessionConfigure) decoder.decode(
                "{\"type\":\"session.configure\",\"payload\":{\"sessionId\":\"s1\",\"agent\":null}}");
        EngineCommand.SessionConfigure pin = (EngineCommand.SessionConfigure) decoder.decode(
                "{\"type\":\"session.configure\",\"payload\":{\"sessionId\":\"s1\",\"routingMode\":\"pinned\","
                        + "\"agent\":\"code.arch\",\"sessionPrompt\":\"Be brief.\"}}");

        assertTrue(clear.agentProvided());
        assertNull(clear.agent());
        assertFalse(clear.sessionPromptProvided());
        assertNull(clear.routingMode());

        assertEquals(RoutingMode.PINNED, pin.routingMode());
        assertEquals("code.arch", pin.agent());
        assertEquals("Be brief.", pin.sessionPrompt());
    }

    @Test
    void shouldRejectUnknownRoutingMode() {
        ProtocolException error = assertThrows(ProtocolException.class, () -> decoder.decode(
                "{\"type\":\"session.configure\",\"payload\":{\"sessionId\":\"s1\",\"routingMode\":\"smart\"}}"));

        assertEquals("Invalid command: routingMode must be 'auto' or 'pinned'", error.getMessage());
    }

    @Test
    void shouldDecodeServiceCommands() {
        assertEquals(new EngineCommand.ServiceStart(ServiceName.MLX),
                decoder.decode("{\"type\":\"service.start\",\"payload\":{\"name\":\"mlx\"}}"));
        assertEquals(new EngineCommand.ServiceStop(ServiceName.KOKOMO),
                decoder.decode("{\"type\":\"service.stop\",\"payload\":{\"name\":\"kokomo\"}}"));
        assertEquals(new EngineCommand.ServiceStatusQuery(null), decoder.decode("{\"type\":\"service.status\"}"));
        assertEquals(new EngineCommand.AgentList(), decoder.decode("{\"type\":\"agent.list\",\"payload\":{}}"));
        assertEquals(new EngineCommand.SessionCancel("s1"),
                decoder.decode("{\"type\":\"session.cancel\",\"payload\":{\"sessionId\":\"s1\"}}"));
    }

    @Test
    void shouldRejectUnknownService() {
        ProtocolException error = assertThrows(ProtocolException.class,
                () -> decoder.decode("{\"type\":\"service.start\",\"payload\":{\"name\":\"whisper\"}}"));

        assertEquals("Invalid command: unknown service 'whisper'", error.getMessage());
    }

    @Test
    void shouldRejectUnknownFields() {
        ProtocolException inPayload = assertThrows(ProtocolException.class, () -> decoder.decode(
                "{\"type\":\"session.cancel\",\"payload\":{\"sessionId\":\"s1\",\"force\":true}}"));
        ProtocolException inEnvelope = assertThrows(ProtocolException.class,
                () -> decoder.decode("{\"type\":\"agent.list\",\"id\":3}"));

        assertEquals("Invalid command: unrecognized field 'force' in session.cancel", inPayload.getMessage());
        assertEquals("Invalid command: unrecognized field 'id' in command", inEnvelope.getMessage());
    }

    @Test
    void shouldRejectUnknownType() {
        ProtocolException error = assertThrows(ProtocolException.class,
                () -> decoder.decode("{\"type\":\"session.delete\"}"));

        assertEquals("Invalid command: unknown command type 'session.delete'", error.getMessage());
    }

    @Test
    void shouldRejectMalformedEnvelopes() {
        assertTrue(assertThrows(ProtocolException.class, () -> decoder.decode("{not json"))
                .getMessage().startsWith("Failed to parse message: "));
        assertEquals("Invalid command: expected a JSON object",
                assertThrows(ProtocolException.class, () -> decoder.decode("[1]")).getMessage());
        assertEquals("Invalid command: type must be a string",
                assertThrows(ProtocolException.class, () -> decoder.decode("{\"type\":5}")).getMessage());
        assertEquals("Invalid command: payload must be an object", assertThrows(ProtocolException.class,
                () -> decoder.decode("{\"type\":\"agent.list\",\"payload\":[]}")).getMessage());
    }
}

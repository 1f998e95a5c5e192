package me.golemcore.engine.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventStreamLineParserTest {

    private final EventStreamLineParser parser = new EventStreamLineParser(new ObjectMapper());

    @Test
    void shouldExtractDeltaContent() {
        assertEquals(Optional.of("Hi"),
                parser.parseDelta("data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}"));
    }

    @Test
    void shouldFallBackToMessageAndTextFields() {
        assertEquals(Optional.of("full"),
                parser.parseDelta("data:{\"choices\":[{\"message\":{\"content\":\"full\"}}]}"));
        assertEquals(Optional.of("legacy"),
                parser.parseDelta("data: {\"choices\":[{\"text\":\"legacy\"}]}"));
    }

    @Test
    void shouldIgnoreNonContentLines() {
        assertTrue(parser.parseDelta("data: [DONE]").isEmpty());
        assertTrue(parser.parseDelta(": keep-alive").isEmpty());
        assertTrue(parser.parseDelta("").isEmpty());
        assertTrue(parser.parseDelta(null).isEmpty());
        assertTrue(parser.parseDelta("event: message").isEmpty());
        assertTrue(parser.parseDelta("data: {not json").isEmpty());
        assertTrue(parser.parseDelta("data: {\"choices\":[{\"delta\":{\"content\":\"\"}}]}").isEmpty());
    }

    @Test
    void shouldReadModelWithFallback() {
        assertEquals("served", parser.parseModel("data: {\"model\":\"served\",\"choices\":[]}", "requested"));
        assertEquals("requested", parser.parseModel("data: {\"choices\":[]}", "requested"));
        assertEquals("requested", parser.parseModel("data: {broken", "requested"));
    }
}

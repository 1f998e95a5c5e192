package me.golemcore.engine.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.tools.TimeNowTool;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallProtocolTest {

    private final ToolCallProtocol protocol = new ToolCallProtocol(new ObjectMapper());
    private final ToolComponent timeNow = new TimeNowTool(Clock.systemUTC());
    private final Map<String, ToolComponent> allowed = Map.of(ToolNames.TIME_NOW, timeNow);

    @Test
    void shouldParseFirstCallLine() {
        String text = "Let me check.\n  TOOL_CALL: {\"name\":\"time.now\",\"args\":{}}\n"
                + "TOOL_CALL: {\"name\":\"other\"}";

        Optional<ToolCallProtocol.ParsedCall> parsed = protocol.parse(text, allowed);

        assertTrue(parsed.isPresent());
        assertSame(timeNow, parsed.get().tool());
        assertEquals(Map.of(), parsed.get().arguments());
    }

    @Test
    void shouldIgnoreTextWithoutCallLine() {
        assertFalse(protocol.parse("Just an answer.", allowed).isPresent());
        assertFalse(protocol.parse(null, allowed).isPresent());
    }

    @Test
    void shouldIgnoreMalformedJson() {
        assertFalse(protocol.parse("TOOL_CALL: {\"name\":", allowed).isPresent());
        assertFalse(protocol.parse("TOOL_CALL: [1,2]", allowed).isPresent());
        assertFalse(protocol.parse("TOOL_CALL: {\"args\":{}}", allowed).isPresent());
    }

    @Test
    void shouldIgnoreToolsOutsideAllowList() {
        assertFalse(protocol.parse("TOOL_CALL: {\"name\":\"fs.read\",\"args\":{\"path\":\"a\"}}", allowed)
                .isPresent());
    }

    @Test
    void shouldIgnoreWrongArgumentShape() {
        assertFalse(protocol.parse("TOOL_CALL: {\"name\":\"time.now\",\"args\":\"now\"}", allowed).isPresent());
    }

    @Test
    void shouldFormatSuccessAndFailureResults() {
        Map<String, Object> ok = protocol.outcome(ToolResult.success(Map.of("iso", "t")));
        Map<String, Object> failed = protocol.outcome(ToolResult.failure("boom"));

        assertEquals("TOOL_RESULT: {\"name\":\"time.now\",\"ok\":true,\"result\":{\"iso\":\"t\"}}",
                protocol.formatResult("time.now", ok));
        assertEquals("TOOL_RESULT: {\"name\":\"fs.read\",\"ok\":false,\"error\":\"boom\"}",
                protocol.formatResult("fs.read", failed));
    }

    @Test
    void shouldStripProtocolLines() {
        String text = "Answer line\nTOOL_CALL: {\"name\":\"x\"}\n  TOOL_RESULT: {}\nsecond line\n";

        assertEquals("Answer line\nsecond line", ToolCallProtocol.strip(text));
        assertEquals("", ToolCallProtocol.strip(null));
    }

    @Test
    void shouldListToolsInCatalogPrompt() {
        String prompt = ToolCallProtocol.catalogPrompt(List.of(ToolDefinition.builder()
                .name("time.now")
                .argsExample("{}")
                .returns("{ iso, epochMs }")
                .build()));

        assertTrue(prompt.contains("TOOL_CALL: {\"name\":\"...\",\"args\":{...}}"));
        assertTrue(prompt.contains("- time.now args={} -> { iso, epochMs }"));
    }
}

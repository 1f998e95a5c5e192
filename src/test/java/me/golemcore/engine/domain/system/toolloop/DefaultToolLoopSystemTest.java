package me.golemcore.engine.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.LlmMessage;
import me.golemcore.engine.domain.model.LlmOptions;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolCall;
import me.golemcore.engine.domain.model.ToolCallStatus;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.port.outbound.LlmPort;
import me.golemcore.engine.tools.TimeNowTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultToolLoopSystemTest {

    private static final String TIME_CALL = "TOOL_CALL: {\"name\":\"time.now\",\"args\":{}}";

    private ScriptedLlm llm;
    private DefaultToolLoopSystem toolLoop;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlm();
        TimeNowTool timeNow = new TimeNowTool(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
        toolLoop = new DefaultToolLoopSystem(llm, List.of(timeNow), new ObjectMapper());
        listener = new RecordingListener();
    }

    @Test
    void shouldExecuteToolAndFeedResultBack() {
        llm.answers.add("Checking the clock.\n" + TIME_CALL);
        llm.answers.add("It is midnight.");

        ToolLoopResult result = toolLoop.run(request(agent(2, 10)), listener);

        assertEquals("It is midnight.", result.content());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());

        assertEquals(1, listener.calls.size());
        ToolCall call = listener.calls.get(0);
        assertEquals(ToolNames.TIME_NOW, call.getName());
        assertEquals(ToolCallStatus.RUNNING, call.getStatus());
        assertEquals(Boolean.TRUE, listener.results.get(call.getId()).get("ok"));

        List<LlmMessage> second = llm.requests.get(1);
        LlmMessage assistantTurn = second.get(second.size() - 2);
        LlmMessage resultLine = second.get(second.size() - 1);
        assertEquals(Message.ROLE_ASSISTANT, assistantTurn.getRole());
        assertEquals(Message.ROLE_SYSTEM, resultLine.getRole());
        assertTrue(resultLine.getContent().startsWith("TOOL_RESULT: {\"name\":\"time.now\",\"ok\":true"));
        assertTrue(resultLine.getContent().contains("2026-01-01T00:00:00Z"));
    }

    @Test
    void shouldSendAgentPromptThenCatalogThenHistoryWindow() {
        llm.answers.add("Done.");
        List<Message> transcript = List.of(
                message(Message.ROLE_USER, "first"),
                message(Message.ROLE_ASSISTANT, "first answer"),
                message(Message.ROLE_SYSTEM, "note"),
                message(Message.ROLE_USER, "second"),
                message(Message.ROLE_ASSISTANT, "second answer"),
                message(Message.ROLE_USER, "third"));

        toolLoop.run(new ToolLoopRequest("  Agent prompt  ", transcript, agent(1, 1), null), listener);

        List<LlmMessage> sent = llm.requests.get(0);
        assertEquals(4, sent.size());
        assertEquals("Agent prompt", sent.get(0).getContent());
        assertTrue(sent.get(1).getContent().contains("- time.now args={}"));
        assertEquals("second answer", sent.get(2).getContent());
        assertEquals("third", sent.get(3).getContent());
    }

    @Test
    void shouldUseAgentTemperatureWhenRequestHasNone() {
        llm.answers.add("ok");

        toolLoop.run(request(agent(0, 10)), listener);

        assertEquals(0.3, llm.options.get(0).getTemperature());
    }

    @Test
    void shouldStopAtToolBudget() {
        llm.answers.add(TIME_CALL);
        llm.answers.add("Still checking\n" + TIME_CALL);
        llm.answers.add("never requested");

        ToolLoopResult result = toolLoop.run(request(agent(1, 10)), listener);

        assertEquals("Still checking", result.content());
        assertEquals(2, result.llmCalls());
        assertEquals(2, result.toolExecutions());
        assertEquals(1, llm.answers.size());
    }

    @Test
    void shouldAnswerNoResponseWhenBudgetEndsOnBareCall() {
        llm.answers.add(TIME_CALL);

        ToolLoopResult result = toolLoop.run(request(agent(0, 10)), listener);

        assertEquals(DefaultToolLoopSystem.NO_RESPONSE, result.content());
        assertEquals(1, result.llmCalls());
    }

    @Test
    void shouldTreatCallOfDisallowedToolAsText() {
        llm.answers.add("TOOL_CALL: {\"name\":\"fs.read\",\"args\":{\"path\":\"README.md\"}}");

        ToolLoopResult result = toolLoop.run(request(agent(3, 10)), listener);

        assertEquals(DefaultToolLoopSystem.EMPTY_ANSWER, result.content());
        assertEquals(0, result.toolExecutions());
        assertTrue(listener.calls.isEmpty());
    }

    @Test
    void shouldPropagateModelFailure() {
        llm.failure = new IllegalStateException("backend down");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> toolLoop.run(request(agent(1, 10)), listener));
        assertEquals("backend down", error.getMessage());
    }

    private static ToolLoopRequest request(AgentPack agent) {
        return new ToolLoopRequest("system", List.of(message(Message.ROLE_USER, "what time is it?")), agent,
                LlmOptions.defaults());
    }

    private static AgentPack agent(int maxToolCalls, int maxHistoryTurns) {
        return AgentPack.builder()
                .name("tool.test")
                .prompt("test")
                .tools(List.of(ToolNames.TIME_NOW))
                .maxToolCalls(maxToolCalls)
                .maxHistoryTurns(maxHistoryTurns)
                .temperature(0.3)
                .build();
    }

    private static Message message(String role, String content) {
        return Message.builder().id(content).role(role).content(content).timestamp(Instant.EPOCH).build();
    }

    private static final class ScriptedLlm implements LlmPort {
        private final Deque<String> answers = new ArrayDeque<>();
        private final List<List<LlmMessage>> requests = new ArrayList<>();
        private final List<LlmOptions> options = new ArrayList<>();
        private RuntimeException failure;

        @Override
        public CompletableFuture<ChatCompletion> complete(List<LlmMessage> messages, LlmOptions llmOptions) {
            requests.add(List.copyOf(messages));
            options.add(llmOptions);
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture(new ChatCompletion("test-model", answers.removeFirst()));
        }

        @Override
        public CompletableFuture<ChatCompletion> completeStreaming(List<LlmMessage> messages,
                Consumer<String> onToken, LlmOptions llmOptions) {
            throw new UnsupportedOperationException();
        }
    }

    private static final class RecordingListener implements ToolLoopListener {
        private final List<ToolCall> calls = new ArrayList<>();
        private final Map<String, Map<String, Object>> results = new HashMap<>();

        @Override
        public void onToolCall(ToolCall call) {
            calls.add(call);
        }

        @Override
        public void onToolResult(String toolId, Map<String, Object> result) {
            results.put(toolId, result);
        }
    }
}

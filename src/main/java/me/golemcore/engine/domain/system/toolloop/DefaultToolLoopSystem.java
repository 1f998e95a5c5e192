package me.golemcore.engine.domain.system.toolloop;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.LlmMessage;
import me.golemcore.engine.domain.model.LlmOptions;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolCall;
import me.golemcore.engine.domain.model.ToolCallStatus;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Sends at most {@code maxToolCalls + 1} buffered completions. Each answer
 * containing a valid tool call is executed, and the assistant turn plus a
 * {@code TOOL_RESULT:} system line are appended to the request transcript.
 * The first answer without a valid call is the final text.
 */
@Component
@Slf4j
public class DefaultToolLoopSystem implements ToolLoopSystem {

    static final String EMPTY_ANSWER = "…";
    static final String NO_RESPONSE = "No response.";

    private final LlmPort llmPort;
    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final ToolCallProtocol protocol;

    public DefaultToolLoopSystem(LlmPort llmPort, List<ToolComponent> toolComponents, ObjectMapper objectMapper) {
        this.llmPort = llmPort;
        for (ToolComponent tool : toolComponents) {
            tools.put(tool.getToolName(), tool);
        }
        this.protocol = new ToolCallProtocol(objectMapper);
    }

    @Override
    public ToolLoopResult run(ToolLoopRequest request, ToolLoopListener listener) {
        AgentPack agent = request.agent();
        Map<String, ToolComponent> allowed = allowedTools(agent);
        List<LlmMessage> messages = buildMessages(request, allowed);
        LlmOptions options = request.options().toBuilder()
                .temperature(request.options().getTemperature() != null
                        ? request.options().getTemperature()
                        : agent.getTemperature())
                .build();

        int maxRequests = Math.max(0, agent.getMaxToolCalls()) + 1;
        int llmCalls = 0;
        int toolExecutions = 0;
        String lastAnswer = "";

        while (llmCalls < maxRequests) {
            ChatCompletion completion = join(llmPort.complete(messages, options));
            llmCalls++;
            lastAnswer = completion.content();

            Optional<ToolCallProtocol.ParsedCall> parsed = protocol.parse(lastAnswer, allowed);
            if (parsed.isEmpty()) {
                String cleaned = ToolCallProtocol.strip(lastAnswer);
                log.debug("[ToolLoop] {} finished after {} LLM calls, {} tools", agent.getName(), llmCalls,
                        toolExecutions);
                return new ToolLoopResult(cleaned.isEmpty() ? EMPTY_ANSWER : cleaned, llmCalls, toolExecutions);
            }

            ToolComponent tool = parsed.get().tool();
            ToolCall call = ToolCall.builder()
                    .id(UUID.randomUUID().toString())
                    .name(tool.getToolName())
                    .args(parsed.get().arguments())
                    .status(ToolCallStatus.RUNNING)
                    .build();
            listener.onToolCall(call);

            Map<String, Object> outcome = protocol.outcome(execute(tool, parsed.get().arguments()));
            toolExecutions++;
            listener.onToolResult(call.getId(), outcome);

            messages.add(LlmMessage.assistant(lastAnswer));
            messages.add(LlmMessage.system(protocol.formatResult(tool.getToolName(), outcome)));
        }

        log.debug("[ToolLoop] {} exhausted its budget of {} tool calls", agent.getName(), agent.getMaxToolCalls());
        String cleaned = ToolCallProtocol.strip(lastAnswer);
        return new ToolLoopResult(cleaned.isEmpty() ? NO_RESPONSE : cleaned, llmCalls, toolExecutions);
    }

    private Map<String, ToolComponent> allowedTools(AgentPack agent) {
        Map<String, ToolComponent> allowed = new LinkedHashMap<>();
        if (agent.getTools() != null) {
            for (String name : agent.getTools()) {
                ToolComponent tool = tools.get(name);
                if (tool != null) {
                    allowed.put(name, tool);
                }
            }
        }
        return allowed;
    }

    private List<LlmMessage> buildMessages(ToolLoopRequest request, Map<String, ToolComponent> allowed) {
        List<LlmMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(LlmMessage.system(request.systemPrompt().trim()));
        }
        List<ToolDefinition> definitions = allowed.values().stream()
                .map(ToolComponent::getDefinition)
                .toList();
        messages.add(LlmMessage.system(ToolCallProtocol.catalogPrompt(definitions)));

        List<Message> history = request.transcript().stream()
                .filter(Message::isConversational)
                .toList();
        int window = Math.max(0, request.agent().getMaxHistoryTurns()) * 2;
        for (Message message : history.subList(Math.max(0, history.size() - window), history.size())) {
            messages.add(LlmMessage.builder().role(message.getRole()).content(message.getContent()).build());
        }
        return messages;
    }

    private ToolResult execute(ToolComponent tool, Map<String, Object> arguments) {
        try {
            ToolResult result = tool.execute(arguments).join();
            return result != null ? result : ToolResult.failure("tool returned no result");
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[ToolLoop] {} failed: {}", tool.getToolName(), cause.getMessage());
            return ToolResult.failure(String.valueOf(cause.getMessage()));
        } catch (RuntimeException e) { // NOSONAR - tool failures are reported to the model
            log.warn("[ToolLoop] {} failed: {}", tool.getToolName(), e.getMessage());
            return ToolResult.failure(String.valueOf(e.getMessage()));
        }
    }

    private static ChatCompletion join(CompletableFuture<ChatCompletion> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}

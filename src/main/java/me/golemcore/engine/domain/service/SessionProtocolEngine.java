package me.golemcore.engine.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentCatalog;
import me.golemcore.engine.domain.model.AgentPack;
import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.LlmMessage;
import me.golemcore.engine.domain.model.LlmOptions;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.RoutingDecision;
import me.golemcore.engine.domain.model.RoutingMode;
import me.golemcore.engine.domain.model.ServiceEvent;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ServiceState;
import me.golemcore.engine.domain.model.ServiceStatus;
import me.golemcore.engine.domain.model.Session;
import me.golemcore.engine.domain.model.SessionStatus;
import me.golemcore.engine.domain.model.ToolCall;
import me.golemcore.engine.domain.model.ToolCallStatus;
import me.golemcore.engine.domain.model.protocol.EngineCommand;
import me.golemcore.engine.domain.model.protocol.EngineEvent;
import me.golemcore.engine.domain.system.toolloop.ToolCallProtocol;
import me.golemcore.engine.domain.system.toolloop.ToolLoopListener;
import me.golemcore.engine.domain.system.toolloop.ToolLoopRequest;
import me.golemcore.engine.domain.system.toolloop.ToolLoopResult;
import me.golemcore.engine.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.EngineEventPort;
import me.golemcore.engine.port.outbound.LlmPort;
import me.golemcore.engine.routing.HeuristicAgentRouter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Executes protocol commands against the session table and pushes the
 * resulting events to clients.
 *
 * <p>
 * A {@code session.send} runs in two phases. The admission phase runs on the
 * session owner thread: it rejects busy sessions, records the user message and
 * flips the session to {@code thinking}. The answer phase runs on a worker
 * thread and picks one of these paths:
 * <ul>
 * <li>vision: image attachments go to the vlm backend</li>
 * <li>quick: short chat answers streamed token by token from mlx, optionally
 * extended by a follow-up completion</li>
 * <li>agent: the tool-call loop with the routed agent's tools</li>
 * <li>fallback: a canned reply explaining how to start a backend</li>
 * </ul>
 * Every path finishes with exactly one {@code assistant.message} and an
 * {@code idle} status, whatever failed along the way.
 */
@Service
@Slf4j
public class SessionProtocolEngine {

    static final String FOLLOWUP_INSTRUCTION = "Continue with a bit more useful detail. Do not repeat the previous response.";
    static final String DETAIL_THINKING = "Thinking...";
    static final String DETAIL_READY = "Ready";
    static final String DETAIL_SESSION_READY = "Session ready";
    static final String DETAIL_CANCELLED = "Cancelled";

    private static final String MODE_STREAM = "stream";
    private static final String MODE_FOLLOWUP = "followup";
    private static final String MODE_VLM = "vlm";
    private static final String METRIC_TTFB = "llm.ttfb";
    private static final String METRIC_LLM_TOTAL = "llm.total";
    private static final String METRIC_AGENT_TOTAL = "agent.total";

    private final SessionTable sessionTable;
    private final EngineEventPort events;
    private final ServiceSupervisor supervisor;
    private final LlmPort llmPort;
    private final AgentCatalogCache catalogCache;
    private final HeuristicAgentRouter router;
    private final PromptStackService promptStack;
    private final ToolLoopSystem toolLoop;
    private final WorkbenchService workbench;
    private final EngineExecutors executors;
    private final EngineProperties properties;
    private final WorkspacePaths paths;
    private final Clock clock;

    private Runnable serviceSubscription;

    public SessionProtocolEngine(SessionTable sessionTable, EngineEventPort events, ServiceSupervisor supervisor,
            LlmPort llmPort, AgentCatalogCache catalogCache, HeuristicAgentRouter router,
            PromptStackService promptStack, ToolLoopSystem toolLoop, WorkbenchService workbench,
            EngineExecutors executors, EngineProperties properties, WorkspacePaths paths, Clock clock) {
        this.sessionTable = sessionTable;
        this.events = events;
        this.supervisor = supervisor;
        this.llmPort = llmPort;
        this.catalogCache = catalogCache;
        this.router = router;
        this.promptStack = promptStack;
        this.toolLoop = toolLoop;
        this.workbench = workbench;
        this.executors = executors;
        this.properties = properties;
        this.paths = paths;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        serviceSubscription = supervisor.addListener(this::onServiceEvent);
    }

    @PreDestroy
    public void destroy() {
        if (serviceSubscription != null) {
            serviceSubscription.run();
        }
    }

    /**
     * Replays every backend that has something to report to a newly connected
     * client.
     */
    public void onConnect(String connectionId) {
        for (ServiceState state : supervisor.listStates()) {
            if (!state.isQuiet()) {
                events.send(connectionId, new EngineEvent.ServiceStatusChanged(state));
            }
        }
    }

    public void handle(String connectionId, EngineCommand command) {
        log.debug("[Engine] {} from {}", command.type(), connectionId);
        if (command instanceof EngineCommand.SessionCreate create) {
            createSession(create);
        } else if (command instanceof EngineCommand.SessionSend send) {
            send(connectionId, send);
        } else if (command instanceof EngineCommand.SessionConfigure configure) {
            configure(configure);
        } else if (command instanceof EngineCommand.SessionCancel cancel) {
            cancel(cancel);
        } else if (command instanceof EngineCommand.AgentList) {
            listAgents(connectionId);
        } else if (command instanceof EngineCommand.ServiceStart start) {
            reportFailure(connectionId, supervisor.start(start.name()));
        } else if (command instanceof EngineCommand.ServiceStop stop) {
            reportFailure(connectionId, supervisor.stop(stop.name()));
        } else if (command instanceof EngineCommand.ServiceStatusQuery query) {
            reportStatus(connectionId, query.name());
        }
    }

    // ==================== SESSION COMMANDS ====================

    private void createSession(EngineCommand.SessionCreate create) {
        String id = hasText(create.sessionId()) ? create.sessionId() : UUID.randomUUID().toString();
        submitLogged("create", sessions -> {
            sessions.create(id);
            events.broadcast(new EngineEvent.SessionCreated(id));
            events.broadcast(new EngineEvent.SessionStatusChanged(id, SessionStatus.IDLE, DETAIL_SESSION_READY));
        });
    }

    private void configure(EngineCommand.SessionConfigure configure) {
        submitLogged("configure", sessions -> {
            Session session = sessions.getOrCreate(configure.sessionId());
            if (configure.routingMode() != null) {
                session.setRoutingMode(configure.routingMode());
            }
            if (configure.agentProvided()) {
                session.setAgent(hasText(configure.agent()) ? configure.agent().trim() : null);
            }
            if (configure.sessionPromptProvided()) {
                session.setSessionPrompt(configure.sessionPrompt());
            }
            String detail = "Configured (" + session.getRoutingMode().getValue()
                    + (session.getAgent() != null ? ": " + session.getAgent() : "") + ")";
            events.broadcast(new EngineEvent.SessionStatusChanged(session.getId(), session.getStatus(), detail));
        });
    }

    /**
     * Marks the session idle. A running answer is not interrupted; its events
     * still arrive and the follow-up stream stops once a new message lands.
     */
    private void cancel(EngineCommand.SessionCancel cancel) {
        submitLogged("cancel", sessions -> sessions.find(cancel.sessionId()).ifPresent(session -> {
            session.setStatus(SessionStatus.IDLE);
            events.broadcast(new EngineEvent.SessionStatusChanged(session.getId(), SessionStatus.IDLE,
                    DETAIL_CANCELLED));
        }));
    }

    private void listAgents(String connectionId) {
        List<EngineEvent.AgentSummary> agents = catalogCache.get().agents().stream()
                .map(agent -> new EngineEvent.AgentSummary(agent.getName(), agent.getDescription(),
                        agent.getTools()))
                .toList();
        events.send(connectionId, new EngineEvent.AgentListed(agents));
    }

    private void send(String connectionId, EngineCommand.SessionSend send) {
        String id = send.sessionId();
        List<String> imagePaths = send.images().stream()
                .filter(SessionProtocolEngine::hasText)
                .toList();
        String attachmentLines = imagePaths.stream()
                .map(image -> "[image] " + ImageAttachments.fileName(image))
                .collect(Collectors.joining("\n"));
        String content = send.content() != null ? send.content() : "";
        String userContent = (content + (attachmentLines.isEmpty() ? "" : "\n" + attachmentLines)).trim();

        sessionTable.submit(sessions -> {
            Session session = sessions.getOrCreate(id);
            if (session.getStatus().isBusy()) {
                events.send(connectionId, new EngineEvent.ErrorReported(id, "Session " + id + " is busy"));
                return null;
            }
            session.appendMessage(Message.builder()
                    .id(UUID.randomUUID().toString())
                    .role(Message.ROLE_USER)
                    .content(userContent)
                    .timestamp(clock.instant())
                    .build());
            session.setStatus(SessionStatus.THINKING);
            events.broadcast(new EngineEvent.SessionStatusChanged(id, SessionStatus.THINKING, DETAIL_THINKING));
            return new Turn(id, content, imagePaths, session.getRoutingMode(), session.getAgent(),
                    session.getSessionPrompt(), session.snapshotMessages());
        }).thenAcceptAsync(turn -> {
            if (turn != null) {
                answer(turn);
            }
        }, executors.worker()).exceptionally(e -> {
            log.error("[Engine] Failed to process message for session {}", id, e);
            return null;
        });
    }

    // ==================== ANSWER PIPELINE ====================

    /**
     * Snapshot of the session taken when the message was admitted.
     */
    record Turn(String sessionId, String content, List<String> imagePaths, RoutingMode routingMode,
            String pinnedAgent, String sessionPrompt, List<Message> transcript) {
    }

    private record Followup(String system, AgentPack agent) {
    }

    /**
     * Mutable result of one answer; filled in by whichever path runs.
     */
    private static final class Outcome {
        private String text = "";
        private boolean streamed;
        private Followup followup;
        private WorkbenchService.Plan workbenchPlan;
    }

    void answer(Turn turn) {
        Outcome outcome = new Outcome();
        try {
            produce(turn, outcome);
        } catch (RuntimeException e) { // NOSONAR - the session must always finish
            log.error("[Engine] Unexpected failure answering session {}", turn.sessionId(), e);
            outcome.text = "Internal error: " + messageOf(e);
            outcome.streamed = false;
            outcome.followup = null;
            outcome.workbenchPlan = null;
        }

        String text = outcome.text != null ? outcome.text : "";
        if (!outcome.streamed) {
            for (String token : TextChunker.chunks(text)) {
                events.broadcast(new EngineEvent.AssistantToken(turn.sessionId(), token));
            }
        }
        if (outcome.followup != null && !text.isBlank()) {
            text = followUp(turn, outcome.followup, text);
        }
        finish(turn.sessionId(), text);

        if (outcome.workbenchPlan != null && outcome.followup == null) {
            workbench.schedule(outcome.workbenchPlan);
        }
    }

    private void produce(Turn turn, Outcome outcome) {
        List<String> imageUrls = new ArrayList<>();
        String forced = null;
        if (!turn.imagePaths().isEmpty()) {
            try {
                for (String image : turn.imagePaths()) {
                    imageUrls.add(ImageAttachments.toDataUrl(resolveImage(image)));
                }
            } catch (IOException e) {
                imageUrls.clear();
                forced = "Image attachment failed: " + e.getMessage();
            }
        }

        if (!imageUrls.isEmpty()) {
            outcome.text = answerWithVision(turn, imageUrls);
        } else if (forced == null) {
            answerWithText(turn, outcome);
        }
        if (forced != null) {
            outcome.text = forced;
            outcome.streamed = false;
        }
    }

    private void finish(String sessionId, String text) {
        sessionTable.run(sessions -> {
            Session session = sessions.getOrCreate(sessionId);
            String messageId = UUID.randomUUID().toString();
            session.appendMessage(Message.builder()
                    .id(messageId)
                    .role(Message.ROLE_ASSISTANT)
                    .content(text)
                    .timestamp(clock.instant())
                    .build());
            session.setStatus(SessionStatus.IDLE);
            events.broadcast(new EngineEvent.AssistantMessage(sessionId, messageId, text));
            events.broadcast(new EngineEvent.SessionStatusChanged(sessionId, SessionStatus.IDLE, DETAIL_READY));
        });
    }

    // ==================== VISION PATH ====================

    private String answerWithVision(Turn turn, List<String> imageUrls) {
        ensureBackend(ServiceName.VLM, false);
        boolean useVlm = isRunning(ServiceName.VLM) || supervisor.isHealthy(ServiceName.VLM);
        if (!useVlm) {
            return "Image input requires the VLM service.\n\n" + fixHint(ServiceName.VLM);
        }
        try {
            updateStatus(turn.sessionId(), SessionStatus.STREAMING, "Vision (vlm)...");
            AgentCatalog catalog = catalogCache.get();
            AgentPack agent = catalog.resolve(AgentPack.CHAT_QUICK);
            String system = promptStack.composeSystemPrompt(agent, catalog.workspacePrompt(), turn.sessionPrompt());
            String prompt = hasText(turn.content()) ? turn.content().trim() : properties.getVlm().getDefaultPrompt();

            List<LlmMessage> messages = new ArrayList<>();
            if (hasText(system)) {
                messages.add(LlmMessage.system(system));
            }
            messages.add(LlmMessage.builder()
                    .role(Message.ROLE_USER)
                    .content(prompt)
                    .imageUrls(imageUrls)
                    .build());

            long started = clock.millis();
            ChatCompletion out = join(llmPort.complete(messages, vlmOptions()));
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("mode", MODE_VLM);
            meta.put("model", out.model());
            meta.put("images", imageUrls.size());
            perf(turn.sessionId(), METRIC_LLM_TOTAL, clock.millis() - started, meta);
            return out.content();
        } catch (RuntimeException e) { // NOSONAR - surfaced as the answer
            log.warn("[Engine] VLM request failed: {}", messageOf(e));
            return "VLM request failed: " + messageOf(e);
        }
    }

    private LlmOptions vlmOptions() {
        EngineProperties.VlmProperties vlm = properties.getVlm();
        String baseUrl = hasText(vlm.getBaseUrl()) ? vlm.getBaseUrl()
                : supervisor.launchConfig(ServiceName.VLM).baseUrl();
        return LlmOptions.builder()
                .baseUrl(baseUrl)
                .model(vlm.getModel())
                .timeoutMs(vlm.getTimeoutMs())
                .maxTokens(vlm.getMaxTokens())
                .temperature(vlm.getTemperature())
                .build();
    }

    // ==================== TEXT PATH ====================

    private void answerWithText(Turn turn, Outcome outcome) {
        boolean prefersMlx = properties.getLlm().isPreferLocal();
        ensureBackend(ServiceName.MLX, prefersMlx);
        boolean useMlx = prefersMlx || isRunning(ServiceName.MLX) || supervisor.isHealthy(ServiceName.MLX);
        if (!useMlx) {
            outcome.text = noLlmReply(turn.content());
            return;
        }

        try {
            long routeStarted = clock.millis();
            AgentCatalog catalog = catalogCache.get();
            Optional<AgentPack> pinned = turn.routingMode() == RoutingMode.PINNED && hasText(turn.pinnedAgent())
                    ? catalog.find(turn.pinnedAgent().trim())
                    : Optional.empty();
            RoutingDecision decision = pinned.map(router::pinned)
                    .orElseGet(() -> router.route(turn.content(), catalog.agents()));
            AgentPack selected = catalog.resolve(decision.agent());
            events.broadcast(new EngineEvent.RouterDecision(turn.sessionId(),
                    pinned.isPresent() ? RoutingMode.PINNED : RoutingMode.AUTO, selected.getName(),
                    selected.getTools(), decision.reason(), clock.millis() - routeStarted));

            String system = promptStack.composeSystemPrompt(selected, catalog.workspacePrompt(),
                    turn.sessionPrompt());
            boolean quick = AgentPack.CHAT_QUICK.equals(selected.getName())
                    || (!selected.hasTools() && isSimpleMessage(turn.content()));
            if (quick) {
                answerQuick(turn, selected, system, outcome);
            } else {
                outcome.text = answerWithAgent(turn, selected, system);
            }
        } catch (RuntimeException e) { // NOSONAR - surfaced as the answer
            log.warn("[Engine] Local LLM failed: {}", messageOf(e));
            outcome.text = "Local MLX LLM failed.\n\n" + messageOf(e) + "\n\n" + fixHint(ServiceName.MLX);
            outcome.followup = null;
            outcome.workbenchPlan = null;
        }
    }

    private void answerQuick(Turn turn, AgentPack selected, String system, Outcome outcome) {
        updateStatus(turn.sessionId(), SessionStatus.STREAMING, "Local LLM (" + selected.getName() + ")...");
        EngineProperties.QuickProperties quick = properties.getQuick();
        String quickSystem = PromptStackService.join(system, QuickOutputSanitizer.QUICK_OUTPUT_GUIDANCE);
        List<LlmMessage> messages = promptStack.buildChatMessages(quickSystem, turn.transcript(),
                selected.getMaxHistoryTurns());
        LlmOptions options = LlmOptions.builder()
                .baseUrl(quick.getBaseUrl())
                .model(quick.getModel())
                .maxTokens(quick.getMaxTokens())
                .temperature(firstNonNull(quick.getTemperature(), selected.getTemperature(),
                        properties.getLlm().getTemperature()))
                .build();

        long started = clock.millis();
        TokenRelay relay = new TokenRelay(turn.sessionId(), selected.getName(), MODE_STREAM, started, () -> true);
        outcome.streamed = true;
        ChatCompletion streamed;
        try {
            streamed = join(llmPort.completeStreaming(messages, relay, options));
        } catch (RuntimeException e) {
            outcome.streamed = relay.count > 0;
            throw e;
        }
        String text = QuickOutputSanitizer.sanitize(streamed.content());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("agent", selected.getName());
        meta.put("mode", MODE_STREAM);
        meta.put("tokens", relay.count);
        meta.put("model", streamed.model());
        perf(turn.sessionId(), METRIC_LLM_TOTAL, clock.millis() - started, meta);
        outcome.text = text;

        if (workbench.isEnabled()) {
            outcome.workbenchPlan = new WorkbenchService.Plan(turn.sessionId(), quickSystem, selected.getName(),
                    text, streamed.model(), turn.transcript());
        }
        EngineProperties.FollowupProperties followup = properties.getFollowup();
        if (AgentPack.CHAT_QUICK.equals(selected.getName())
                && followup.isEnabled()
                && turn.content().trim().length() >= followup.getMinPromptChars()
                && text.trim().length() < followup.getMinChars()) {
            outcome.followup = new Followup(quickSystem, selected);
        }
    }

    private String answerWithAgent(Turn turn, AgentPack selected, String system) {
        updateStatus(turn.sessionId(), SessionStatus.TOOL_USE, "Agent (" + selected.getName() + ")...");
        long started = clock.millis();
        ToolLoopResult result = toolLoop.run(
                new ToolLoopRequest(system, turn.transcript(), selected, LlmOptions.defaults()),
                new SessionToolListener(turn.sessionId()));
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("agent", selected.getName());
        meta.put("llmCalls", result.llmCalls());
        meta.put("toolExecutions", result.toolExecutions());
        perf(turn.sessionId(), METRIC_AGENT_TOTAL, clock.millis() - started, meta);
        return result.content();
    }

    /**
     * Streams a continuation after a short quick answer. Tokens stop flowing
     * once another message lands in the session; failures keep the original
     * answer.
     */
    private String followUp(Turn turn, Followup followup, String text) {
        EngineProperties.FollowupProperties config = properties.getFollowup();
        int baseSize = turn.transcript().size();
        String system = PromptStackService.join(followup.system(), FOLLOWUP_INSTRUCTION);

        List<Message> transcript = new ArrayList<>(turn.transcript());
        transcript.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(text)
                .timestamp(clock.instant())
                .build());
        List<LlmMessage> messages = promptStack.buildChatMessages(system, transcript,
                Math.max(followup.agent().getMaxHistoryTurns(), config.getMinHistoryTurns()));
        LlmOptions options = LlmOptions.builder()
                .model(hasText(config.getModel()) ? config.getModel() : properties.getLlm().getModel())
                .maxTokens(config.getMaxTokens())
                .temperature(firstNonNull(config.getTemperature(), followup.agent().getTemperature(),
                        properties.getLlm().getTemperature()))
                .build();

        events.broadcast(new EngineEvent.AssistantToken(turn.sessionId(), "\n\n"));
        long started = clock.millis();
        BooleanSupplier unchanged = () -> sessionTable.call(sessions -> sessions.find(turn.sessionId())
                .map(session -> session.getMessages().size())
                .orElse(-1)) == baseSize;
        TokenRelay relay = new TokenRelay(turn.sessionId(), followup.agent().getName(), MODE_FOLLOWUP, started,
                unchanged);
        try {
            ChatCompletion out = join(llmPort.completeStreaming(messages, relay, options));
            String extra = QuickOutputSanitizer.sanitize(out.content()).trim();
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("agent", followup.agent().getName());
            meta.put("mode", MODE_FOLLOWUP);
            meta.put("tokens", relay.count);
            meta.put("model", out.model());
            perf(turn.sessionId(), METRIC_LLM_TOTAL, clock.millis() - started, meta);
            if (!extra.isEmpty()) {
                return text + "\n\n" + extra;
            }
        } catch (RuntimeException e) { // NOSONAR - the first answer stands on its own
            log.debug("[Engine] Follow-up failed for session {}: {}", turn.sessionId(), messageOf(e));
        }
        return text;
    }

    /**
     * Forwards scrubbed stream tokens to clients, emitting {@code llm.ttfb} on
     * the first visible one.
     */
    private final class TokenRelay implements Consumer<String> {

        private final String sessionId;
        private final String agent;
        private final String mode;
        private final long started;
        private final BooleanSupplier active;
        private boolean blocked;
        private boolean ttfbSent;
        private int count;

        private TokenRelay(String sessionId, String agent, String mode, long started, BooleanSupplier active) {
            this.sessionId = sessionId;
            this.agent = agent;
            this.mode = mode;
            this.started = started;
            this.active = active;
        }

        @Override
        public void accept(String token) {
            if (blocked || !active.getAsBoolean()) {
                return;
            }
            QuickOutputSanitizer.Scrubbed scrubbed = QuickOutputSanitizer.scrubToken(token);
            if (!scrubbed.text().isEmpty()) {
                count++;
                if (!ttfbSent) {
                    ttfbSent = true;
                    Map<String, Object> meta = new LinkedHashMap<>();
                    meta.put("agent", agent);
                    meta.put("mode", mode);
                    perf(sessionId, METRIC_TTFB, clock.millis() - started, meta);
                }
                events.broadcast(new EngineEvent.AssistantToken(sessionId, scrubbed.text()));
            }
            if (scrubbed.stop()) {
                blocked = true;
            }
        }
    }

    /**
     * Mirrors tool activity into the session record and out to clients.
     */
    private final class SessionToolListener implements ToolLoopListener {

        private final String sessionId;

        private SessionToolListener(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onToolCall(ToolCall call) {
            ToolCall recorded = call.toBuilder().build();
            sessionTable.run(sessions -> sessions.find(sessionId)
                    .ifPresent(session -> session.getToolCalls().add(recorded)));
            events.broadcast(new EngineEvent.ToolCallStarted(sessionId, call));
        }

        @Override
        public void onToolResult(String toolId, Map<String, Object> result) {
            boolean ok = Boolean.TRUE.equals(result.get("ok"));
            sessionTable.run(sessions -> sessions.find(sessionId).ifPresent(session -> {
                for (ToolCall recorded : session.getToolCalls()) {
                    if (recorded.getId().equals(toolId)) {
                        recorded.setStatus(ok ? ToolCallStatus.COMPLETED : ToolCallStatus.FAILED);
                        recorded.setResult(result);
                    }
                }
            }));
            events.broadcast(new EngineEvent.ToolCallFinished(sessionId, toolId, result));
        }
    }

    // ==================== SERVICES ====================

    private void onServiceEvent(ServiceEvent event) {
        if (event instanceof ServiceEvent.Status status) {
            events.broadcast(new EngineEvent.ServiceStatusChanged(status.service()));
        } else if (event instanceof ServiceEvent.Log line) {
            events.broadcast(new EngineEvent.ServiceLog(line.name(), line.stream(), line.line()));
        }
    }

    private void reportStatus(String connectionId, ServiceName name) {
        if (name != null) {
            events.send(connectionId, new EngineEvent.ServiceStatusChanged(supervisor.getState(name)));
            return;
        }
        onConnect(connectionId);
    }

    private void reportFailure(String connectionId, CompletableFuture<Void> operation) {
        operation.whenComplete((ignored, error) -> {
            if (error != null) {
                events.send(connectionId, EngineEvent.ErrorReported.of(messageOf(error)));
            }
        });
    }

    /**
     * Best-effort start of a backend that looks installed or already serves
     * externally.
     */
    private void ensureBackend(ServiceName name, boolean preferred) {
        boolean canTry = preferred || supervisor.canStart(name) || supervisor.isHealthy(name);
        if (!canTry || isRunning(name)) {
            return;
        }
        try {
            supervisor.start(name).join();
        } catch (RuntimeException e) { // NOSONAR - the caller falls back
            log.debug("[Engine] Auto-start of {} failed: {}", name.getValue(), messageOf(e));
        }
    }

    private boolean isRunning(ServiceName name) {
        return supervisor.getState(name).getStatus() == ServiceStatus.RUNNING;
    }

    // ==================== HELPERS ====================

    private boolean isSimpleMessage(String content) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            return true;
        }
        if (text.startsWith(ToolCallProtocol.TOOL_CALL_PREFIX)) {
            return false;
        }
        EngineProperties.QuickProperties quick = properties.getQuick();
        return text.length() <= quick.getMaxChars() && text.split("\\s+").length <= quick.getMaxWords();
    }

    private Path resolveImage(String image) {
        Path path = Path.of(image);
        return path.isAbsolute() ? path : paths.repoRoot().resolve(path).normalize();
    }

    private void updateStatus(String sessionId, SessionStatus status, String detail) {
        sessionTable.run(sessions -> {
            sessions.getOrCreate(sessionId).setStatus(status);
            events.broadcast(new EngineEvent.SessionStatusChanged(sessionId, status, detail));
        });
    }

    private void perf(String sessionId, String name, long durationMs, Map<String, Object> meta) {
        events.broadcast(new EngineEvent.PerfMetric(sessionId, name, durationMs, meta));
    }

    private void submitLogged(String action, Consumer<SessionTable.Sessions> body) {
        sessionTable.submit(sessions -> {
            body.accept(sessions);
            return null;
        }).exceptionally(e -> {
            log.error("[Engine] Session {} failed", action, e);
            return null;
        });
    }

    private String noLlmReply(String content) {
        return "I understand you said: \"" + content + "\"\n\n"
                + "This engine is currently running without an LLM.\n\n"
                + "To use a local MLX model, configure the mlx service:\n"
                + "  ENGINE_SERVICES_MLX_COMMAND=\"<launch command>\"\n"
                + "or install the bundled server under scripts/mlx.\n\n"
                + "Tip: set ENGINE_LLM_PREFER_LOCAL=true to always try MLX.";
    }

    private String fixHint(ServiceName name) {
        String key = "ENGINE_SERVICES_" + name.getValue().toUpperCase(Locale.ROOT);
        return "Fix:\n"
                + "  " + key + "_COMMAND=\"<launch command>\"\n"
                + "  or " + key + "_COMMAND_JSON='[\"cmd\", \"arg\"]'\n\n"
                + "Then start it with a service.start command for \"" + name.getValue() + "\".";
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

    static String messageOf(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static double firstNonNull(Double first, Double second, double fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}

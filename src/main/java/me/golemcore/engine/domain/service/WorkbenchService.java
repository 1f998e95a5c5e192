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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.LlmOptions;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.SessionStatus;
import me.golemcore.engine.domain.model.protocol.EngineEvent;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.EngineEventPort;
import me.golemcore.engine.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Re-runs a finished quick answer against alternative model strategies and
 * reports how close each one came, as {@code perf.metric} events. Never
 * touches the transcript.
 */
@Service
@Slf4j
public class WorkbenchService {

    static final String METRIC_STRATEGY = "workbench.strategy";
    static final String METRIC_ERROR = "workbench.error";

    private static final List<String> STRATEGY_IDS = List.of("quick", "balanced", "full");

    private final EngineProperties properties;
    private final LlmPort llmPort;
    private final PromptStackService promptStack;
    private final SessionTable sessionTable;
    private final EngineEventPort events;
    private final EngineExecutors executors;
    private final Clock clock;

    public WorkbenchService(EngineProperties properties, LlmPort llmPort, PromptStackService promptStack,
            SessionTable sessionTable, EngineEventPort events, EngineExecutors executors, Clock clock) {
        this.properties = properties;
        this.llmPort = llmPort;
        this.promptStack = promptStack;
        this.sessionTable = sessionTable;
        this.events = events;
        this.executors = executors;
        this.clock = clock;
    }

    /**
     * Model preset compared against the primary answer.
     */
    public record Strategy(String id, String model, int maxTokens, double temperature, int maxHistoryTurns) {
    }

    /**
     * Everything needed to replay a quick answer.
     */
    public record Plan(String sessionId, String system, String agent, String primaryResponse, String primaryModel,
            List<Message> transcript) {
    }

    public boolean isEnabled() {
        return !enabledStrategyIds().isEmpty();
    }

    /**
     * Parses the configured strategy list: empty, {@code 0} or {@code false}
     * disable; {@code 1} or {@code true} enable all; otherwise a comma list of
     * known ids.
     */
    public static List<String> parseStrategies(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty() || "0".equals(value) || "false".equals(value)) {
            return List.of();
        }
        if ("1".equals(value) || "true".equals(value)) {
            return STRATEGY_IDS;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(STRATEGY_IDS::contains)
                .toList();
    }

    public List<Strategy> strategies() {
        EngineProperties.LlmProperties llm = properties.getLlm();
        EngineProperties.QuickProperties quick = properties.getQuick();
        double quickTemperature = quick.getTemperature() != null ? quick.getTemperature() : llm.getTemperature();
        int balancedMaxTokens = Math.min(properties.getWorkbench().getBalancedMaxTokens(), llm.getMaxTokens());

        Set<String> enabled = new HashSet<>(enabledStrategyIds());
        return List.of(
                new Strategy("quick", quick.getModel(), quick.getMaxTokens(), quickTemperature, 4),
                new Strategy("balanced", llm.getModel(), balancedMaxTokens, llm.getTemperature(), 8),
                new Strategy("full", llm.getModel(), llm.getMaxTokens(), llm.getTemperature(), 12))
                .stream()
                .filter(strategy -> enabled.contains(strategy.id()))
                .toList();
    }

    /**
     * Runs the enabled strategies one after another in the background, as long
     * as the session is idle when the run begins.
     */
    public void schedule(Plan plan) {
        List<Strategy> strategies = strategies();
        if (strategies.isEmpty()) {
            return;
        }
        try {
            executors.worker().execute(() -> run(plan, strategies));
        } catch (RejectedExecutionException e) {
            log.debug("[Workbench] Skipped, engine is shutting down");
        }
    }

    void run(Plan plan, List<Strategy> strategies) {
        boolean idle = sessionTable.call(sessions -> sessions.find(plan.sessionId())
                .map(session -> session.getStatus() == SessionStatus.IDLE)
                .orElse(false));
        if (!idle) {
            log.debug("[Workbench] Session {} is busy, skipping", plan.sessionId());
            return;
        }
        for (Strategy strategy : strategies) {
            runStrategy(plan, strategy);
        }
    }

    private void runStrategy(Plan plan, Strategy strategy) {
        long started = clock.millis();
        try {
            LlmOptions options = LlmOptions.builder()
                    .model(strategy.model())
                    .maxTokens(strategy.maxTokens())
                    .temperature(strategy.temperature())
                    .build();
            ChatCompletion out = llmPort.complete(
                    promptStack.buildChatMessages(plan.system(), plan.transcript(), strategy.maxHistoryTurns()),
                    options).join();

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("agent", plan.agent());
            meta.put("strategy", strategy.id());
            meta.put("model", out.model());
            meta.put("primaryModel", plan.primaryModel());
            meta.put("maxTokens", strategy.maxTokens());
            meta.put("temperature", strategy.temperature());
            meta.put("maxHistoryTurns", strategy.maxHistoryTurns());
            meta.put("responseLength", out.content().length());
            meta.put("primaryLength", plan.primaryResponse().length());
            meta.put("jaccard", jaccard(plan.primaryResponse(), out.content()));
            meta.put("lengthRatio", lengthRatio(plan.primaryResponse(), out.content()));
            events.broadcast(new EngineEvent.PerfMetric(plan.sessionId(), METRIC_STRATEGY,
                    clock.millis() - started, meta));
        } catch (RuntimeException e) { // NOSONAR - reported as a metric
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("strategy", strategy.id());
            meta.put("model", strategy.model());
            meta.put("error", String.valueOf(cause.getMessage()));
            events.broadcast(new EngineEvent.PerfMetric(plan.sessionId(), METRIC_ERROR,
                    clock.millis() - started, meta));
        }
    }

    private List<String> enabledStrategyIds() {
        return parseStrategies(properties.getWorkbench().getStrategies());
    }

    /**
     * Jaccard similarity of the lower-cased alphanumeric word sets.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = words(a);
        Set<String> right = words(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        int union = left.size() + right.size() - intersection.size();
        return union == 0 ? 0 : (double) intersection.size() / union;
    }

    public static double lengthRatio(String a, String b) {
        int left = a == null ? 0 : a.trim().length();
        int right = b == null ? 0 : b.trim().length();
        if (left == 0 || right == 0) {
            return 0;
        }
        return (double) Math.min(left, right) / Math.max(left, right);
    }

    private static Set<String> words(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        for (String word : text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s]", " ").split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }
}

package me.golemcore.engine.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.exception.EmptyCompletionException;
import me.golemcore.engine.domain.exception.LlmRequestException;
import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.LlmMessage;
import me.golemcore.engine.domain.model.LlmOptions;
import me.golemcore.engine.domain.service.TextChunker;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.LlmPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Client for OpenAI-compatible {@code /v1/chat/completions} endpoints, as
 * served by mlx-lm and mlx-vlm.
 *
 * <p>
 * Streaming requests accept both server-sent events and a plain JSON body;
 * the latter is replayed as whitespace-delimited chunks. Requests run on the
 * engine worker pool and are bounded by an overall call timeout.
 */
@Component
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final String EVENT_STREAM = "text/event-stream";
    private static final int ERROR_BODY_LIMIT = 500;

    private final OkHttpClient httpClient;
    private final EngineProperties.LlmProperties defaults;
    private final ObjectMapper objectMapper;
    private final EngineExecutors executors;
    private final EventStreamLineParser lineParser;

    public OpenAiCompatibleLlmAdapter(OkHttpClient httpClient, EngineProperties properties,
            ObjectMapper objectMapper, EngineExecutors executors) {
        this.httpClient = httpClient;
        this.defaults = properties.getLlm();
        this.objectMapper = objectMapper;
        this.executors = executors;
        this.lineParser = new EventStreamLineParser(objectMapper);
    }

    @Override
    public CompletableFuture<ChatCompletion> complete(List<LlmMessage> messages, LlmOptions options) {
        return CompletableFuture.supplyAsync(() -> execute(messages, options, null), executors.worker());
    }

    @Override
    public CompletableFuture<ChatCompletion> completeStreaming(List<LlmMessage> messages, Consumer<String> onToken,
            LlmOptions options) {
        return CompletableFuture.supplyAsync(() -> execute(messages, options, onToken), executors.worker());
    }

    private ChatCompletion execute(List<LlmMessage> messages, LlmOptions options, Consumer<String> onToken) {
        LlmOptions effective = options != null ? options : LlmOptions.defaults();
        String model = effective.getModel() != null ? effective.getModel() : defaults.getModel();
        long timeoutMs = effective.getTimeoutMs() != null ? effective.getTimeoutMs() : defaults.getTimeoutMs();
        boolean streaming = onToken != null;

        ChatCompletionRequest body = buildRequest(messages, effective, model, streaming);
        String url = baseUrl(effective) + COMPLETIONS_PATH;

        Request request;
        try {
            Request.Builder builder = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON));
            if (streaming) {
                builder.header("Accept", EVENT_STREAM);
            }
            request = builder.build();
        } catch (JsonProcessingException e) {
            throw new LlmRequestException("Failed to serialize chat request", e);
        } catch (IllegalArgumentException e) {
            throw new LlmRequestException("Invalid LLM url: " + url, e);
        }

        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();

        log.debug("[LLM] POST {} model={} stream={} messages={}", url, model, streaming, messages.size());
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                String errorBody = responseBody != null ? truncate(responseBody.string()) : "";
                throw new LlmRequestException("LLM request failed (" + response.code() + "): " + errorBody,
                        response.code(), null);
            }
            if (responseBody == null) {
                throw new EmptyCompletionException("LLM returned an empty response");
            }

            MediaType bodyType = responseBody.contentType();
            String contentType = response.header("Content-Type", bodyType != null ? bodyType.toString() : "");
            if (streaming && contentType.contains(EVENT_STREAM)) {
                return readEventStream(responseBody, model, onToken);
            }

            ChatCompletion completion = parseBuffered(responseBody.string(), model);
            if (streaming) {
                TextChunker.chunks(completion.content()).forEach(onToken);
            }
            return completion;
        } catch (InterruptedIOException e) {
            throw new LlmRequestException("LLM request timed out after " + timeoutMs + " ms", e);
        } catch (IOException e) {
            throw new LlmRequestException("LLM request failed: " + e.getMessage(), e);
        }
    }

    private ChatCompletion readEventStream(ResponseBody body, String requestedModel, Consumer<String> onToken)
            throws IOException {
        StringBuilder content = new StringBuilder();
        String model = requestedModel;
        // Lines end at \n or \r\n only; an unterminated last line is still delivered.
        try (BufferedSource source = body.source()) {
            String line;
            while ((line = source.readUtf8Line()) != null) {
                Optional<String> delta = lineParser.parseDelta(line);
                if (delta.isPresent()) {
                    model = lineParser.parseModel(line, model);
                    content.append(delta.get());
                    onToken.accept(delta.get());
                }
            }
        }
        if (content.toString().isBlank()) {
            throw new EmptyCompletionException("LLM returned an empty response");
        }
        return new ChatCompletion(model, content.toString());
    }

    private ChatCompletion parseBuffered(String json, String requestedModel) throws JsonProcessingException {
        ChatCompletionResponse parsed = objectMapper.readValue(json, ChatCompletionResponse.class);
        String content = null;
        if (parsed.getChoices() != null && !parsed.getChoices().isEmpty()
                && parsed.getChoices().get(0).getMessage() != null) {
            Object raw = parsed.getChoices().get(0).getMessage().getContent();
            content = raw instanceof String text ? text : null;
        }
        if (content == null || content.isBlank()) {
            throw new EmptyCompletionException("LLM returned an empty response");
        }
        String model = parsed.getModel() != null ? parsed.getModel() : requestedModel;
        return new ChatCompletion(model, content);
    }

    private ChatCompletionRequest buildRequest(List<LlmMessage> messages, LlmOptions options, String model,
            boolean streaming) {
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(model);
        request.setMaxTokens(options.getMaxTokens() != null ? options.getMaxTokens() : defaults.getMaxTokens());
        request.setTemperature(
                options.getTemperature() != null ? options.getTemperature() : defaults.getTemperature());
        request.setTopP(options.getTopP() != null ? options.getTopP() : defaults.getTopP());
        request.setStream(streaming ? Boolean.TRUE : null);

        List<ApiMessage> apiMessages = new ArrayList<>();
        for (LlmMessage message : messages) {
            ApiMessage apiMessage = new ApiMessage();
            apiMessage.setRole(message.getRole());
            if (message.hasImages()) {
                List<Map<String, Object>> blocks = new ArrayList<>();
                blocks.add(Map.of("type", "text", "text", message.getContent() != null ? message.getContent() : ""));
                for (String imageUrl : message.getImageUrls()) {
                    blocks.add(Map.of("type", "image_url", "image_url", Map.of("url", imageUrl)));
                }
                apiMessage.setContent(blocks);
            } else {
                apiMessage.setContent(message.getContent());
            }
            apiMessages.add(apiMessage);
        }
        request.setMessages(apiMessages);
        return request;
    }

    private String baseUrl(LlmOptions options) {
        String base = options.getBaseUrl() != null && !options.getBaseUrl().isBlank()
                ? options.getBaseUrl()
                : defaults.getBaseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static String truncate(String text) {
        String trimmed = text.trim();
        return trimmed.length() > ERROR_BODY_LIMIT ? trimmed.substring(0, ERROR_BODY_LIMIT) + "..." : trimmed;
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Double temperature;
        @JsonProperty("top_p")
        private Double topP;
        private Boolean stream;
    }

    @Data
    public static class ApiMessage {
        private String role;
        /** Plain string, or a list of content blocks for multimodal input. */
        private Object content;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    public static class ChatChoice {
        private Integer index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }
}

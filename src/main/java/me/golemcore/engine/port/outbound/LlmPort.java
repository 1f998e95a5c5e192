package me.golemcore.engine.port.outbound;

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

import me.golemcore.engine.domain.model.ChatCompletion;
import me.golemcore.engine.domain.model.LlmMessage;
import me.golemcore.engine.domain.model.LlmOptions;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Chat-completion access to an OpenAI-compatible model backend.
 */
public interface LlmPort {

    /**
     * Executes a buffered chat completion and returns the full response. The
     * future fails with
     * {@link me.golemcore.engine.domain.exception.LlmRequestException} on
     * transport errors, timeouts and non-2xx answers, and with
     * {@link me.golemcore.engine.domain.exception.EmptyCompletionException} when
     * the backend returns no text.
     */
    CompletableFuture<ChatCompletion> complete(List<LlmMessage> messages, LlmOptions options);

    /**
     * Executes a streaming chat completion, invoking {@code onToken} for every
     * text delta as it arrives. Backends that ignore the stream request and
     * answer with a single JSON body are replayed through {@code onToken} split
     * on whitespace boundaries, so the concatenation of all tokens always equals
     * the returned content.
     */
    CompletableFuture<ChatCompletion> completeStreaming(List<LlmMessage> messages, Consumer<String> onToken,
            LlmOptions options);
}

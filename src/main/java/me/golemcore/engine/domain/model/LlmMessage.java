package me.golemcore.engine.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Chat message sent to a model backend. Messages carrying image URLs are sent
 * as multimodal content blocks.
 */
@Value
@Builder
public class LlmMessage {

    String role;
    String content;
    @Builder.Default
    List<String> imageUrls = List.of();

    public static LlmMessage system(String content) {
        return LlmMessage.builder().role(Message.ROLE_SYSTEM).content(content).build();
    }

    public static LlmMessage user(String content) {
        return LlmMessage.builder().role(Message.ROLE_USER).content(content).build();
    }

    public static LlmMessage assistant(String content) {
        return LlmMessage.builder().role(Message.ROLE_ASSISTANT).content(content).build();
    }

    public boolean hasImages() {
        return imageUrls != null && !imageUrls.isEmpty();
    }
}

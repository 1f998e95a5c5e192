package me.golemcore.engine.domain.exception;

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

/**
 * Chat completion request failed: transport error, deadline exceeded or a
 * non-2xx answer from the backend.
 */
public class LlmRequestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public LlmRequestException(String message) {
        this(message, -1, null);
    }

    public LlmRequestException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmRequestException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed response, or {@code -1} when no response was
     * received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

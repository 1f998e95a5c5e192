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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supervised model backends.
 */
public enum ServiceName {

    KOKOMO("kokomo"), CHATTERBOX("chatterbox"), MLX("mlx"), VLM("vlm");

    private final String value;

    ServiceName(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ServiceName> fromValue(String value) {
        return Arrays.stream(values())
                .filter(name -> name.value.equals(value))
                .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}

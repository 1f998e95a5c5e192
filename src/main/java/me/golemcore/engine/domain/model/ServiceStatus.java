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

/**
 * Supervisor state of a backend. Allowed transitions:
 *
 * <pre>
 * stopped  → starting | running (external)
 * starting → running | error | stopped (exit)
 * running  → stopping | stopped (exit) | error
 * stopping → stopped
 * error    → stopping | stopped | starting
 * </pre>
 */
public enum ServiceStatus {

    STOPPED("stopped"), STARTING("starting"), RUNNING("running"), STOPPING("stopping"), ERROR("error");

    private final String value;

    ServiceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

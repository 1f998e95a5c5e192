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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Observable state of one backend. Immutable; every transition produces a new
 * instance.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceState {

    ServiceName name;
    ServiceStatus status;
    Long pid;
    String detail;
    Integer lastExitCode;
    String lastError;

    public static ServiceState stopped(ServiceName name) {
        return ServiceState.builder()
                .name(name)
                .status(ServiceStatus.STOPPED)
                .build();
    }

    /**
     * Quiet states are stopped backends without an error to report.
     */
    public boolean isQuiet() {
        return status == ServiceStatus.STOPPED && lastError == null;
    }
}

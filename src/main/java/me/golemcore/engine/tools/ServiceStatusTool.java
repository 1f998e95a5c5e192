package me.golemcore.engine.tools;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ServiceDescriptor;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolNames;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ServiceSupervisor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Reports the supervisor state of one backend.
 */
@Component
public class ServiceStatusTool implements ToolComponent {

    private static final String PARAM_NAME = "name";

    private final ServiceSupervisor serviceSupervisor;

    public ServiceStatusTool(ServiceSupervisor serviceSupervisor) {
        this.serviceSupervisor = serviceSupervisor;
    }

    @Override
    public ToolDefinition getDefinition() {
        String names = ServiceDescriptor.ALL.stream()
                .map(descriptor -> "\"" + descriptor.name().getValue() + "\"")
                .collect(Collectors.joining("|"));
        return ToolDefinition.builder()
                .name(ToolNames.SERVICE_STATUS)
                .argsExample("{\"name\":" + names + "}")
                .returns("ServiceState")
                .build();
    }

    @Override
    public Optional<Map<String, Object>> parseArguments(JsonNode args) {
        if (args == null || !args.isObject() || !args.path(PARAM_NAME).isTextual()) {
            return Optional.empty();
        }
        return ServiceName.fromValue(args.get(PARAM_NAME).asText())
                .map(name -> Map.of(PARAM_NAME, name));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ServiceName name = (ServiceName) parameters.get(PARAM_NAME);
        return CompletableFuture.completedFuture(ToolResult.success(serviceSupervisor.getState(name)));
    }
}

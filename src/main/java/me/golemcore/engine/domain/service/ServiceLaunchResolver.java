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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.engine.domain.model.ServiceDescriptor;
import me.golemcore.engine.domain.model.ServiceLaunchConfig;
import me.golemcore.engine.domain.model.ServiceName;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Resolves how a backend is launched.
 *
 * <p>
 * Command precedence: {@code command-json}, then {@code command}, then the
 * bundled wrapper script when its venv is installed (or when
 * {@code use-defaults} is set). Resolution runs on every call so that
 * installing a backend does not require an engine restart.
 */
@Component
@RequiredArgsConstructor
public class ServiceLaunchResolver {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final EngineProperties properties;
    private final WorkspacePaths workspacePaths;
    private final ObjectMapper objectMapper;

    public ServiceLaunchConfig resolve(ServiceName name) {
        ServiceDescriptor descriptor = ServiceDescriptor.of(name);
        EngineProperties.ServiceProperties overrides = properties.getServices()
                .getOrDefault(name.getValue(), new EngineProperties.ServiceProperties());
        Path root = workspacePaths.repoRoot();

        List<String> command = List.of();
        String configError = null;
        try {
            command = explicitCommand(overrides);
        } catch (IllegalArgumentException e) {
            configError = e.getMessage();
        }

        Path wrapper = root.resolve(descriptor.wrapperScript());
        boolean installed = isInstalled(descriptor, root);
        if (command.isEmpty() && configError == null && (installed || overrides.isUseDefaults())) {
            command = List.of("bash", wrapper.toString());
        }

        String host = hasText(overrides.getHost()) ? overrides.getHost() : descriptor.defaultHost();
        int port = overrides.getPort() != null ? overrides.getPort() : descriptor.defaultPort();
        String baseUrl = "http://" + host + ":" + port;

        String healthUrl = null;
        if (hasText(overrides.getHealthUrl())) {
            healthUrl = overrides.getHealthUrl().trim();
        } else if (!command.isEmpty()) {
            healthUrl = baseUrl + descriptor.healthPath();
        }

        long readyTimeoutMs = overrides.getReadyTimeoutMs() != null
                ? overrides.getReadyTimeoutMs()
                : descriptor.defaultReadyTimeoutMs();
        boolean autoStart = overrides.getAutoStart() != null
                ? overrides.getAutoStart()
                : descriptor.autoStartWhenInstalled() && installed;

        return new ServiceLaunchConfig(name, command, healthUrl, baseUrl, readyTimeoutMs, autoStart,
                configError, root);
    }

    /**
     * The wrapper script and the venv interpreter it runs both exist.
     */
    public boolean isInstalled(ServiceName name) {
        return isInstalled(ServiceDescriptor.of(name), workspacePaths.repoRoot());
    }

    /**
     * Operator-facing text explaining how to make a backend startable.
     */
    public String notConfiguredMessage(ServiceName name) {
        ServiceDescriptor descriptor = ServiceDescriptor.of(name);
        String envPrefix = "ENGINE_SERVICES_" + name.getValue().toUpperCase(Locale.ROOT);
        return descriptor.title() + " is not configured/installed.\n\n"
                + "Install the bundled backend so that these exist:\n"
                + "  " + descriptor.wrapperScript() + "\n"
                + "  " + descriptor.venvPython() + "\n\n"
                + "Or provide your own command:\n"
                + "  " + envPrefix + "_COMMAND=\"...\"\n"
                + "  " + envPrefix + "_COMMAND_JSON='[\"...\"]'";
    }

    private List<String> explicitCommand(EngineProperties.ServiceProperties overrides) {
        if (hasText(overrides.getCommandJson())) {
            try {
                List<String> argv = objectMapper.readValue(overrides.getCommandJson(), STRING_LIST);
                if (argv == null || argv.stream().anyMatch(arg -> arg == null)) {
                    throw new IllegalArgumentException("command-json must be a JSON array of strings");
                }
                return argv;
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("command-json must be a JSON array of strings", e);
            }
        }
        if (hasText(overrides.getCommand())) {
            return ShellCommandSplitter.split(overrides.getCommand().trim());
        }
        return List.of();
    }

    private static boolean isInstalled(ServiceDescriptor descriptor, Path root) {
        return Files.isRegularFile(root.resolve(descriptor.wrapperScript()))
                && Files.exists(root.resolve(descriptor.venvPython()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Launch description of a child process.
 *
 * @param name
 *            label used in logs and output events
 * @param command
 *            argv, first element is the executable
 * @param workingDirectory
 *            working directory, or {@code null} to inherit
 * @param environment
 *            variables merged over the inherited environment
 */
public record ProcessSpec(String name, List<String> command, Path workingDirectory,
        Map<String, String> environment) {

    public ProcessSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Process \"" + name + "\" requires a command.");
        }
        command = List.copyOf(command);
        environment = environment != null ? Map.copyOf(environment) : Map.of();
    }
}

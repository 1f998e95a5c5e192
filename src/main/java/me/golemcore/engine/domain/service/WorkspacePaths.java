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

import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Resolves the repository root and the engine state directory beneath it.
 */
@Component
public class WorkspacePaths {

    private static final String AGENTS_DIR = "agents";
    private static final String WORKSPACE_PROMPT = "workspace.md";
    private static final String WORKSPACE_LOCAL_PROMPT = "workspace.local.md";

    private final Path repoRoot;
    private final Path stateDir;

    public WorkspacePaths(EngineProperties properties) {
        EngineProperties.WorkspaceProperties workspace = properties.getWorkspace();
        this.repoRoot = Path.of(workspace.getRoot()).toAbsolutePath().normalize();
        this.stateDir = repoRoot.resolve(workspace.getStateDir()).normalize();
    }

    public Path repoRoot() {
        return repoRoot;
    }

    public Path stateDir() {
        return stateDir;
    }

    public Path agentsDir() {
        return stateDir.resolve(AGENTS_DIR);
    }

    public Path workspacePrompt() {
        return stateDir.resolve(WORKSPACE_PROMPT);
    }

    public Path workspaceLocalPrompt() {
        return stateDir.resolve(WORKSPACE_LOCAL_PROMPT);
    }
}

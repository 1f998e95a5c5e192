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

import me.golemcore.engine.domain.exception.PathEscapeException;
import me.golemcore.engine.domain.service.WorkspacePaths;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves repo-relative paths for the file system tools and keeps them inside
 * the repository root, including after symlink resolution.
 */
@Component
public class RepoPathResolver {

    private final WorkspacePaths workspacePaths;

    public RepoPathResolver(WorkspacePaths workspacePaths) {
        this.workspacePaths = workspacePaths;
    }

    public Path root() {
        return workspacePaths.repoRoot();
    }

    /**
     * @throws PathEscapeException
     *             if the path is empty, absolute, contains a {@code ..} segment or
     *             resolves outside the root
     */
    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            throw new PathEscapeException("path is required");
        }
        String normalized = relativePath.replace('\\', '/');
        if (normalized.startsWith("/") || isAbsolute(relativePath) || normalized.matches("^[A-Za-z]:.*")) {
            throw new PathEscapeException("absolute paths are not allowed");
        }
        for (String segment : normalized.split("/")) {
            if ("..".equals(segment)) {
                throw new PathEscapeException("path traversal is not allowed");
            }
        }

        Path root = root();
        Path resolved;
        try {
            resolved = root.resolve(normalized).normalize();
        } catch (InvalidPathException e) {
            throw new PathEscapeException("invalid path: " + relativePath);
        }
        if (!resolved.startsWith(root)) {
            throw new PathEscapeException("path escapes repo root");
        }

        if (Files.exists(resolved)) {
            try {
                Path realRoot = root.toRealPath();
                if (!resolved.toRealPath().startsWith(realRoot)) {
                    throw new PathEscapeException("path escapes repo root");
                }
            } catch (IOException e) {
                throw new PathEscapeException("cannot resolve path: " + relativePath);
            }
        }
        return resolved;
    }

    private static boolean isAbsolute(String path) {
        try {
            return Path.of(path).isAbsolute();
        } catch (InvalidPathException e) {
            return false;
        }
    }
}

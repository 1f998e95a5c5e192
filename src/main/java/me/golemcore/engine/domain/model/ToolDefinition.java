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
import lombok.Data;

/**
 * Catalog entry describing a tool to the model: its name, the argument shape
 * and what it returns.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private String argsExample;
    private String returns;

    /**
     * Renders the one-line catalog entry, e.g.
     * {@code - time.now args={} -> { iso, epochMs }}.
     */
    public String toCatalogLine() {
        StringBuilder line = new StringBuilder("- ").append(name)
                .append(" args=").append(argsExample)
                .append(" -> ").append(returns);
        if (description != null && !description.isBlank()) {
            line.append(" (").append(description).append(')');
        }
        return line.toString();
    }
}

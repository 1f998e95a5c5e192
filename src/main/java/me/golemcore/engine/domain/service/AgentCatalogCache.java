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

import me.golemcore.engine.domain.model.AgentCatalog;

import java.time.Clock;

/**
 * Caches the loaded {@link AgentCatalog} for a short time so that agent files
 * are not re-read on every message while edits still show up quickly.
 */
public class AgentCatalogCache {

    private final AgentPackLoader loader;
    private final Clock clock;
    private final long ttlMs;

    private AgentCatalog cached;
    private long loadedAt;

    public AgentCatalogCache(AgentPackLoader loader, Clock clock, long ttlMs) {
        this.loader = loader;
        this.clock = clock;
        this.ttlMs = ttlMs;
    }

    public synchronized AgentCatalog get() {
        long now = clock.millis();
        if (cached == null || now - loadedAt >= ttlMs) {
            cached = loader.load();
            loadedAt = now;
        }
        return cached;
    }
}

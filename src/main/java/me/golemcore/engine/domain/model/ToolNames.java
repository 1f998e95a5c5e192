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

import java.util.List;

/**
 * Names of the built-in tools. Agent packs may only allow-list these.
 */
public final class ToolNames {

    public static final String TIME_NOW = "time.now";
    public static final String FS_READ = "fs.read";
    public static final String FS_LIST = "fs.list";
    public static final String SERVICE_STATUS = "service.status";
    public static final String LOGO_FETCH = "logo.fetch";

    public static final List<String> ALL = List.of(TIME_NOW, FS_READ, FS_LIST, SERVICE_STATUS, LOGO_FETCH);

    private ToolNames() {
    }

    public static boolean isKnown(String name) {
        return ALL.contains(name);
    }
}

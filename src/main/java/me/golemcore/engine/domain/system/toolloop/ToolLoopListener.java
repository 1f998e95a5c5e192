package me.golemcore.engine.domain.system.toolloop;

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

import me.golemcore.engine.domain.model.ToolCall;

import java.util.Map;

/**
 * Observer of tool executions inside a loop run.
 */
public interface ToolLoopListener {

    ToolLoopListener NONE = new ToolLoopListener() {
        @Override
        public void onToolCall(ToolCall call) {
            // nothing to observe
        }

        @Override
        public void onToolResult(String toolId, Map<String, Object> result) {
            // nothing to observe
        }
    };

    /**
     * Called before a tool runs; the call has status {@code running}.
     */
    void onToolCall(ToolCall call);

    /**
     * Called after a tool ran with {@code {ok:true,result}} or
     * {@code {ok:false,error}}.
     */
    void onToolResult(String toolId, Map<String, Object> result);
}

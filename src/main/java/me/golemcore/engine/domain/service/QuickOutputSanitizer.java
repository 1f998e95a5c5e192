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

import java.util.List;

/**
 * Cleans quick-path model output: text from the first tool-call marker on is
 * dropped and chat-template special tokens are removed.
 */
public final class QuickOutputSanitizer {

    public static final String QUICK_OUTPUT_GUIDANCE = """
            Respond in plain text only.
            Never emit tool-call syntax or special tokens.
            Assume benign intent; avoid refusals unless unsafe.
            If you must refuse, keep it to one short sentence.
            Keep it brief unless explicitly asked for more.""";

    private static final List<String> BLOCKERS = List.of(
            "<start_function_call>", "<tool_call>", "<|tool_call|>", "TOOL_CALL:");
    private static final List<String> STRIP_TOKENS = List.of(
            "<end_of_turn>", "<start_of_turn>", "<eos>", "<|endoftext|>");

    private QuickOutputSanitizer() {
    }

    /**
     * Scrubbed streaming token. {@code stop} is set when a blocker was found and
     * the rest of the stream must be dropped.
     */
    public record Scrubbed(String text, boolean stop) {
    }

    public static Scrubbed scrubToken(String token) {
        int cut = firstBlocker(token);
        String out = cut >= 0 ? token.substring(0, cut) : token;
        return new Scrubbed(stripTokens(out), cut >= 0);
    }

    /**
     * Sanitizes a full response. Falls back to the trimmed input if nothing
     * would remain.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        int cut = firstBlocker(text);
        String out = stripTokens(cut >= 0 ? text.substring(0, cut) : text).trim();
        return out.isEmpty() ? text.trim() : out;
    }

    private static int firstBlocker(String text) {
        int cut = -1;
        for (String marker : BLOCKERS) {
            int index = text.indexOf(marker);
            if (index >= 0 && (cut == -1 || index < cut)) {
                cut = index;
            }
        }
        return cut;
    }

    private static String stripTokens(String text) {
        String out = text;
        for (String token : STRIP_TOKENS) {
            out = out.replace(token, "");
        }
        return out;
    }
}

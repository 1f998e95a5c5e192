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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into argv using shell-like rules: whitespace separates
 * arguments, single and double quotes group, and a backslash escapes the next
 * character outside single quotes. No variable expansion or globbing.
 */
public final class ShellCommandSplitter {

    private ShellCommandSplitter() {
    }

    /**
     * @throws IllegalArgumentException
     *             on an unterminated quote or a trailing backslash
     */
    public static List<String> split(String commandLine) {
        List<String> args = new ArrayList<>();
        if (commandLine == null) {
            return args;
        }

        StringBuilder current = new StringBuilder();
        boolean inArg = false;
        char quote = 0;
        int i = 0;
        while (i < commandLine.length()) {
            char c = commandLine.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\\') {
                if (i + 1 >= commandLine.length()) {
                    throw new IllegalArgumentException("Trailing backslash in command: " + commandLine);
                }
                i++;
                current.append(commandLine.charAt(i));
                inArg = true;
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inArg = true;
            } else if (Character.isWhitespace(c)) {
                if (inArg) {
                    args.add(current.toString());
                    current.setLength(0);
                    inArg = false;
                }
            } else {
                current.append(c);
                inArg = true;
            }
            i++;
        }

        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in command: " + commandLine);
        }
        if (inArg) {
            args.add(current.toString());
        }
        return args;
    }
}

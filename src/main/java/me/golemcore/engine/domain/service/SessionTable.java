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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.Session;
import me.golemcore.engine.infrastructure.config.EngineExecutors;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory session store owned by a single thread.
 *
 * <p>
 * Every read and write of a {@link Session} is submitted to the owner
 * executor, so session state needs no locking and per-session checks such as
 * the busy test are atomic with the update that follows them. Must not be
 * called from the owner thread with the blocking methods.
 */
@Component
@Slf4j
public class SessionTable {

    private final ExecutorService owner;
    private final Clock clock;
    private final Map<String, Session> sessions = new HashMap<>();
    private final Sessions view = new Sessions();

    public SessionTable(EngineExecutors executors, Clock clock) {
        this.owner = executors.sessionOwner();
        this.clock = clock;
    }

    /**
     * Runs {@code action} on the owner thread.
     */
    public <T> CompletableFuture<T> submit(Function<Sessions, T> action) {
        return CompletableFuture.supplyAsync(() -> action.apply(view), owner);
    }

    /**
     * Runs {@code action} on the owner thread and waits for its result.
     */
    public <T> T call(Function<Sessions, T> action) {
        try {
            return submit(action).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * Runs {@code action} on the owner thread and waits for it to finish.
     */
    public void run(Consumer<Sessions> action) {
        call(sessionsView -> {
            action.accept(sessionsView);
            return null;
        });
    }

    /**
     * Owner-thread view of the table.
     */
    public final class Sessions {

        private Sessions() {
        }

        public Optional<Session> find(String id) {
            return Optional.ofNullable(sessions.get(id));
        }

        public Session getOrCreate(String id) {
            return sessions.computeIfAbsent(id, key -> newSession(key));
        }

        /**
         * Creates a fresh session, replacing any existing one with the same id.
         */
        public Session create(String id) {
            Session session = newSession(id);
            if (sessions.put(id, session) != null) {
                log.debug("[Sessions] Replaced session {}", id);
            }
            return session;
        }

        public int size() {
            return sessions.size();
        }

        private Session newSession(String id) {
            return new Session(id, clock.instant());
        }
    }
}

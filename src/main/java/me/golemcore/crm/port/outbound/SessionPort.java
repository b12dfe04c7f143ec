package me.golemcore.crm.port.outbound;

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

import me.golemcore.crm.domain.exception.SessionNotFoundException;
import me.golemcore.crm.domain.model.LlmUsage;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.SessionState;
import me.golemcore.crm.domain.model.UserFact;

import java.util.List;

/**
 * Port for conversation state and per-user long-term facts.
 */
public interface SessionPort {

    /**
     * @throws SessionNotFoundException
     *             if no session has this id
     */
    SessionState getSession(String sessionId);

    boolean exists(String sessionId);

    /**
     * Create a fresh, empty session. An existing session with the same id is
     * replaced; callers check {@link #exists(String)} first or use
     * {@link #getOrCreateSession(String, String)}.
     */
    SessionState createSession(String sessionId, String userId);

    /**
     * Atomically return the existing session or create it.
     */
    SessionState getOrCreateSession(String sessionId, String userId);

    /**
     * @throws SessionNotFoundException
     *             if no session has this id
     */
    void addMessage(String sessionId, Message message);

    /**
     * Longest suffix of the session history whose approximate token cost fits
     * {@code tokenBudget}.
     *
     * @throws SessionNotFoundException
     *             if no session has this id
     */
    List<Message> getMessages(String sessionId, int tokenBudget);

    void recordUsage(String sessionId, LlmUsage usage);

    List<UserFact> getUserMemory(String userId);

    void addUserFact(String userId, UserFact fact);
}

package me.golemcore.crm.port.inbound;

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

import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.TurnResult;

import java.util.List;

/**
 * Inbound port used by the chat-handling layer.
 */
public interface AgentTurnPort {

    /**
     * Handle one user turn end to end: route, resolve configuration, call the
     * model with tier fallback, optionally evaluate, and record the exchange.
     *
     * @throws me.golemcore.crm.domain.exception.AllTiersExhaustedException
     *             if every configured model tier failed
     * @throws me.golemcore.crm.domain.exception.TurnCancelledException
     *             if {@code token} was cancelled
     */
    TurnResult handleTurn(String sessionId, String userId, String userMessage, CancellationToken token);

    /**
     * Drop cached configuration of a user after it was changed externally.
     */
    void invalidateUserConfig(String userId);

    List<Message> getSessionHistory(String sessionId, int tokenBudget);
}

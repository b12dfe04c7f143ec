package me.golemcore.crm.routing;

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

import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.RoutingContext;

/**
 * Selects the worker that handles a user turn.
 *
 * <p>
 * Routing is single dispatch: every call returns exactly one worker node
 * ({@link AgentNode#isWorker()}), never {@code null}, so a turn is never split
 * across workers. Implementations are stateless; conversation context is
 * passed in through {@link RoutingContext}.
 *
 * @since 1.0
 * @see KeywordWorkerRouter
 * @see LlmWorkerRouter
 */
public interface WorkerRouter {

    /**
     * Pick the worker for this turn.
     *
     * @param context
     *            latest user message, user id and the recent history window
     * @param token
     *            cancellation of the surrounding turn; aborts a pending
     *            classification
     * @return the selected worker node
     * @throws me.golemcore.crm.domain.exception.TurnCancelledException
     *             if the turn is cancelled while routing
     */
    AgentNode route(RoutingContext context, CancellationToken token);
}

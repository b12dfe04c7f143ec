package me.golemcore.crm.domain.worker;

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
import me.golemcore.crm.domain.model.LlmChunk;
import me.golemcore.crm.domain.model.ToolDefinition;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * A named capability the router can dispatch a turn to: fixed instructions, the
 * subset of tools it may offer the model, and a streaming invocation.
 */
public interface Worker {

    AgentNode getNode();

    String getInstructions();

    List<ToolDefinition> getAllowedTools();

    /**
     * Start the worker's model call. Nothing happens until the returned stream
     * is subscribed; cancelling the subscription abandons the call.
     */
    Flux<LlmChunk> execute(WorkerInvocation invocation);
}

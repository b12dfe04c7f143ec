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

import me.golemcore.crm.domain.model.LlmChunk;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.LlmResponse;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for LLM providers. The model and provider to use are carried by each
 * request.
 */
public interface LlmPort {

    String getProviderId();

    /**
     * Execute a request and return the complete response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Execute a request as a stream of chunks. The first chunk with text marks
     * the arrival of the first token. Cancelling the subscription aborts the
     * provider call on a best-effort basis.
     */
    Flux<LlmChunk> chatStream(LlmRequest request);

    /**
     * Whether at least one provider has credentials configured.
     */
    boolean isAvailable();
}

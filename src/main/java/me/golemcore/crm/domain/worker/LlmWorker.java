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

import me.golemcore.crm.domain.model.LlmChunk;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Worker backed by a single streamed LLM call: instructions become the system
 * prompt, history and the user message become the conversation.
 */
public abstract class LlmWorker implements Worker {

    private final LlmPort llmPort;

    protected LlmWorker(LlmPort llmPort) {
        this.llmPort = llmPort;
    }

    @Override
    public Flux<LlmChunk> execute(WorkerInvocation invocation) {
        return Flux.defer(() -> llmPort.chatStream(buildRequest(invocation)));
    }

    LlmRequest buildRequest(WorkerInvocation invocation) {
        List<Message> messages = new ArrayList<>(invocation.getHistory());
        String content = invocation.getUserMessage();
        if (invocation.getFeedback() != null && !invocation.getFeedback().isBlank()) {
            content = content + "\n\n[Reviewer feedback on your previous answer: " + invocation.getFeedback()
                    + " Address it in this answer.]";
        }
        messages.add(Message.builder()
                .role(Message.ROLE_USER)
                .content(content)
                .build());

        return LlmRequest.builder()
                .model(invocation.getTarget().model())
                .provider(invocation.getTarget().provider())
                .settings(invocation.getTarget().settings())
                .systemPrompt(getInstructions())
                .messages(messages)
                .tools(getAllowedTools())
                .sessionId(invocation.getSessionId())
                .build();
    }
}

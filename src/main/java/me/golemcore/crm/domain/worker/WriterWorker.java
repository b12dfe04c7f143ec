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
import me.golemcore.crm.domain.model.ToolDefinition;
import me.golemcore.crm.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WriterWorker extends LlmWorker {

    private static final List<ToolDefinition> TOOLS = List.of(
            new ToolDefinition("lookup_individual", "Find the recipient's contact details"));

    public WriterWorker(LlmPort llmPort) {
        super(llmPort);
    }

    @Override
    public AgentNode getNode() {
        return AgentNode.WRITER_WORKER;
    }

    @Override
    public String getInstructions() {
        return """
                You are the writing assistant of a CRM. Draft emails, letters and summaries in the \
                user's voice. Return the draft ready to send, without commentary around it.""";
    }

    @Override
    public List<ToolDefinition> getAllowedTools() {
        return TOOLS;
    }
}

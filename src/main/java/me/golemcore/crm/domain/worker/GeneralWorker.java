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
public class GeneralWorker extends LlmWorker {

    public GeneralWorker(LlmPort llmPort) {
        super(llmPort);
    }

    @Override
    public AgentNode getNode() {
        return AgentNode.GENERAL_WORKER;
    }

    @Override
    public String getInstructions() {
        return """
                You are a helpful assistant inside a CRM application. Answer directly and concisely. \
                When the user asks for CRM data or job search help, tell them what to ask for.""";
    }

    @Override
    public List<ToolDefinition> getAllowedTools() {
        return List.of();
    }
}

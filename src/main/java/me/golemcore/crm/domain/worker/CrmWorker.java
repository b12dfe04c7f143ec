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
public class CrmWorker extends LlmWorker {

    private static final List<ToolDefinition> TOOLS = List.of(
            new ToolDefinition("lookup_individual", "Find contacts by name, email or organization"),
            new ToolDefinition("lookup_organization", "Find organizations by name or domain"),
            new ToolDefinition("update_record", "Update fields of a CRM record"),
            new ToolDefinition("create_task", "Create a follow-up task linked to a record"));

    public CrmWorker(LlmPort llmPort) {
        super(llmPort);
    }

    @Override
    public AgentNode getNode() {
        return AgentNode.CRM_WORKER;
    }

    @Override
    public String getInstructions() {
        return """
                You are the CRM assistant. Look up and update contacts, organizations, deals and tasks \
                using your tools. Say plainly when a lookup finds nothing; never invent records.""";
    }

    @Override
    public List<ToolDefinition> getAllowedTools() {
        return TOOLS;
    }
}

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
public class JobSearchWorker extends LlmWorker {

    private static final List<ToolDefinition> TOOLS = List.of(
            new ToolDefinition("search_jobs", "Search job postings by title, location and keywords"),
            new ToolDefinition("get_resume", "Fetch the user's stored resume"),
            new ToolDefinition("save_application", "Record a job application in the CRM"));

    public JobSearchWorker(LlmPort llmPort) {
        super(llmPort);
    }

    @Override
    public AgentNode getNode() {
        return AgentNode.JOB_SEARCH_WORKER;
    }

    @Override
    public String getInstructions() {
        return """
                You are the job search assistant of a CRM. Help the user find openings, tailor their \
                resume and prepare applications. Only report postings returned by your tools.""";
    }

    @Override
    public List<ToolDefinition> getAllowedTools() {
        return TOOLS;
    }
}

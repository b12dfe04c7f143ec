package me.golemcore.crm.domain.model;

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

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of logical agent roles. Each node carries its stable configuration
 * key, presentation metadata and the hard-coded model used when a user has no
 * override stored for it.
 *
 * <p>
 * Worker nodes are the only ones the router may select. The remaining nodes
 * back internal calls (routing, evaluation, titles) but resolve their model
 * through the same per-user configuration.
 *
 * @since 1.0
 */
public enum AgentNode {

    TRIAGE_ORCHESTRATOR("triage_orchestrator", "Triage Orchestrator",
            "Classifies each user message and hands it to exactly one worker",
            "gpt-5.2", "openai", false),

    JOB_SEARCH_WORKER("job_search_worker", "Job Search Worker",
            "Finds openings, reviews resumes and prepares applications",
            "gpt-5.2", "openai", true),

    CRM_WORKER("crm_worker", "CRM Worker",
            "Looks up and updates contacts, organizations and records",
            "gpt-5.2", "openai", true),

    WRITER_WORKER("writer_worker", "Writer Worker",
            "Drafts emails, cover letters and other long-form text",
            "gpt-5.2", "openai", true),

    GENERAL_WORKER("general_worker", "General Worker",
            "Handles conversation that no specialized worker claims",
            "gpt-5.2", "openai", true),

    EVALUATOR("evaluator", "Evaluator",
            "Scores worker output and decides whether a retry is needed",
            "claude-sonnet-4-5-20250929", "anthropic", false),

    TITLE_GENERATOR("title_generator", "Title Generator",
            "Generates short conversation titles",
            "claude-haiku-4-5-20251001", "anthropic", false);

    private final String configKey;
    private final String displayName;
    private final String description;
    private final String defaultModel;
    private final String defaultProvider;
    private final boolean worker;

    AgentNode(String configKey, String displayName, String description,
            String defaultModel, String defaultProvider, boolean worker) {
        this.configKey = configKey;
        this.displayName = displayName;
        this.description = description;
        this.defaultModel = defaultModel;
        this.defaultProvider = defaultProvider;
        this.worker = worker;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public String getDefaultProvider() {
        return defaultProvider;
    }

    public boolean isWorker() {
        return worker;
    }

    /**
     * Resolve a node from its configuration key ({@code "crm_worker"}). Matching
     * is case-insensitive and ignores surrounding whitespace.
     */
    public static Optional<AgentNode> fromConfigKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(java.util.Locale.ROOT);
        return Arrays.stream(values())
                .filter(node -> node.configKey.equals(normalized))
                .findFirst();
    }
}

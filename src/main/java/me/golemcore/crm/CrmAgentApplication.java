package me.golemcore.crm;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Agent orchestration runtime of the CRM assistant.
 *
 * <p>
 * For every user turn the runtime picks one worker, resolves that worker's
 * per-user model configuration through a cache, calls the model with tiered
 * first-token fallback, keeps a bounded conversation window, and optionally
 * gates the answer through an evaluator. A background scheduler drives due
 * automations and the daily digest.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound port       → AgentTurnPort (used by the chat-handling layer)
 * Domain Layer       → AgentOrchestrator, NodeConfigCache, SessionService,
 *                      ModelFallbackController, ResponseEvaluator, workers
 * Outbound adapters  → langchain4j LLM client, local workspace storage,
 *                      file-backed agent configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code agent.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CrmAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrmAgentApplication.class, args);
    }

}

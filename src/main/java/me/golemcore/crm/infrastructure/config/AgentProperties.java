package me.golemcore.crm.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties of the agent runtime, bound from
 * application.properties under the {@code agent.*} prefix.
 *
 * <p>
 * Nested sections:
 * <ul>
 * <li>{@link LlmProperties} - provider credentials and client timeouts</li>
 * <li>{@link SessionProperties} - history window sizing</li>
 * <li>{@link RoutingProperties} - worker selection</li>
 * <li>{@link EvaluatorProperties} - post-turn quality gate</li>
 * <li>{@link SchedulerProperties} - automation and digest cadence</li>
 * <li>{@link StorageProperties} - local workspace</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private SessionProperties session = new SessionProperties();
    private RoutingProperties routing = new RoutingProperties();
    private EvaluatorProperties evaluator = new EvaluatorProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private StorageProperties storage = new StorageProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private long timeoutMs = 120_000;
        private int maxRetries = 5;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    // ==================== SESSION ====================

    @Data
    public static class SessionProperties {
        private int historyTokenBudget = 8000;
        private int charsPerToken = 4;
    }

    // ==================== ROUTING ====================

    @Data
    public static class RoutingProperties {
        private boolean llmClassifierEnabled = false;
        private long classifierTimeoutMs = 5000;
    }

    // ==================== EVALUATOR ====================

    @Data
    public static class EvaluatorProperties {
        private boolean enabled = false;
        private int maxRetries = 2;
        private long timeoutMs = 30_000;
    }

    // ==================== SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private Duration automationInterval = Duration.ofMinutes(1);
        private String digestTime = "09:00";
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/crm-agent";
    }
}

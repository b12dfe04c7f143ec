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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * All node overrides a user has stored, as returned by the configuration
 * service. Nodes without an override are simply absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentConfigSnapshot {

    @JsonProperty("user_id")
    private String userId;

    @Builder.Default
    private List<NodeConfigRecord> nodes = new ArrayList<>();

    public static AgentConfigSnapshot empty(String userId) {
        return AgentConfigSnapshot.builder().userId(userId).build();
    }

    /**
     * Stored override of a single node. The fallback chain is kept in its raw
     * JSON form, {@code [{"model": "...", "timeout_seconds": N}]}, and parsed by
     * the configuration cache.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class NodeConfigRecord {

        @JsonProperty("node_name")
        private String nodeName;

        private String model;
        private String provider;
        private Double temperature;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        @JsonProperty("top_p")
        private Double topP;

        @JsonProperty("top_k")
        private Integer topK;

        @JsonProperty("frequency_penalty")
        private Double frequencyPenalty;

        @JsonProperty("presence_penalty")
        private Double presencePenalty;

        @JsonProperty("fallback_chain")
        private JsonNode fallbackChain;

        public LlmSettings toSettings() {
            return LlmSettings.builder()
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .topP(topP)
                    .topK(topK)
                    .frequencyPenalty(frequencyPenalty)
                    .presencePenalty(presencePenalty)
                    .build();
        }
    }

    /**
     * Stored form of one fallback tier.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FallbackTierRecord {

        private String model;

        @JsonProperty("timeout_seconds")
        private Integer timeoutSeconds;
    }
}

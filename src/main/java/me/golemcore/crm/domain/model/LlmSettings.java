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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional sampling parameters for a single LLM call. Every field is nullable;
 * a null field means "provider default".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LlmSettings {

    private Double temperature;
    private Integer maxTokens;
    private Double topP;
    private Integer topK;
    private Double frequencyPenalty;
    private Double presencePenalty;

    public static LlmSettings empty() {
        return new LlmSettings();
    }

    public boolean isEmpty() {
        return temperature == null && maxTokens == null && topP == null && topK == null
                && frequencyPenalty == null && presencePenalty == null;
    }

    /**
     * Compact human-readable form used in logs, e.g.
     * {@code temp=0.2 max_tokens=2048}.
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (temperature != null) {
            parts.add("temp=" + temperature);
        }
        if (maxTokens != null) {
            parts.add("max_tokens=" + maxTokens);
        }
        if (topP != null) {
            parts.add("top_p=" + topP);
        }
        if (topK != null) {
            parts.add("top_k=" + topK);
        }
        if (frequencyPenalty != null) {
            parts.add("freq_penalty=" + frequencyPenalty);
        }
        if (presencePenalty != null) {
            parts.add("pres_penalty=" + presencePenalty);
        }
        return String.join(" ", parts);
    }
}

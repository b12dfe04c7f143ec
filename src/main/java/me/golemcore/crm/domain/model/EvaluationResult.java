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
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Verdict of the evaluator on one worker output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationResult {

    private String feedback;

    @JsonProperty("success_criteria_met")
    private boolean successCriteriaMet;

    @JsonProperty("user_input_needed")
    private boolean userInputNeeded;

    /** 0..100 */
    private int score;

    public static EvaluationResult approved(String feedback) {
        return new EvaluationResult(feedback, true, false, 100);
    }

    /**
     * Whether the worker should be asked to try again.
     */
    public boolean requiresRetry() {
        return !successCriteriaMet && !userInputNeeded;
    }
}

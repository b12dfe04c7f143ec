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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a fallback-controlled model call.
 */
@Data
@Builder
public class ModelCallResult {

    private String content;
    private String model;
    private int tierIndex;
    private LlmUsage usage;

    /** Tiers abandoned or failed before the successful one, in order. */
    @Builder.Default
    private List<TierFailure> skippedTiers = new ArrayList<>();

    public boolean wasPromoted() {
        return tierIndex > 0;
    }
}

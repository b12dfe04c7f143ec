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

import java.util.List;

/**
 * Fully resolved model configuration for one node and one user: the primary
 * model, its provider, settings already filtered for that model, and the
 * (possibly empty) fallback chain.
 */
public record ModelSelection(AgentNode node, String model, String provider, LlmSettings settings,
        List<ModelTier> fallbackChain) {

    public ModelSelection {
        settings = settings != null ? settings : LlmSettings.empty();
        fallbackChain = fallbackChain != null ? List.copyOf(fallbackChain) : List.of();
    }

    public boolean hasFallbackChain() {
        return !fallbackChain.isEmpty();
    }
}

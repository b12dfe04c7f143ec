package me.golemcore.crm.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.ModelTarget;
import me.golemcore.crm.domain.model.ModelTier;
import me.golemcore.crm.infrastructure.config.ModelCapabilityService;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves which model a node uses for a user and how each call is
 * parameterized.
 *
 * <p>
 * Resolution reads the user's overrides through {@link NodeConfigCache}.
 * Settings stay unfiltered on the {@link ModelSelection}; they are filtered per
 * call in {@link #target(ModelSelection, String)} because fallback tiers may run
 * on models with different parameter support.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelSelectionService {

    private final NodeConfigCache configCache;
    private final ModelCapabilityService modelCapabilities;

    public ModelSelection resolve(String userId, AgentNode node) {
        String model = configCache.getModel(userId, node);
        String provider = configCache.getProvider(userId, node);
        LlmSettings settings = configCache.getSettings(userId, node);
        List<ModelTier> chain = configCache.getModelChain(userId, node);

        ModelSelection selection = new ModelSelection(node, model, provider, settings, chain);
        log.info("[Config] user={} | {}: {}", userId, node.getConfigKey(), describe(selection));
        return selection;
    }

    /**
     * Call target for {@code model}, which is either the selection's primary
     * model or one of its tiers. Tier models take their provider from the model
     * catalog and fall back to the node's provider for unknown models.
     */
    public ModelTarget target(ModelSelection selection, String model) {
        String provider;
        if (model.equals(selection.model())) {
            provider = selection.provider();
        } else if (modelCapabilities.isKnownModel(model)) {
            provider = modelCapabilities.getProvider(model);
        } else {
            provider = selection.provider();
        }
        return new ModelTarget(model, provider, modelCapabilities.filterSettings(model, selection.settings()));
    }

    private static String describe(ModelSelection selection) {
        boolean defaultModel = selection.model().equals(selection.node().getDefaultModel());
        if (defaultModel && selection.settings().isEmpty() && !selection.hasFallbackChain()) {
            return selection.model() + " (defaults)";
        }
        StringBuilder sb = new StringBuilder(selection.model());
        if (!selection.settings().isEmpty()) {
            sb.append(' ').append(selection.settings().describe());
        }
        if (selection.hasFallbackChain()) {
            sb.append(" chain=").append(selection.fallbackChain().stream()
                    .map(tier -> tier.model() + "@" + tier.firstTokenTimeout().toSeconds() + "s")
                    .toList());
        }
        return sb.toString();
    }
}

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
import me.golemcore.crm.domain.model.AgentConfigSnapshot;
import me.golemcore.crm.domain.model.AgentConfigSnapshot.NodeConfigRecord;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.port.outbound.AgentConfigPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and changes a user's stored node overrides. Every write invalidates
 * the user's entry in {@link NodeConfigCache} so the next turn sees it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentConfigService {

    private final AgentConfigPort configPort;
    private final NodeConfigCache configCache;

    /**
     * Configuration of every node for the user: the stored override where one
     * exists, the node defaults otherwise. Reads the store directly.
     */
    public List<EffectiveNodeConfig> getEffectiveConfig(String userId) {
        AgentConfigSnapshot snapshot = configPort.getUserConfig(userId);
        Map<AgentNode, NodeConfigRecord> overrides = new EnumMap<>(AgentNode.class);
        for (NodeConfigRecord record : snapshot.getNodes()) {
            AgentNode.fromConfigKey(record.getNodeName()).ifPresent(node -> overrides.put(node, record));
        }

        List<EffectiveNodeConfig> result = new ArrayList<>();
        for (AgentNode node : AgentNode.values()) {
            NodeConfigRecord override = overrides.get(node);
            if (override == null) {
                result.add(new EffectiveNodeConfig(node, node.getDefaultModel(), node.getDefaultProvider(), false,
                        null));
                continue;
            }
            String model = isBlank(override.getModel()) ? node.getDefaultModel() : override.getModel();
            String provider = isBlank(override.getProvider()) ? node.getDefaultProvider() : override.getProvider();
            result.add(new EffectiveNodeConfig(node, model, provider, true, override));
        }
        return result;
    }

    public void updateNode(String userId, AgentNode node, NodeConfigRecord record) {
        record.setNodeName(node.getConfigKey());
        configPort.saveNodeConfig(userId, record);
        configCache.invalidate(userId);
        log.info("[AgentConfig] Updated {} for user {}: model={}", node.getConfigKey(), userId, record.getModel());
    }

    public boolean resetNode(String userId, AgentNode node) {
        boolean removed = configPort.deleteNodeConfig(userId, node.getConfigKey());
        configCache.invalidate(userId);
        log.info("[AgentConfig] Reset {} for user {} (override existed: {})", node.getConfigKey(), userId, removed);
        return removed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Node configuration as the user sees it.
     */
    public record EffectiveNodeConfig(AgentNode node, String model, String provider, boolean customized,
            NodeConfigRecord override) {
    }
}

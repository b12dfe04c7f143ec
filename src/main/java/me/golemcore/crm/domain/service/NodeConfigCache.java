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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.model.AgentConfigSnapshot;
import me.golemcore.crm.domain.model.AgentConfigSnapshot.FallbackTierRecord;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.ModelTier;
import me.golemcore.crm.domain.model.NodeConfig;
import me.golemcore.crm.port.outbound.AgentConfigPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-user, per-node cache of model configuration in front of the
 * configuration service.
 *
 * <p>
 * A user is either <em>cold</em> (never loaded, or invalidated) or
 * <em>loaded</em>. The first lookup for a cold user loads the user's entire
 * node set in one call and then re-checks the requested node. For a loaded
 * user a missing node means "no override": defaults are returned without
 * another round trip until {@link #invalidate(String)} is called.
 *
 * <p>
 * A failed load leaves the user cold, so the caller gets defaults and the next
 * lookup tries again. Loads run outside the lock; only the repopulation takes
 * the write lock. A load that started before an invalidation of the same user
 * is discarded instead of restoring stale data.
 *
 * <p>
 * {@link #getModel}, {@link #getProvider} and {@link #getSettings} never fail
 * and fall back to the node defaults. {@link #getModelChain} has no default:
 * an empty chain disables tier promotion.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class NodeConfigCache {

    private static final TypeReference<List<FallbackTierRecord>> TIER_LIST_TYPE = new TypeReference<>() {
    };

    private final AgentConfigPort configPort;
    private final ObjectMapper objectMapper;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    // guarded by lock
    private final Map<String, Map<AgentNode, NodeConfig>> configsByUser = new HashMap<>();
    private final Map<String, Long> generations = new HashMap<>();

    public NodeConfigCache(AgentConfigPort configPort, ObjectMapper objectMapper) {
        this.configPort = configPort;
        this.objectMapper = objectMapper;
    }

    public String getModel(String userId, AgentNode node) {
        return resolve(userId, node)
                .filter(NodeConfig::hasModel)
                .map(NodeConfig::getModel)
                .orElse(node.getDefaultModel());
    }

    public String getProvider(String userId, AgentNode node) {
        return resolve(userId, node)
                .filter(NodeConfig::hasProvider)
                .map(NodeConfig::getProvider)
                .orElse(node.getDefaultProvider());
    }

    public LlmSettings getSettings(String userId, AgentNode node) {
        return resolve(userId, node)
                .map(NodeConfig::getSettings)
                .orElseGet(LlmSettings::empty);
    }

    public List<ModelTier> getModelChain(String userId, AgentNode node) {
        return resolve(userId, node)
                .map(config -> List.copyOf(config.getFallbackChain()))
                .orElse(List.of());
    }

    /**
     * Drop every cached node of the user. The next lookup reloads.
     */
    public void invalidate(String userId) {
        writeLock.lock();
        try {
            configsByUser.remove(userId);
            generations.merge(userId, 1L, Long::sum);
        } finally {
            writeLock.unlock();
        }
        log.info("[ConfigCache] Invalidated config for user {}", userId);
    }

    public boolean isLoaded(String userId) {
        readLock.lock();
        try {
            return configsByUser.containsKey(userId);
        } finally {
            readLock.unlock();
        }
    }

    private Optional<NodeConfig> resolve(String userId, AgentNode node) {
        CacheLookup lookup = lookup(userId, node);
        if (lookup.loaded()) {
            return Optional.ofNullable(lookup.config());
        }
        loadUser(userId, lookup.generation());
        return Optional.ofNullable(lookup(userId, node).config());
    }

    private CacheLookup lookup(String userId, AgentNode node) {
        readLock.lock();
        try {
            Map<AgentNode, NodeConfig> nodes = configsByUser.get(userId);
            long generation = generations.getOrDefault(userId, 0L);
            if (nodes == null) {
                return new CacheLookup(false, null, generation);
            }
            return new CacheLookup(true, nodes.get(node), generation);
        } finally {
            readLock.unlock();
        }
    }

    private void loadUser(String userId, long expectedGeneration) {
        AgentConfigSnapshot snapshot;
        try {
            snapshot = configPort.getUserConfig(userId);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[ConfigCache] Failed to load config for user {}, using defaults: {}", userId, e.getMessage());
            return;
        }

        Map<AgentNode, NodeConfig> nodes = toNodeConfigs(userId, snapshot);

        writeLock.lock();
        try {
            if (generations.getOrDefault(userId, 0L) != expectedGeneration) {
                log.debug("[ConfigCache] Discarding load for user {}: invalidated while loading", userId);
                return;
            }
            configsByUser.put(userId, nodes);
        } finally {
            writeLock.unlock();
        }
        log.debug("[ConfigCache] Loaded {} node override(s) for user {}", nodes.size(), userId);
    }

    private Map<AgentNode, NodeConfig> toNodeConfigs(String userId, AgentConfigSnapshot snapshot) {
        Map<AgentNode, NodeConfig> nodes = new EnumMap<>(AgentNode.class);
        if (snapshot == null || snapshot.getNodes() == null) {
            return nodes;
        }
        for (AgentConfigSnapshot.NodeConfigRecord record : snapshot.getNodes()) {
            Optional<AgentNode> node = AgentNode.fromConfigKey(record.getNodeName());
            if (node.isEmpty()) {
                log.debug("[ConfigCache] Ignoring unknown node '{}' for user {}", record.getNodeName(), userId);
                continue;
            }
            nodes.put(node.get(), NodeConfig.builder()
                    .model(trimToNull(record.getModel()))
                    .provider(trimToNull(record.getProvider()))
                    .settings(record.toSettings())
                    .fallbackChain(parseFallbackChain(userId, node.get(), record.getFallbackChain()))
                    .build());
        }
        return nodes;
    }

    /**
     * Parse a stored chain, {@code [{"model": "...", "timeout_seconds": N}]},
     * given either as a JSON array or as a string containing one. Malformed
     * chains disable promotion rather than failing the load.
     */
    List<ModelTier> parseFallbackChain(String userId, AgentNode node, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return new ArrayList<>();
        }
        List<FallbackTierRecord> records;
        try {
            if (raw.isTextual()) {
                String text = raw.asText();
                if (text.isBlank()) {
                    return new ArrayList<>();
                }
                records = objectMapper.readValue(text, TIER_LIST_TYPE);
            } else {
                records = objectMapper.convertValue(raw, TIER_LIST_TYPE);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[ConfigCache] Malformed fallback chain for user {} node {}: {}",
                    userId, node.getConfigKey(), e.getMessage());
            return new ArrayList<>();
        }

        List<ModelTier> tiers = new ArrayList<>();
        for (FallbackTierRecord record : records) {
            if (record == null || record.getModel() == null || record.getModel().isBlank()
                    || record.getTimeoutSeconds() == null || record.getTimeoutSeconds() <= 0) {
                log.warn("[ConfigCache] Skipping invalid tier {} for user {} node {}",
                        record, userId, node.getConfigKey());
                continue;
            }
            tiers.add(new ModelTier(record.getModel().trim(), Duration.ofSeconds(record.getTimeoutSeconds())));
        }
        return tiers;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record CacheLookup(boolean loaded, NodeConfig config, long generation) {
    }
}

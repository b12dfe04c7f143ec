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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.port.outbound.StoragePort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog of model capabilities: which provider serves a model and which
 * sampling parameters it accepts.
 *
 * <p>
 * Loaded from {@code models/models.json} in the workspace when present,
 * otherwise from the bundled {@code classpath:models.json}. Lookups try the
 * exact name, then the name without a {@code provider/} prefix, then the
 * longest catalog key the name starts with (so dated releases such as
 * {@code claude-sonnet-4-5-20250929} match {@code claude-sonnet-4-5}), then
 * the catalog defaults.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelCapabilityService {

    public static final String PARAM_TEMPERATURE = "temperature";
    public static final String PARAM_MAX_TOKENS = "max_tokens";
    public static final String PARAM_TOP_P = "top_p";
    public static final String PARAM_TOP_K = "top_k";
    public static final String PARAM_FREQUENCY_PENALTY = "frequency_penalty";
    public static final String PARAM_PRESENCE_PENALTY = "presence_penalty";

    private static final String MODELS_DIR = "models";
    private static final String CONFIG_FILE = "models.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private ModelsConfig config = new ModelsConfig();

    public ModelCapabilityService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        if (!loadFromWorkspace()) {
            loadFromClasspath();
        }
    }

    private boolean loadFromWorkspace() {
        try {
            String json = storagePort.getText(MODELS_DIR, CONFIG_FILE).join();
            if (json != null && !json.isBlank()) {
                config = objectMapper.readValue(json, ModelsConfig.class);
                log.info("[ModelCatalog] Loaded from workspace: {} models", config.getModels().size());
                return true;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[ModelCatalog] Failed to load from workspace: {}", e.getMessage());
        }
        return false;
    }

    private void loadFromClasspath() {
        ClassPathResource resource = new ClassPathResource(CONFIG_FILE);
        if (!resource.exists()) {
            log.warn("[ModelCatalog] No models.json found, using empty catalog");
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            config = objectMapper.readValue(new String(is.readAllBytes(), StandardCharsets.UTF_8),
                    ModelsConfig.class);
            log.info("[ModelCatalog] Loaded from classpath: {} models", config.getModels().size());
        } catch (IOException e) {
            log.warn("[ModelCatalog] Failed to load from classpath: {}", e.getMessage());
        }
    }

    public ModelCapabilities getCapabilities(String modelName) {
        if (modelName == null) {
            return config.getDefaults();
        }
        Map<String, ModelCapabilities> models = config.getModels();
        if (models.containsKey(modelName)) {
            return models.get(modelName);
        }
        String name = stripProviderPrefix(modelName);
        if (models.containsKey(name)) {
            return models.get(name);
        }
        return models.entrySet().stream()
                .filter(entry -> name.startsWith(entry.getKey()))
                .max(Comparator.comparingInt(entry -> entry.getKey().length()))
                .map(Map.Entry::getValue)
                .orElse(config.getDefaults());
    }

    public String getProvider(String modelName) {
        return getCapabilities(modelName).getProvider();
    }

    public boolean isKnownModel(String modelName) {
        return getCapabilities(modelName) != config.getDefaults();
    }

    /**
     * Drop settings the model does not accept. Models with exclusive sampling
     * take either temperature or top_p; when both are set, top_p is dropped.
     */
    public LlmSettings filterSettings(String modelName, LlmSettings settings) {
        if (settings == null || settings.isEmpty()) {
            return LlmSettings.empty();
        }
        ModelCapabilities capabilities = getCapabilities(modelName);
        Set<String> unsupported = Set.copyOf(capabilities.getUnsupportedParameters());
        LlmSettings.LlmSettingsBuilder filtered = settings.toBuilder();
        List<String> dropped = new ArrayList<>();

        if (settings.getTemperature() != null
                && (!capabilities.isSupportsTemperature() || unsupported.contains(PARAM_TEMPERATURE))) {
            filtered.temperature(null);
            dropped.add(PARAM_TEMPERATURE);
        }
        if (settings.getMaxTokens() != null && unsupported.contains(PARAM_MAX_TOKENS)) {
            filtered.maxTokens(null);
            dropped.add(PARAM_MAX_TOKENS);
        }
        if (settings.getTopP() != null && (unsupported.contains(PARAM_TOP_P)
                || capabilities.isExclusiveSampling() && settings.getTemperature() != null
                        && !dropped.contains(PARAM_TEMPERATURE))) {
            filtered.topP(null);
            dropped.add(PARAM_TOP_P);
        }
        if (settings.getTopK() != null && unsupported.contains(PARAM_TOP_K)) {
            filtered.topK(null);
            dropped.add(PARAM_TOP_K);
        }
        if (settings.getFrequencyPenalty() != null && unsupported.contains(PARAM_FREQUENCY_PENALTY)) {
            filtered.frequencyPenalty(null);
            dropped.add(PARAM_FREQUENCY_PENALTY);
        }
        if (settings.getPresencePenalty() != null && unsupported.contains(PARAM_PRESENCE_PENALTY)) {
            filtered.presencePenalty(null);
            dropped.add(PARAM_PRESENCE_PENALTY);
        }

        if (!dropped.isEmpty()) {
            log.debug("[ModelCatalog] Dropped {} for model {}", dropped, modelName);
        }
        return filtered.build();
    }

    private static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        private Map<String, ModelCapabilities> models = new HashMap<>();
        private ModelCapabilities defaults = new ModelCapabilities();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelCapabilities {
        private String provider = "openai";
        private String displayName;
        private boolean supportsTemperature = true;
        /** Accepts temperature or top_p, never both. */
        private boolean exclusiveSampling = false;
        private List<String> unsupportedParameters = new ArrayList<>();
    }
}

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
 * Effective configuration of one node for one user, as held by the
 * configuration cache.
 */
@Data
@Builder
public class NodeConfig {

    private String model;
    private String provider;

    @Builder.Default
    private LlmSettings settings = LlmSettings.empty();

    @Builder.Default
    private List<ModelTier> fallbackChain = new ArrayList<>();

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    public boolean hasProvider() {
        return provider != null && !provider.isBlank();
    }
}

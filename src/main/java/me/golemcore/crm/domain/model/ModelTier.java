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

import java.time.Duration;
import java.util.Objects;

/**
 * One entry of an ordered fallback chain: a model and the longest acceptable
 * wait for its first output token.
 */
public record ModelTier(String model, Duration firstTokenTimeout) {

    public ModelTier {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(firstTokenTimeout, "firstTokenTimeout");
        if (firstTokenTimeout.isNegative() || firstTokenTimeout.isZero()) {
            throw new IllegalArgumentException("firstTokenTimeout must be positive: " + firstTokenTimeout);
        }
    }
}

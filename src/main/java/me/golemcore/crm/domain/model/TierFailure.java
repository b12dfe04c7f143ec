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

/**
 * Reason a single fallback tier did not produce a response.
 *
 * @param tierIndex
 *            position of the tier in the chain (0-based)
 * @param model
 *            model attempted at this tier
 * @param kind
 *            whether the tier timed out waiting for its first token or failed
 * @param reason
 *            human-readable detail
 */
public record TierFailure(int tierIndex, String model, Kind kind, String reason) {

    public enum Kind {
        FIRST_TOKEN_TIMEOUT, ERROR
    }

    @Override
    public String toString() {
        return "tier " + tierIndex + " (" + model + "): " + kind + " - " + reason;
    }
}

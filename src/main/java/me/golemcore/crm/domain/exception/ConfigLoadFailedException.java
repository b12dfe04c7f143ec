package me.golemcore.crm.domain.exception;

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
 * The configuration service could not supply a user's node configuration.
 * Raised by configuration adapters and absorbed by the configuration cache,
 * which falls back to defaults.
 */
public class ConfigLoadFailedException extends AgentRuntimeException {

    private final String userId;

    public ConfigLoadFailedException(String userId, String message, Throwable cause) {
        super("Failed to load agent config for user " + userId + ": " + message, cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}

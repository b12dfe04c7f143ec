package me.golemcore.crm.port.outbound;

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

import me.golemcore.crm.domain.exception.ConfigLoadFailedException;
import me.golemcore.crm.domain.model.AgentConfigSnapshot;

/**
 * Port to the authoritative per-user agent configuration store.
 */
public interface AgentConfigPort {

    /**
     * Load every node override the user has stored. Users without overrides
     * yield an empty snapshot.
     *
     * @throws ConfigLoadFailedException
     *             when the store cannot be reached or read
     */
    AgentConfigSnapshot getUserConfig(String userId);

    /**
     * Insert or replace the override of {@code record.nodeName}.
     */
    void saveNodeConfig(String userId, AgentConfigSnapshot.NodeConfigRecord record);

    /**
     * Remove the override of a node, restoring its defaults.
     *
     * @return {@code true} if an override existed
     */
    boolean deleteNodeConfig(String userId, String nodeName);
}

package me.golemcore.crm.adapter.outbound.config;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.exception.ConfigLoadFailedException;
import me.golemcore.crm.domain.model.AgentConfigSnapshot;
import me.golemcore.crm.domain.model.AgentConfigSnapshot.NodeConfigRecord;
import me.golemcore.crm.port.outbound.AgentConfigPort;
import me.golemcore.crm.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Agent configuration kept as one JSON document per user,
 * {@code agent-config/<escaped userId>.json}, in the local workspace.
 *
 * <p>
 * Writes are read-modify-write under the adapter's monitor, so concurrent
 * updates of one process do not lose nodes.
 */
@Component
@Slf4j
public class StorageAgentConfigAdapter implements AgentConfigPort {

    private static final String CONFIG_DIR = "agent-config";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public StorageAgentConfigAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentConfigSnapshot getUserConfig(String userId) {
        String json;
        try {
            json = storagePort.getText(CONFIG_DIR, fileName(userId)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConfigLoadFailedException(userId, cause.getMessage(), cause);
        }
        if (json == null || json.isBlank()) {
            return AgentConfigSnapshot.empty(userId);
        }
        try {
            AgentConfigSnapshot snapshot = objectMapper.readValue(json, AgentConfigSnapshot.class);
            snapshot.setUserId(userId);
            if (snapshot.getNodes() == null) {
                snapshot.setNodes(new ArrayList<>());
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new ConfigLoadFailedException(userId, "malformed config document", e);
        }
    }

    @Override
    public synchronized void saveNodeConfig(String userId, NodeConfigRecord record) {
        AgentConfigSnapshot snapshot = getUserConfig(userId);
        List<NodeConfigRecord> nodes = new ArrayList<>(snapshot.getNodes());
        nodes.removeIf(existing -> record.getNodeName().equals(existing.getNodeName()));
        nodes.add(record);
        snapshot.setNodes(nodes);
        write(userId, snapshot);
    }

    @Override
    public synchronized boolean deleteNodeConfig(String userId, String nodeName) {
        AgentConfigSnapshot snapshot = getUserConfig(userId);
        List<NodeConfigRecord> nodes = new ArrayList<>(snapshot.getNodes());
        boolean removed = nodes.removeIf(existing -> nodeName.equals(existing.getNodeName()));
        if (removed) {
            snapshot.setNodes(nodes);
            write(userId, snapshot);
        }
        return removed;
    }

    private void write(String userId, AgentConfigSnapshot snapshot) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
            storagePort.putTextAtomic(CONFIG_DIR, fileName(userId), json).join();
            log.debug("[AgentConfig] Saved {} node override(s) for user {}", snapshot.getNodes().size(), userId);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config of user " + userId, e);
        }
    }

    /**
     * Escapes every byte outside {@code [A-Za-z0-9-]} as {@code _XX}, so
     * distinct user ids never share a file.
     */
    static String fileName(String userId) {
        StringBuilder name = new StringBuilder(userId.length() + 5);
        for (byte b : userId.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-') {
                name.append(c);
            } else {
                name.append('_').append(String.format("%02X", b & 0xFF));
            }
        }
        return name.append(".json").toString();
    }
}

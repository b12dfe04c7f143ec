package me.golemcore.crm.domain.worker;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.model.AgentNode;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Worker lookup by node. Every worker node must have exactly one
 * implementation; a gap fails at startup rather than mid-turn.
 */
@Component
@Slf4j
public class WorkerRegistry {

    private final Map<AgentNode, Worker> workers = new EnumMap<>(AgentNode.class);

    public WorkerRegistry(List<Worker> workers) {
        for (Worker worker : workers) {
            AgentNode node = worker.getNode();
            if (!node.isWorker()) {
                throw new IllegalStateException(node.getConfigKey() + " is not a worker node");
            }
            if (this.workers.putIfAbsent(node, worker) != null) {
                throw new IllegalStateException("Duplicate worker for " + node.getConfigKey());
            }
        }
        List<String> missing = Arrays.stream(AgentNode.values())
                .filter(AgentNode::isWorker)
                .filter(node -> !this.workers.containsKey(node))
                .map(AgentNode::getConfigKey)
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No worker registered for " + missing);
        }
        log.info("[Workers] Registered {} workers", this.workers.size());
    }

    public Worker get(AgentNode node) {
        Worker worker = workers.get(node);
        if (worker == null) {
            throw new IllegalArgumentException("Not a worker node: " + node);
        }
        return worker;
    }
}

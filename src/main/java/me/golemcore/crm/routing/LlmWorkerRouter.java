package me.golemcore.crm.routing;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.exception.TurnCancelledException;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.LlmResponse;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.ModelTarget;
import me.golemcore.crm.domain.model.RoutingContext;
import me.golemcore.crm.domain.service.JsonBlockExtractor;
import me.golemcore.crm.domain.service.ModelSelectionService;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Router that asks the {@code triage_orchestrator} model to classify the turn.
 *
 * <p>
 * The model sees the worker catalog, the last few history messages and the
 * user message, and answers with {@code {"worker": "...", "reason": "..."}}.
 * The keyword router decides instead when classification is disabled
 * ({@code agent.routing.llm-classifier-enabled}), times out, fails, or names
 * something that is not a worker. Cancelling the turn aborts a pending
 * classification and propagates instead of falling back.
 *
 * @since 1.0
 */
@Component
@Primary
@Slf4j
public class LlmWorkerRouter implements WorkerRouter {

    private static final int CONTEXT_MESSAGES = 3;

    private static final String SYSTEM_PROMPT = """
            You route messages of a CRM assistant to exactly one worker.
            Pick the single worker that fits the user's latest message best, using the conversation
            context to resolve short follow-ups. Use general_worker when nothing else fits.
            Respond ONLY with JSON: {"worker": "worker_name", "reason": "brief explanation"}
            """;

    private final AgentProperties properties;
    private final ModelSelectionService modelSelectionService;
    private final LlmPort llmPort;
    private final KeywordWorkerRouter keywordRouter;
    private final ObjectMapper objectMapper;

    public LlmWorkerRouter(AgentProperties properties, ModelSelectionService modelSelectionService,
            LlmPort llmPort, KeywordWorkerRouter keywordRouter, ObjectMapper objectMapper) {
        this.properties = properties;
        this.modelSelectionService = modelSelectionService;
        this.llmPort = llmPort;
        this.keywordRouter = keywordRouter;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentNode route(RoutingContext context, CancellationToken token) {
        token.throwIfCancelled();
        if (!properties.getRouting().isLlmClassifierEnabled()) {
            return keywordRouter.route(context, token);
        }

        long timeoutMs = properties.getRouting().getClassifierTimeoutMs();
        try {
            ModelSelection selection = modelSelectionService.resolve(context.userId(), AgentNode.TRIAGE_ORCHESTRATOR);
            ModelTarget target = modelSelectionService.target(selection, selection.model());
            LlmRequest request = LlmRequest.builder()
                    .model(target.model())
                    .provider(target.provider())
                    .settings(target.settings())
                    .systemPrompt(SYSTEM_PROMPT)
                    .messages(List.of(Message.builder()
                            .role(Message.ROLE_USER)
                            .content(buildPrompt(context))
                            .build()))
                    .build();

            long startMs = System.currentTimeMillis();
            CompletableFuture<LlmResponse> pending = llmPort.chat(request);
            LlmResponse response;
            try (CancellationToken.Registration registration = token.onCancel(() -> pending.cancel(true))) {
                response = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            }
            log.debug("[Router] Classifier responded in {}ms", System.currentTimeMillis() - startMs);

            Optional<AgentNode> classified = parseResponse(response != null ? response.getContent() : null);
            if (classified.isPresent()) {
                log.info("[Router] Classified as {}", classified.get().getConfigKey());
                return classified.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Router] Classification interrupted, using keyword rules");
        } catch (TurnCancelledException e) {
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            token.throwIfCancelled();
            log.warn("[Router] Classification failed, using keyword rules: {}", e.getMessage());
        }
        return keywordRouter.route(context, token);
    }

    String buildPrompt(RoutingContext context) {
        StringBuilder sb = new StringBuilder("## Workers\n");
        Arrays.stream(AgentNode.values())
                .filter(AgentNode::isWorker)
                .forEach(node -> sb.append("- ").append(node.getConfigKey())
                        .append(": ").append(node.getDescription()).append('\n'));

        List<Message> history = context.history();
        if (!history.isEmpty()) {
            sb.append("\n## Conversation Context\n");
            for (int i = Math.max(0, history.size() - CONTEXT_MESSAGES); i < history.size(); i++) {
                Message message = history.get(i);
                sb.append("- ").append(message.getRole()).append(": ")
                        .append(truncate(message.getContent(), 200)).append('\n');
            }
        }

        sb.append("\n## Current User Message\n").append(truncate(context.userMessage(), 1000));
        return sb.toString();
    }

    Optional<AgentNode> parseResponse(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode json = objectMapper.readTree(JsonBlockExtractor.extract(content));
            String worker = json.path("worker").asText(null);
            Optional<AgentNode> node = AgentNode.fromConfigKey(worker).filter(AgentNode::isWorker);
            if (node.isEmpty()) {
                log.warn("[Router] Classifier returned unknown worker: {}", worker);
            }
            return node;
        } catch (IOException e) {
            log.warn("[Router] Failed to parse classifier response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.exception.TurnCancelledException;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.EvaluationResult;
import me.golemcore.crm.domain.model.EvaluatorType;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.LlmResponse;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.ModelTarget;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Post-turn quality gate backed by the {@code evaluator} node's model.
 *
 * <p>
 * Empty output always fails with score 0. When the evaluator model cannot be
 * reached or answers with something unparsable, the output is approved: the
 * gate must never block a turn on its own failure. Cancellation is not such a
 * failure: it aborts the evaluator call and propagates.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ResponseEvaluator {

    private static final String RESPONSE_FORMAT = """

            Respond ONLY with JSON:
            {"feedback": "what is wrong or missing, empty if nothing", "success_criteria_met": true|false, \
            "user_input_needed": true|false, "score": 0-100}
            Set user_input_needed only when the assistant cannot proceed without information from the user.
            """;

    private final AgentProperties properties;
    private final ModelSelectionService modelSelectionService;
    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;

    public ResponseEvaluator(AgentProperties properties, ModelSelectionService modelSelectionService,
            LlmPort llmPort, ObjectMapper objectMapper) {
        this.properties = properties;
        this.modelSelectionService = modelSelectionService;
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
    }

    public EvaluationResult evaluate(String userId, String output, String originalRequest,
            EvaluatorType type, int attempt, CancellationToken token) {
        token.throwIfCancelled();
        if (output == null || output.isBlank()) {
            return EvaluationResult.builder()
                    .feedback("The response was empty.")
                    .successCriteriaMet(false)
                    .userInputNeeded(false)
                    .score(0)
                    .build();
        }

        try {
            ModelSelection selection = modelSelectionService.resolve(userId, AgentNode.EVALUATOR);
            ModelTarget target = modelSelectionService.target(selection, selection.model());
            LlmRequest request = LlmRequest.builder()
                    .model(target.model())
                    .provider(target.provider())
                    .settings(target.settings())
                    .systemPrompt(type.getRubric() + RESPONSE_FORMAT)
                    .messages(List.of(Message.builder()
                            .role(Message.ROLE_USER)
                            .content("## User request\n" + originalRequest
                                    + "\n\n## Assistant response (attempt " + (attempt + 1) + ")\n" + output)
                            .build()))
                    .build();

            CompletableFuture<LlmResponse> pending = llmPort.chat(request);
            LlmResponse response;
            try (CancellationToken.Registration registration = token.onCancel(() -> pending.cancel(true))) {
                response = pending.get(properties.getEvaluator().getTimeoutMs(), TimeUnit.MILLISECONDS);
            }
            EvaluationResult result = parse(response != null ? response.getContent() : null);
            log.info("[Evaluator] {} attempt {}: met={}, input_needed={}, score={}",
                    type, attempt + 1, result.isSuccessCriteriaMet(), result.isUserInputNeeded(), result.getScore());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Evaluator] Interrupted, approving output");
            return EvaluationResult.approved("Evaluation interrupted");
        } catch (TurnCancelledException e) {
            throw e;
        } catch (ExecutionException | TimeoutException | IOException | RuntimeException e) {
            token.throwIfCancelled();
            log.warn("[Evaluator] Evaluation failed, approving output: {}", e.getMessage());
            return EvaluationResult.approved("Evaluation unavailable");
        }
    }

    EvaluationResult parse(String content) throws IOException {
        if (content == null || content.isBlank()) {
            throw new IOException("empty evaluator response");
        }
        EvaluationResult result = objectMapper.readValue(JsonBlockExtractor.extract(content), EvaluationResult.class);
        result.setScore(Math.max(0, Math.min(100, result.getScore())));
        return result;
    }
}

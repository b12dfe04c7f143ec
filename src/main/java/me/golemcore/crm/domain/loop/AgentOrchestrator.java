package me.golemcore.crm.domain.loop;

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
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.EvaluationResult;
import me.golemcore.crm.domain.model.EvaluatorType;
import me.golemcore.crm.domain.model.LlmUsage;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ModelCallResult;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.RoutingContext;
import me.golemcore.crm.domain.model.TurnResult;
import me.golemcore.crm.domain.model.TurnStatus;
import me.golemcore.crm.domain.service.ModelFallbackController;
import me.golemcore.crm.domain.service.ModelSelectionService;
import me.golemcore.crm.domain.service.NodeConfigCache;
import me.golemcore.crm.domain.service.ResponseEvaluator;
import me.golemcore.crm.domain.worker.Worker;
import me.golemcore.crm.domain.worker.WorkerInvocation;
import me.golemcore.crm.domain.worker.WorkerRegistry;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.inbound.AgentTurnPort;
import me.golemcore.crm.port.outbound.SessionPort;
import me.golemcore.crm.routing.WorkerRouter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Turn pipeline of the agent runtime.
 *
 * <p>
 * For every user turn:
 * <ol>
 * <li>Ensure the session exists and read the history window</li>
 * <li>Route the turn to exactly one worker</li>
 * <li>Resolve the worker node's model configuration for the user</li>
 * <li>Run the worker through the fallback controller</li>
 * <li>Optionally evaluate the output and retry the same worker with the
 * evaluator's feedback, up to {@code agent.evaluator.max-retries} times</li>
 * <li>Append the user message and the final answer to the session</li>
 * </ol>
 *
 * <p>
 * Retries continue only while the evaluator reports the output as not
 * acceptable and not waiting on the user. A request for user input stops the
 * loop and surfaces the output; exceeding the ceiling surfaces the last output
 * with {@link TurnStatus#RETRY_CEILING_REACHED}. Exhausted tiers and
 * cancellation propagate to the caller and leave the session history
 * untouched; the token is checked once more right before anything is
 * recorded.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AgentOrchestrator implements AgentTurnPort {

    private final AgentProperties properties;
    private final SessionPort sessionPort;
    private final NodeConfigCache configCache;
    private final ModelSelectionService modelSelectionService;
    private final ModelFallbackController fallbackController;
    private final WorkerRouter router;
    private final WorkerRegistry workerRegistry;
    private final ResponseEvaluator evaluator;
    private final Clock clock;

    public AgentOrchestrator(AgentProperties properties, SessionPort sessionPort, NodeConfigCache configCache,
            ModelSelectionService modelSelectionService, ModelFallbackController fallbackController,
            WorkerRouter router, WorkerRegistry workerRegistry, ResponseEvaluator evaluator, Clock clock) {
        this.properties = properties;
        this.sessionPort = sessionPort;
        this.configCache = configCache;
        this.modelSelectionService = modelSelectionService;
        this.fallbackController = fallbackController;
        this.router = router;
        this.workerRegistry = workerRegistry;
        this.evaluator = evaluator;
        this.clock = clock;
    }

    @Override
    public TurnResult handleTurn(String sessionId, String userId, String userMessage, CancellationToken token) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(userMessage, "userMessage");
        CancellationToken cancellation = token != null ? token : CancellationToken.none();
        long startMs = clock.millis();

        log.info("[Orchestrator] Turn started: session={}, user={}", sessionId, userId);
        cancellation.throwIfCancelled();

        sessionPort.getOrCreateSession(sessionId, userId);
        List<Message> history = sessionPort.getMessages(sessionId, properties.getSession().getHistoryTokenBudget());
        log.debug("[Orchestrator] History window: {} message(s)", history.size());

        AgentNode node = router.route(new RoutingContext(userId, userMessage, history), cancellation);
        Worker worker = workerRegistry.get(node);
        log.info("[Orchestrator] Routed to {}", node.getConfigKey());

        ModelSelection selection = modelSelectionService.resolve(userId, node);

        boolean evaluate = properties.getEvaluator().isEnabled();
        int maxRetries = Math.max(0, properties.getEvaluator().getMaxRetries());
        EvaluatorType evaluatorType = EvaluatorType.forNode(node);

        int attempt = 0;
        String feedback = null;
        LlmUsage usage = LlmUsage.zero();
        EvaluationResult evaluation = null;
        ModelCallResult call;
        TurnStatus status;
        while (true) {
            call = runWorker(worker, selection, sessionId, userId, userMessage, history, feedback, cancellation);
            usage = usage.plus(call.getUsage());

            if (!evaluate) {
                status = TurnStatus.COMPLETED;
                break;
            }
            evaluation = evaluator.evaluate(userId, call.getContent(), userMessage, evaluatorType, attempt,
                    cancellation);
            if (evaluation.isUserInputNeeded()) {
                status = TurnStatus.AWAITING_USER_INPUT;
                break;
            }
            if (evaluation.isSuccessCriteriaMet()) {
                status = TurnStatus.COMPLETED;
                break;
            }
            if (attempt >= maxRetries) {
                log.warn("[Orchestrator] Retry ceiling ({}) reached for {}, surfacing last output",
                        maxRetries, node.getConfigKey());
                status = TurnStatus.RETRY_CEILING_REACHED;
                break;
            }
            attempt++;
            feedback = evaluation.getFeedback();
            log.info("[Orchestrator] Retrying {} ({}/{}): {}", node.getConfigKey(), attempt, maxRetries, feedback);
        }

        cancellation.throwIfCancelled();
        Instant now = clock.instant();
        sessionPort.addMessage(sessionId, Message.user(userMessage, now));
        sessionPort.addMessage(sessionId, Message.assistant(call.getContent(), now));
        sessionPort.recordUsage(sessionId, usage);

        log.info("[Orchestrator] Turn finished: session={}, node={}, model={}, status={}, attempts={}, {}ms",
                sessionId, node.getConfigKey(), call.getModel(), status, attempt + 1, clock.millis() - startMs);

        return TurnResult.builder()
                .sessionId(sessionId)
                .node(node)
                .model(call.getModel())
                .response(call.getContent())
                .status(status)
                .evaluation(evaluation)
                .attempts(attempt + 1)
                .usage(usage)
                .build();
    }

    @Override
    public void invalidateUserConfig(String userId) {
        configCache.invalidate(userId);
    }

    @Override
    public List<Message> getSessionHistory(String sessionId, int tokenBudget) {
        return sessionPort.getMessages(sessionId, tokenBudget);
    }

    private ModelCallResult runWorker(Worker worker, ModelSelection selection, String sessionId, String userId,
            String userMessage, List<Message> history, String feedback, CancellationToken token) {
        return fallbackController.execute(selection, model -> worker.execute(WorkerInvocation.builder()
                .sessionId(sessionId)
                .userId(userId)
                .userMessage(userMessage)
                .history(history)
                .target(modelSelectionService.target(selection, model))
                .feedback(feedback)
                .build()), token);
    }
}

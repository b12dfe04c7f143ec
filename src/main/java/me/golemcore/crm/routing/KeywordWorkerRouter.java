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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.RoutingContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule-based router. Each specialized worker owns a keyword list; the worker
 * with the most whole-word hits in the message wins, ties going to the earlier
 * entry. A message without hits inherits the worker of the previous user
 * message, so short follow-ups stay with their topic. Everything else goes to
 * the general worker.
 */
@Component
@Slf4j
public class KeywordWorkerRouter implements WorkerRouter {

    private static final Map<AgentNode, List<Pattern>> RULES = new LinkedHashMap<>();

    static {
        RULES.put(AgentNode.JOB_SEARCH_WORKER, compile(
                "job", "jobs", "career", "resume", "cv", "hiring", "position", "positions", "opening",
                "openings", "vacancy", "vacancies", "interview", "employment", "employer", "salary",
                "find work", "job search", "apply"));
        RULES.put(AgentNode.CRM_WORKER, compile(
                "crm", "contact", "contacts", "account", "accounts", "organization", "organizations",
                "company", "individual", "lookup", "look up", "record", "records", "deal", "deals",
                "lead", "leads", "pipeline"));
        RULES.put(AgentNode.WRITER_WORKER, compile(
                "write", "draft", "compose", "rewrite", "proofread", "email", "letter", "cover letter",
                "message to", "reply to", "summary", "summarize"));
    }

    @Override
    public AgentNode route(RoutingContext context, CancellationToken token) {
        token.throwIfCancelled();
        AgentNode byMessage = match(context.userMessage());
        if (byMessage != null) {
            log.debug("[Router] Keyword match: {}", byMessage.getConfigKey());
            return byMessage;
        }

        List<Message> history = context.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            Message message = history.get(i);
            if (!message.isUserMessage()) {
                continue;
            }
            AgentNode byHistory = match(message.getContent());
            if (byHistory != null) {
                log.debug("[Router] Follow-up of {} topic", byHistory.getConfigKey());
                return byHistory;
            }
            break;
        }
        return AgentNode.GENERAL_WORKER;
    }

    /**
     * Best-scoring worker for {@code text}, or {@code null} without any hit.
     */
    AgentNode match(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        AgentNode best = null;
        int bestScore = 0;
        for (Map.Entry<AgentNode, List<Pattern>> rule : RULES.entrySet()) {
            int score = 0;
            for (Pattern pattern : rule.getValue()) {
                if (pattern.matcher(normalized).find()) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = rule.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    private static List<Pattern> compile(String... keywords) {
        return java.util.Arrays.stream(keywords)
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"))
                .toList();
    }
}

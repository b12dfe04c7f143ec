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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.exception.SessionNotFoundException;
import me.golemcore.crm.domain.model.LlmUsage;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.SessionState;
import me.golemcore.crm.domain.model.UserFact;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory store of conversation sessions and per-user facts.
 *
 * <p>
 * Sessions live for the lifetime of the process. Messages are append-only and
 * kept in append order. History is served through a sliding window: the
 * longest suffix whose approximate token cost, at a fixed characters-per-token
 * ratio, fits the requested budget. Messages are never split.
 *
 * <p>
 * Sessions and facts are guarded by one read/write lock; reads proceed
 * concurrently and each mutation holds the write lock only for its own
 * duration. Returned sessions and lists are copies.
 */
@Service
@Slf4j
public class SessionService implements SessionPort {

    private final Clock clock;
    private final int charsPerToken;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    // guarded by lock
    private final Map<String, SessionState> sessions = new HashMap<>();
    private final Map<String, List<UserFact>> factsByUser = new HashMap<>();

    public SessionService(AgentProperties properties, Clock clock) {
        this.clock = clock;
        this.charsPerToken = Math.max(1, properties.getSession().getCharsPerToken());
    }

    @Override
    public SessionState getSession(String sessionId) {
        readLock.lock();
        try {
            return copyOf(require(sessionId));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean exists(String sessionId) {
        readLock.lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public SessionState createSession(String sessionId, String userId) {
        SessionState session = newSession(sessionId, userId);
        SessionState previous;
        writeLock.lock();
        try {
            previous = sessions.put(sessionId, session);
        } finally {
            writeLock.unlock();
        }
        if (previous != null) {
            log.warn("[Session] Replaced existing session {} ({} messages dropped)",
                    sessionId, previous.getMessages().size());
        } else {
            log.info("[Session] Created session {} for user {}", sessionId, userId);
        }
        return copyOf(session);
    }

    @Override
    public SessionState getOrCreateSession(String sessionId, String userId) {
        readLock.lock();
        try {
            SessionState existing = sessions.get(sessionId);
            if (existing != null) {
                return copyOf(existing);
            }
        } finally {
            readLock.unlock();
        }

        writeLock.lock();
        try {
            SessionState session = sessions.computeIfAbsent(sessionId, id -> {
                log.info("[Session] Created session {} for user {}", id, userId);
                return newSession(id, userId);
            });
            return copyOf(session);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void addMessage(String sessionId, Message message) {
        writeLock.lock();
        try {
            SessionState session = require(sessionId);
            session.getMessages().add(message);
            session.setUpdatedAt(clock.instant());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Message> getMessages(String sessionId, int tokenBudget) {
        readLock.lock();
        try {
            return window(require(sessionId).getMessages(), tokenBudget);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void recordUsage(String sessionId, LlmUsage usage) {
        if (usage == null) {
            return;
        }
        writeLock.lock();
        try {
            SessionState session = require(sessionId);
            session.setUsage(session.getUsage().plus(usage));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<UserFact> getUserMemory(String userId) {
        readLock.lock();
        try {
            return List.copyOf(factsByUser.getOrDefault(userId, List.of()));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void addUserFact(String userId, UserFact fact) {
        writeLock.lock();
        try {
            List<UserFact> facts = factsByUser.computeIfAbsent(userId, id -> new ArrayList<>());
            for (int i = 0; i < facts.size(); i++) {
                if (facts.get(i).key().equals(fact.key())) {
                    facts.set(i, fact);
                    return;
                }
            }
            facts.add(fact);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Longest suffix of {@code messages} whose total content length is at most
     * {@code tokenBudget * charsPerToken}. Scanning stops at the first message
     * that does not fit.
     */
    List<Message> window(List<Message> messages, int tokenBudget) {
        if (messages.isEmpty() || tokenBudget <= 0) {
            return List.of();
        }
        long budgetChars = (long) tokenBudget * charsPerToken;
        long usedChars = 0;
        int start = messages.size();
        for (int i = messages.size() - 1; i >= 0; i--) {
            int length = messages.get(i).contentLength();
            if (usedChars + length > budgetChars) {
                break;
            }
            usedChars += length;
            start = i;
        }
        return List.copyOf(messages.subList(start, messages.size()));
    }

    private SessionState require(String sessionId) {
        SessionState session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private SessionState newSession(String sessionId, String userId) {
        Instant now = clock.instant();
        return SessionState.builder()
                .sessionId(sessionId)
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static SessionState copyOf(SessionState session) {
        return SessionState.builder()
                .sessionId(session.getSessionId())
                .userId(session.getUserId())
                .messages(new ArrayList<>(session.getMessages()))
                .usage(session.getUsage())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}

package me.golemcore.crm.domain.service;

import me.golemcore.crm.domain.exception.SessionNotFoundException;
import me.golemcore.crm.domain.model.LlmUsage;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.SessionState;
import me.golemcore.crm.domain.model.UserFact;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SESSION = "session-1";
    private static final String USER = "42";

    private SessionService service;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getSession().setCharsPerToken(4);
        service = new SessionService(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Message user(String content) {
        return Message.user(content, NOW);
    }

    // ===== Lifecycle =====

    @Test
    void shouldCreateEmptySession() {
        SessionState session = service.createSession(SESSION, USER);

        assertEquals(SESSION, session.getSessionId());
        assertEquals(USER, session.getUserId());
        assertTrue(session.getMessages().isEmpty());
        assertEquals(NOW, session.getCreatedAt());
        assertTrue(service.exists(SESSION));
    }

    @Test
    void shouldReplaceExistingSessionOnCreate() {
        service.createSession(SESSION, USER);
        service.addMessage(SESSION, user("hello"));

        service.createSession(SESSION, USER);

        assertTrue(service.getSession(SESSION).getMessages().isEmpty());
    }

    @Test
    void shouldReturnExistingSessionFromGetOrCreate() {
        service.createSession(SESSION, USER);
        service.addMessage(SESSION, user("hello"));

        SessionState session = service.getOrCreateSession(SESSION, "other-user");

        assertEquals(USER, session.getUserId());
        assertEquals(1, session.getMessages().size());
    }

    @Test
    void shouldCreateSessionOnlyOnceUnderConcurrentGetOrCreate() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    service.getOrCreateSession(SESSION, USER);
                    service.addMessage(SESSION, user("x"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads, service.getSession(SESSION).getMessages().size());
    }

    @Test
    void shouldThrowForUnknownSession() {
        SessionNotFoundException e = assertThrows(SessionNotFoundException.class,
                () -> service.getSession("missing"));
        assertEquals("missing", e.getSessionId());
        assertThrows(SessionNotFoundException.class, () -> service.addMessage("missing", user("hi")));
        assertThrows(SessionNotFoundException.class, () -> service.getMessages("missing", 100));
        assertFalse(service.exists("missing"));
    }

    @Test
    void shouldReturnDefensiveCopy() {
        service.createSession(SESSION, USER);

        service.getSession(SESSION).getMessages().add(user("sneaky"));

        assertTrue(service.getSession(SESSION).getMessages().isEmpty());
    }

    // ===== History window =====

    @Test
    void shouldReturnAllMessagesWhenTheyFitBudget() {
        service.createSession(SESSION, USER);
        service.addMessage(SESSION, user("aaaa"));
        service.addMessage(SESSION, Message.assistant("bbbb", NOW));

        List<Message> window = service.getMessages(SESSION, 2);

        assertEquals(2, window.size());
        assertEquals("aaaa", window.get(0).getContent());
        assertEquals("bbbb", window.get(1).getContent());
    }

    @Test
    void shouldKeepMessageThatExactlyFillsBudget() {
        List<Message> messages = List.of(user("12345678"), user("1234"), user("1234"));

        assertEquals(2, service.window(messages, 2).size());
        assertEquals(3, service.window(messages, 4).size());
    }

    @Test
    void shouldStopAtFirstMessageThatDoesNotFit() {
        List<Message> messages = List.of(user("a"), user("x".repeat(40)), user("b"), user("c"));

        List<Message> window = service.window(messages, 5);

        assertEquals(List.of("b", "c"), window.stream().map(Message::getContent).toList());
    }

    @Test
    void shouldReturnEmptyWindowForZeroBudgetOrNoMessages() {
        assertTrue(service.window(List.of(user("a")), 0).isEmpty());
        assertTrue(service.window(List.of(user("a")), -3).isEmpty());
        assertTrue(service.window(List.of(), 100).isEmpty());
    }

    @Test
    void shouldReturnEmptyWindowWhenNewestMessageExceedsBudget() {
        assertTrue(service.window(List.of(user("short"), user("x".repeat(100))), 2).isEmpty());
    }

    @Test
    void shouldCountNullContentAsEmpty() {
        List<Message> messages = List.of(user("abcd"), new Message(Message.ROLE_ASSISTANT, null, NOW));

        assertEquals(2, service.window(messages, 1).size());
    }

    @Test
    void shouldReturnSameWindowForRepeatedReads() {
        service.createSession(SESSION, USER);
        service.addMessage(SESSION, user("one"));
        service.addMessage(SESSION, user("two"));

        assertEquals(service.getMessages(SESSION, 10), service.getMessages(SESSION, 10));
    }

    // ===== Usage =====

    @Test
    void shouldAccumulateUsage() {
        service.createSession(SESSION, USER);

        service.recordUsage(SESSION, new LlmUsage(10, 5, 15));
        service.recordUsage(SESSION, new LlmUsage(1, 2, 3));
        service.recordUsage(SESSION, null);

        assertEquals(new LlmUsage(11, 7, 18), service.getSession(SESSION).getUsage());
    }

    // ===== User memory =====

    @Test
    void shouldReturnEmptyMemoryForUnknownUser() {
        assertTrue(service.getUserMemory("nobody").isEmpty());
    }

    @Test
    void shouldUpsertFactsKeepingInsertionOrder() {
        service.addUserFact(USER, new UserFact("city", "Berlin"));
        service.addUserFact(USER, new UserFact("role", "engineer"));
        service.addUserFact(USER, new UserFact("city", "Lisbon"));

        assertEquals(List.of(new UserFact("city", "Lisbon"), new UserFact("role", "engineer")),
                service.getUserMemory(USER));
    }

    @Test
    void shouldKeepFactsPerUser() {
        service.addUserFact(USER, new UserFact("city", "Berlin"));
        service.addUserFact("7", new UserFact("city", "Paris"));

        assertEquals("Berlin", service.getUserMemory(USER).get(0).value());
        assertEquals("Paris", service.getUserMemory("7").get(0).value());
    }
}

package me.golemcore.crm.auto;

import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.outbound.AutomationProcessorPort;
import me.golemcore.crm.port.outbound.DigestSenderPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    private AgentProperties properties;
    private AutomationProcessorPort automations;
    private DigestSenderPort digests;
    private AgentScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getScheduler().setShutdownTimeout(Duration.ofSeconds(1));
        automations = mock(AutomationProcessorPort.class);
        digests = mock(DigestSenderPort.class);
        scheduler = new AgentScheduler(properties, List.of(automations), List.of(digests),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    // ===== Ticks =====

    @Test
    void shouldProcessDueAutomationsWithCurrentInstant() {
        scheduler.automationTick();

        verify(automations).processDueAutomations(NOW);
    }

    @Test
    void shouldSendDigestsForToday() {
        scheduler.digestTick();

        verify(digests).sendDailyDigests(LocalDate.of(2026, 3, 1));
    }

    @Test
    void shouldIsolateFailingCollaborators() {
        AutomationProcessorPort failing = mock(AutomationProcessorPort.class);
        doThrow(new IllegalStateException("db down")).when(failing).processDueAutomations(any());
        AgentScheduler isolated = new AgentScheduler(properties, List.of(failing, automations), List.of(digests),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertDoesNotThrow(isolated::automationTick);
        verify(automations).processDueAutomations(NOW);

        assertDoesNotThrow(isolated::automationTick);
        verify(automations, times(2)).processDueAutomations(NOW);
    }

    @Test
    void shouldSkipTickWhilePreviousIsRunning() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        }).when(automations).processDueAutomations(any());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> first = executor.submit(scheduler::automationTick);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            scheduler.automationTick();
            release.countDown();
            first.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        verify(automations, times(1)).processDueAutomations(any());
    }

    // ===== Digest time =====

    @Test
    void shouldDelayUntilDigestTimeLaterToday() {
        properties.getScheduler().setDigestTime("09:00");

        assertEquals(Duration.ofMinutes(30), scheduler.delayUntilNextDigest());
    }

    @Test
    void shouldDelayUntilTomorrowWhenDigestTimePassed() {
        properties.getScheduler().setDigestTime("08:00");

        assertEquals(Duration.ofHours(23).plusMinutes(30), scheduler.delayUntilNextDigest());
    }

    @Test
    void shouldUseDefaultDigestTimeWhenInvalid() {
        properties.getScheduler().setDigestTime("nine o'clock");

        assertEquals(Duration.ofMinutes(30), scheduler.delayUntilNextDigest());
    }

    @Test
    void shouldUseClockZoneForDigestTime() {
        AgentScheduler berlin = new AgentScheduler(properties, List.of(), List.of(),
                Clock.fixed(NOW, ZoneId.of("Europe/Berlin")));
        properties.getScheduler().setDigestTime("10:00");

        assertEquals(Duration.ofMinutes(30), berlin.delayUntilNextDigest());
    }

    @Test
    void shouldKeepLocalDigestTimeAcrossSpringForward() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        properties.getScheduler().setDigestTime("09:00");
        AgentScheduler dst = new AgentScheduler(properties, List.of(), List.of(),
                Clock.fixed(Instant.parse("2026-03-28T08:00:00Z"), berlin));

        ZonedDateTime fired = ZonedDateTime.of(2026, 3, 28, 9, 0, 0, 0, berlin);
        ZonedDateTime next = dst.nextDigestAfterRun(fired);

        assertEquals(ZonedDateTime.of(2026, 3, 29, 9, 0, 0, 0, berlin), next);
        assertEquals(Duration.ofHours(23), Duration.between(fired, next));
        assertEquals(Duration.ofHours(23), dst.delayUntilNextDigest());
    }

    @Test
    void shouldKeepLocalDigestTimeAcrossFallBack() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        properties.getScheduler().setDigestTime("09:00");
        AgentScheduler dst = new AgentScheduler(properties, List.of(), List.of(),
                Clock.fixed(Instant.parse("2026-10-24T07:00:00Z"), berlin));

        ZonedDateTime fired = ZonedDateTime.of(2026, 10, 24, 9, 0, 0, 0, berlin);
        ZonedDateTime next = dst.nextDigestAfterRun(fired);

        assertEquals(LocalTime.of(9, 0), next.toLocalTime());
        assertEquals(Duration.ofHours(25), Duration.between(fired, next));
    }

    @Test
    void shouldNotRepeatDigestSameDayWhenRunWokeEarly() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        properties.getScheduler().setDigestTime("09:00");
        AgentScheduler early = new AgentScheduler(properties, List.of(), List.of(),
                Clock.fixed(Instant.parse("2026-03-30T06:59:59.990Z"), berlin));

        ZonedDateTime fired = ZonedDateTime.of(2026, 3, 30, 9, 0, 0, 0, berlin);

        assertEquals(ZonedDateTime.of(2026, 3, 31, 9, 0, 0, 0, berlin), early.nextDigestAfterRun(fired));
    }

    // ===== Lifecycle =====

    @Test
    void shouldNotStartWhenDisabled() {
        properties.getScheduler().setEnabled(false);

        scheduler.init();

        assertFalse(scheduler.isRunning());
    }

    @Test
    void shouldRunAutomationTicksUntilStopped() {
        properties.getScheduler().setAutomationInterval(Duration.ofMillis(50));

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());
        verify(automations, timeout(2000).atLeast(2)).processDueAutomations(NOW);

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void shouldTolerateStopWithoutStart() {
        assertDoesNotThrow(scheduler::stop);
    }
}

package me.golemcore.crm.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.outbound.AutomationProcessorPort;
import me.golemcore.crm.port.outbound.DigestSenderPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background driver for time-triggered work.
 *
 * <p>
 * Two independent periodic actions run on a dedicated executor:
 * <ul>
 * <li>an automation tick every {@code agent.scheduler.automation-interval}
 * (default one minute) that hands due automations to every
 * {@link AutomationProcessorPort}</li>
 * <li>a daily digest at {@code agent.scheduler.digest-time} in the clock's
 * zone, sent through every {@link DigestSenderPort}. Each run schedules the
 * next one from the wall clock, so the local time holds across DST
 * changes.</li>
 * </ul>
 *
 * <p>
 * Each action is skipped, not queued, while its previous run is still in
 * progress. A failing collaborator is logged and does not affect later ticks
 * or the other collaborators. {@link #stop()} blocks until in-flight ticks
 * finish or the shutdown timeout passes, then interrupts them.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AgentScheduler {

    private static final LocalTime DEFAULT_DIGEST_TIME = LocalTime.of(9, 0);

    private final AgentProperties properties;
    private final List<AutomationProcessorPort> automationProcessors;
    private final List<DigestSenderPort> digestSenders;
    private final Clock clock;

    private final AtomicBoolean automationRunning = new AtomicBoolean(false);
    private final AtomicBoolean digestRunning = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> automationTask;
    private volatile ScheduledFuture<?> digestTask;

    public AgentScheduler(AgentProperties properties, List<AutomationProcessorPort> automationProcessors,
            List<DigestSenderPort> digestSenders, Clock clock) {
        this.properties = properties;
        this.automationProcessors = List.copyOf(automationProcessors);
        this.digestSenders = List.copyOf(digestSenders);
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("[Scheduler] Disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (isRunning()) {
            log.debug("[Scheduler] Already running");
            return;
        }
        AtomicInteger threadCounter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2, r -> {
            Thread t = new Thread(r, "agent-scheduler-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        scheduler = executor;

        Duration interval = properties.getScheduler().getAutomationInterval();
        automationTask = scheduler.scheduleAtFixedRate(this::automationTick,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);

        ZonedDateTime firstDigest = nextDigestAfter(ZonedDateTime.now(clock));
        Duration untilDigest = scheduleDigest(executor, firstDigest);

        log.info("[Scheduler] Started: automation every {}s, next digest in {}m",
                interval.toSeconds(), untilDigest.toMinutes());
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        if (automationTask != null) {
            automationTask.cancel(false);
        }
        if (digestTask != null) {
            digestTask.cancel(false);
        }
        scheduler.shutdown();
        Duration timeout = properties.getScheduler().getShutdownTimeout();
        try {
            if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Scheduler] Ticks still running after {}s, interrupting", timeout.toSeconds());
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        automationTask = null;
        digestTask = null;
        log.info("[Scheduler] Stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    void automationTick() {
        if (!automationRunning.compareAndSet(false, true)) {
            log.debug("[Scheduler] Automation tick skipped: previous tick still running");
            return;
        }
        try {
            var now = clock.instant();
            for (AutomationProcessorPort processor : automationProcessors) {
                try {
                    processor.processDueAutomations(now);
                } catch (Exception e) { // NOSONAR - isolate collaborator failures to this tick
                    log.error("[Scheduler] Automation processing failed: {}", e.getMessage(), e);
                }
            }
        } finally {
            automationRunning.set(false);
        }
    }

    void digestTick() {
        if (!digestRunning.compareAndSet(false, true)) {
            log.debug("[Scheduler] Digest tick skipped: previous digest still running");
            return;
        }
        try {
            LocalDate today = LocalDate.now(clock);
            log.info("[Scheduler] Sending daily digests for {}", today);
            for (DigestSenderPort sender : digestSenders) {
                try {
                    sender.sendDailyDigests(today);
                } catch (Exception e) { // NOSONAR - isolate collaborator failures to this tick
                    log.error("[Scheduler] Digest sending failed: {}", e.getMessage(), e);
                }
            }
        } finally {
            digestRunning.set(false);
        }
    }

    private Duration scheduleDigest(ScheduledExecutorService executor, ZonedDateTime at) {
        Duration delay = Duration.between(ZonedDateTime.now(clock), at);
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }
        try {
            digestTask = executor.schedule(() -> runDigest(executor, at), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Scheduler] Digest not rescheduled: scheduler stopped");
        }
        return delay;
    }

    private void runDigest(ScheduledExecutorService executor, ZonedDateTime firedAt) {
        try {
            digestTick();
        } finally {
            if (!executor.isShutdown()) {
                Duration delay = scheduleDigest(executor, nextDigestAfterRun(firedAt));
                log.debug("[Scheduler] Next digest in {}m", delay.toMinutes());
            }
        }
    }

    /**
     * Time from now until the next occurrence of the configured digest time.
     */
    Duration delayUntilNextDigest() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        return Duration.between(now, nextDigestAfter(now));
    }

    /**
     * Next digest after the one due at {@code firedAt}. A run that woke
     * slightly before its due time never schedules the same day twice.
     */
    ZonedDateTime nextDigestAfterRun(ZonedDateTime firedAt) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        return nextDigestAfter(now.isAfter(firedAt) ? now : firedAt);
    }

    /**
     * First digest time strictly after {@code from}, in local time of
     * {@code from}'s zone.
     */
    ZonedDateTime nextDigestAfter(ZonedDateTime from) {
        ZonedDateTime next = from.with(digestTime()).withSecond(0).withNano(0);
        if (!next.isAfter(from)) {
            next = next.plusDays(1).with(digestTime()).withSecond(0).withNano(0);
        }
        return next;
    }

    private LocalTime digestTime() {
        String configured = properties.getScheduler().getDigestTime();
        if (configured == null || configured.isBlank()) {
            return DEFAULT_DIGEST_TIME;
        }
        try {
            return LocalTime.parse(configured.trim());
        } catch (DateTimeParseException e) {
            log.warn("[Scheduler] Invalid digest time '{}', using {}", configured, DEFAULT_DIGEST_TIME);
            return DEFAULT_DIGEST_TIME;
        }
    }
}

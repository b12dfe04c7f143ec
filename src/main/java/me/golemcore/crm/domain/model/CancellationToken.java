package me.golemcore.crm.domain.model;

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
import me.golemcore.crm.domain.exception.TurnCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal threaded through every blocking operation of
 * a turn.
 *
 * <p>
 * Callers cancel explicitly via {@link #cancel(String)} or implicitly through a
 * deadline ({@link #withDeadline(Duration)}). Components that hold in-flight
 * work register a listener with {@link #onCancel(Runnable)} and abort that work
 * when it fires. Each listener runs at most once, on the cancelling thread, or
 * immediately if the token is already cancelled at registration time.
 *
 * @since 1.0
 */
@Slf4j
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private static final String DEFAULT_REASON = "cancelled by caller";

    private final boolean cancellable;
    // null while active; set once, together with the cancelled state
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * A token that cancels itself once {@code timeout} has elapsed.
     */
    public static CancellationToken withDeadline(Duration timeout) {
        CancellationToken token = create();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> token.cancel("deadline of " + timeout.toMillis() + "ms exceeded"));
        return token;
    }

    public boolean cancel() {
        return cancel(DEFAULT_REASON);
    }

    /**
     * Cancel the token and notify listeners.
     *
     * @return {@code true} if this call performed the cancellation
     */
    public boolean cancel(String cancelReason) {
        String effectiveReason = cancelReason != null ? cancelReason : DEFAULT_REASON;
        if (!cancellable || !reason.compareAndSet(null, effectiveReason)) {
            return false;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * Register work to run on cancellation. Closing the returned registration
     * removes the listener if it has not run yet.
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return () -> {
            };
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    public void throwIfCancelled() {
        String cancelReason = reason.get();
        if (cancelReason != null) {
            throw new TurnCancelledException(cancelReason);
        }
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[Cancellation] Listener failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

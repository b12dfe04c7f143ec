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
import me.golemcore.crm.domain.exception.AllTiersExhaustedException;
import me.golemcore.crm.domain.exception.StreamFailedException;
import me.golemcore.crm.domain.exception.TurnCancelledException;
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.LlmChunk;
import me.golemcore.crm.domain.model.LlmUsage;
import me.golemcore.crm.domain.model.ModelCallResult;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.ModelTier;
import me.golemcore.crm.domain.model.TierFailure;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Drives one model call through an ordered tier chain.
 *
 * <p>
 * For each tier a timer is armed for the tier's first-token timeout. If text
 * arrives first, the call streams to completion on that tier and no further
 * promotion happens; a failure after that point is a
 * {@link StreamFailedException}. If the timer fires or the tier fails before
 * its first token, the in-flight stream is cancelled and the next tier is
 * tried. When every tier fails, {@link AllTiersExhaustedException} carries one
 * {@link TierFailure} per tier in order.
 *
 * <p>
 * An empty chain means a single attempt on the selection's model with no
 * first-token timer; its failure is reported as exhaustion of that one
 * implicit tier.
 *
 * <p>
 * Cancelling the {@link CancellationToken} cancels the in-flight stream and
 * ends the call with {@link TurnCancelledException}; no further tier is tried.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ModelFallbackController {

    /**
     * Execute the call.
     *
     * @param selection
     *            resolved node configuration with its (possibly empty) chain
     * @param call
     *            opens a provider stream for the given model
     * @param token
     *            cancellation signal of the surrounding turn
     */
    public ModelCallResult execute(ModelSelection selection, Function<String, Flux<LlmChunk>> call,
            CancellationToken token) {
        token.throwIfCancelled();

        if (!selection.hasFallbackChain()) {
            AttemptResult attempt = attempt(0, selection.model(), null, call, token);
            if (attempt.failed()) {
                throw new AllTiersExhaustedException(List.of(attempt.failure()));
            }
            return toResult(attempt, selection.model(), 0, List.of());
        }

        List<ModelTier> chain = selection.fallbackChain();
        List<TierFailure> failures = new ArrayList<>();
        for (int i = 0; i < chain.size(); i++) {
            token.throwIfCancelled();
            ModelTier tier = chain.get(i);
            AttemptResult attempt = attempt(i, tier.model(), tier.firstTokenTimeout(), call, token);
            if (!attempt.failed()) {
                if (i > 0) {
                    log.info("[Fallback] {} answered on tier {} ({}) after {} promotion(s)",
                            selection.node().getConfigKey(), i, tier.model(), failures.size());
                }
                return toResult(attempt, tier.model(), i, failures);
            }
            failures.add(attempt.failure());
            log.warn("[Fallback] {} {}", selection.node().getConfigKey(), attempt.failure());
        }
        log.error("[Fallback] {}: all {} tiers exhausted", selection.node().getConfigKey(), chain.size());
        throw new AllTiersExhaustedException(failures);
    }

    private AttemptResult attempt(int tierIndex, String model, Duration firstTokenTimeout,
            Function<String, Flux<LlmChunk>> call, CancellationToken token) {
        AtomicBoolean streaming = new AtomicBoolean(false);
        StringBuilder content = new StringBuilder();
        AtomicReference<LlmUsage> usage = new AtomicReference<>();

        Flux<LlmChunk> stream;
        try {
            stream = call.apply(model);
        } catch (RuntimeException e) {
            return AttemptResult.failure(new TierFailure(tierIndex, model, TierFailure.Kind.ERROR, describe(e)));
        }

        Flux<LlmChunk> chunks = stream
                .doOnCancel(() -> log.info("[Fallback] Abandoned in-flight call to {} (tier {})", model, tierIndex))
                .filter(chunk -> chunk.hasText() || chunk.isDone());
        if (firstTokenTimeout != null) {
            chunks = chunks.timeout(Mono.delay(firstTokenTimeout), chunk -> Mono.never());
        }
        Mono<Void> completion = chunks.doOnNext(chunk -> {
            if (chunk.hasText()) {
                streaming.set(true);
                content.append(chunk.getText());
            }
            if (chunk.getUsage() != null) {
                usage.set(chunk.getUsage());
            }
        }).then();

        CompletableFuture<Void> future = new CompletableFuture<>();
        Disposable subscription = completion.subscribe(
                ignored -> {
                },
                future::completeExceptionally,
                () -> future.complete(null));

        try (CancellationToken.Registration registration = token.onCancel(() -> {
            subscription.dispose();
            future.cancel(false);
        })) {
            future.get();
            return AttemptResult.success(content.toString(), usage.get());
        } catch (CancellationException e) {
            log.info("[Fallback] Call to {} cancelled: {}", model, token.getReason());
            throw new TurnCancelledException(token.getReason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.dispose();
            throw new TurnCancelledException("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (token.isCancelled()) {
                throw new TurnCancelledException(token.getReason());
            }
            if (streaming.get()) {
                throw new StreamFailedException(model, content.toString(), cause);
            }
            if (cause instanceof TimeoutException && firstTokenTimeout != null) {
                return AttemptResult.failure(new TierFailure(tierIndex, model, TierFailure.Kind.FIRST_TOKEN_TIMEOUT,
                        "no first token within " + firstTokenTimeout.toMillis() + "ms"));
            }
            return AttemptResult.failure(new TierFailure(tierIndex, model, TierFailure.Kind.ERROR, describe(cause)));
        }
    }

    private static ModelCallResult toResult(AttemptResult attempt, String model, int tierIndex,
            List<TierFailure> failures) {
        return ModelCallResult.builder()
                .content(attempt.content())
                .model(model)
                .tierIndex(tierIndex)
                .usage(attempt.usage())
                .skippedTiers(new ArrayList<>(failures))
                .build();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private record AttemptResult(String content, LlmUsage usage, TierFailure failure) {

        static AttemptResult success(String content, LlmUsage usage) {
            return new AttemptResult(content, usage, null);
        }

        static AttemptResult failure(TierFailure failure) {
            return new AttemptResult(null, null, failure);
        }

        boolean failed() {
            return failure != null;
        }
    }
}

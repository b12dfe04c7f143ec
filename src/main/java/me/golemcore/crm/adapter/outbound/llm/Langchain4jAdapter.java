package me.golemcore.crm.adapter.outbound.llm;

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

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crm.domain.model.LlmChunk;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.LlmResponse;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.LlmUsage;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ToolDefinition;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.infrastructure.config.ModelCapabilityService;
import me.golemcore.crm.port.outbound.LlmPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LLM adapter on top of langchain4j.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic. The
 * provider comes from the request, or from the model catalog when the request
 * leaves it blank. Model clients are built lazily per provider and model and
 * reused; sampling settings travel with each {@link ChatRequest}.
 *
 * <p>
 * Streaming maps partial responses to {@link LlmChunk}s. Cancelling the
 * returned {@link Flux} stops delivery immediately; the HTTP exchange itself
 * runs to its own end because langchain4j exposes no abort for it.
 *
 * <p>
 * Non-streamed calls retry rate limits with exponential backoff.
 *
 * <p>
 * Configuration via {@code agent.llm.providers.<id>.api-key|base-url} and
 * {@code agent.llm.timeout-ms}.
 *
 * @see ModelCapabilityService
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int DEFAULT_MAX_OUTPUT_TOKENS = 4096;
    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final AgentProperties properties;
    private final ModelCapabilityService modelCapabilities;

    private final Map<String, ChatModel> chatModels = new ConcurrentHashMap<>();
    private final Map<String, StreamingChatModel> streamingModels = new ConcurrentHashMap<>();

    public Langchain4jAdapter(AgentProperties properties, ModelCapabilityService modelCapabilities) {
        this.properties = properties;
        this.modelCapabilities = modelCapabilities;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(AgentProperties.ProviderProperties::isConfigured);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            AtomicBoolean cancelled = new AtomicBoolean(false);
            sink.onCancel(() -> {
                cancelled.set(true);
                log.debug("[LLM] Stream for {} cancelled by subscriber", request.getModel());
            });

            StreamingChatModel model;
            ChatRequest chatRequest;
            try {
                model = streamingModelFor(request);
                chatRequest = toChatRequest(request);
            } catch (RuntimeException e) {
                sink.error(e);
                return;
            }

            model.chat(chatRequest, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (!cancelled.get()) {
                        sink.next(LlmChunk.builder().text(partialResponse).build());
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                    if (cancelled.get()) {
                        return;
                    }
                    sink.next(LlmChunk.builder()
                            .done(true)
                            .usage(toUsage(response.tokenUsage()))
                            .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                            .build());
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    if (!cancelled.get()) {
                        sink.error(error);
                    }
                }
            });
        });
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = chatModelFor(request);
            ChatRequest chatRequest = toChatRequest(request);
            int maxRetries = properties.getLlm().getMaxRetries();

            for (int attempt = 0;; attempt++) {
                try {
                    ChatResponse response = model.chat(chatRequest);
                    return LlmResponse.builder()
                            .content(response.aiMessage().text())
                            .model(request.getModel())
                            .usage(toUsage(response.tokenUsage()))
                            .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                            .build();
                } catch (RuntimeException e) {
                    if (!isRateLimitError(e) || attempt >= maxRetries) {
                        log.error("[LLM] Chat with {} failed: {}", request.getModel(), e.getMessage());
                        throw e;
                    }
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] Rate limit hit on {} (attempt {}/{}), retrying in {}ms",
                            request.getModel(), attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs);
                }
            }
        });
    }

    private StreamingChatModel streamingModelFor(LlmRequest request) {
        String provider = resolveProvider(request);
        String modelName = stripProviderPrefix(request.getModel());
        return streamingModels.computeIfAbsent(provider + "/" + modelName, key -> {
            AgentProperties.ProviderProperties config = getProviderConfig(provider);
            Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
            log.debug("[LLM] Creating streaming client {} via {}", modelName, provider);
            if (PROVIDER_ANTHROPIC.equals(provider)) {
                var builder = AnthropicStreamingChatModel.builder()
                        .apiKey(config.getApiKey())
                        .modelName(modelName)
                        .maxTokens(DEFAULT_MAX_OUTPUT_TOKENS)
                        .timeout(timeout);
                if (config.getBaseUrl() != null) {
                    builder.baseUrl(config.getBaseUrl());
                }
                return builder.build();
            }
            var builder = OpenAiStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        });
    }

    private ChatModel chatModelFor(LlmRequest request) {
        String provider = resolveProvider(request);
        String modelName = stripProviderPrefix(request.getModel());
        return chatModels.computeIfAbsent(provider + "/" + modelName, key -> {
            AgentProperties.ProviderProperties config = getProviderConfig(provider);
            Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
            log.debug("[LLM] Creating client {} via {}", modelName, provider);
            if (PROVIDER_ANTHROPIC.equals(provider)) {
                var builder = AnthropicChatModel.builder()
                        .apiKey(config.getApiKey())
                        .modelName(modelName)
                        .maxRetries(0)
                        .maxTokens(DEFAULT_MAX_OUTPUT_TOKENS)
                        .timeout(timeout);
                if (config.getBaseUrl() != null) {
                    builder.baseUrl(config.getBaseUrl());
                }
                return builder.build();
            }
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        });
    }

    private String resolveProvider(LlmRequest request) {
        if (request.getModel() == null || request.getModel().isBlank()) {
            throw new IllegalArgumentException("LLM request without model");
        }
        if (request.getProvider() != null && !request.getProvider().isBlank()) {
            return request.getProvider();
        }
        return modelCapabilities.getProvider(request.getModel());
    }

    private AgentProperties.ProviderProperties getProviderConfig(String provider) {
        AgentProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null || !config.isConfigured()) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add agent.llm.providers." + provider + ".api-key");
        }
        return config;
    }

    ChatRequest toChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request));

        LlmSettings settings = request.getSettings() != null ? request.getSettings() : LlmSettings.empty();
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        if (settings.getMaxTokens() != null) {
            builder.maxOutputTokens(settings.getMaxTokens());
        }
        if (settings.getTopP() != null) {
            builder.topP(settings.getTopP());
        }
        if (settings.getTopK() != null) {
            builder.topK(settings.getTopK());
        }
        if (settings.getFrequencyPenalty() != null) {
            builder.frequencyPenalty(settings.getFrequencyPenalty());
        }
        if (settings.getPresencePenalty() != null) {
            builder.presencePenalty(settings.getPresencePenalty());
        }

        List<ToolSpecification> tools = convertTools(request.getTools());
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message message : request.getMessages()) {
            String content = message.getContent() != null ? message.getContent() : "";
            if (message.isAssistantMessage()) {
                messages.add(AiMessage.from(content));
            } else {
                if (!message.isUserMessage()) {
                    log.warn("[LLM] Unknown message role: {}, treating as user message", message.getRole());
                }
                messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        return tools.stream()
                .map(tool -> ToolSpecification.builder()
                        .name(tool.getName())
                        .description(tool.getDescription())
                        .build())
                .toList();
    }

    private static LlmUsage toUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        return LlmUsage.builder()
                .inputTokens(orZero(tokenUsage.inputTokenCount()))
                .outputTokens(orZero(tokenUsage.outputTokenCount()))
                .totalTokens(orZero(tokenUsage.totalTokenCount()))
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static boolean isRateLimitError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && (message.contains("rate_limit") || message.contains("429")
                    || message.contains("Too Many Requests"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", e);
        }
    }

    private static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }
}

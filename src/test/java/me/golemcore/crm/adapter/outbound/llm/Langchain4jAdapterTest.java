package me.golemcore.crm.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ToolDefinition;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.infrastructure.config.ModelCapabilityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class Langchain4jAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AgentProperties properties;
    private ModelCapabilityService modelCapabilities;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        modelCapabilities = mock(ModelCapabilityService.class);
        when(modelCapabilities.getProvider(anyString())).thenReturn("anthropic");
        adapter = new Langchain4jAdapter(properties, modelCapabilities);
    }

    // ===== Request mapping =====

    @Test
    void shouldMapMessagesSettingsAndTools() {
        LlmRequest request = LlmRequest.builder()
                .model("gpt-5.2")
                .provider("openai")
                .systemPrompt("You are the CRM assistant.")
                .messages(List.of(
                        Message.user("who is our contact at Acme?", NOW),
                        Message.assistant("Jane Doe.", NOW),
                        Message.user("and her phone?", NOW)))
                .settings(LlmSettings.builder()
                        .temperature(0.2)
                        .maxTokens(1024)
                        .topP(0.9)
                        .frequencyPenalty(0.1)
                        .presencePenalty(0.3)
                        .build())
                .tools(List.of(new ToolDefinition("lookup_individual", "Find contacts")))
                .build();

        ChatRequest chatRequest = adapter.toChatRequest(request);

        assertEquals(4, chatRequest.messages().size());
        assertInstanceOf(SystemMessage.class, chatRequest.messages().get(0));
        assertInstanceOf(UserMessage.class, chatRequest.messages().get(1));
        assertInstanceOf(AiMessage.class, chatRequest.messages().get(2));
        assertEquals("Jane Doe.", ((AiMessage) chatRequest.messages().get(2)).text());
        assertEquals(0.2, chatRequest.temperature());
        assertEquals(1024, chatRequest.maxOutputTokens());
        assertEquals(0.9, chatRequest.topP());
        assertNull(chatRequest.topK());
        assertEquals(0.1, chatRequest.frequencyPenalty());
        assertEquals(0.3, chatRequest.presencePenalty());
        assertEquals(1, chatRequest.toolSpecifications().size());
        assertEquals("lookup_individual", chatRequest.toolSpecifications().get(0).name());
    }

    @Test
    void shouldLeaveUnsetSettingsToProviderDefaults() {
        ChatRequest chatRequest = adapter.toChatRequest(LlmRequest.builder()
                .model("gpt-5.2")
                .messages(List.of(Message.user("hi", NOW)))
                .build());

        assertEquals(1, chatRequest.messages().size());
        assertNull(chatRequest.temperature());
        assertNull(chatRequest.maxOutputTokens());
        assertTrue(chatRequest.toolSpecifications() == null || chatRequest.toolSpecifications().isEmpty());
    }

    // ===== Provider configuration =====

    @Test
    void shouldFailStreamWhenProviderNotConfigured() {
        LlmRequest request = LlmRequest.builder()
                .model("claude-sonnet-4-5")
                .messages(List.of(Message.user("hi", NOW)))
                .build();

        StepVerifier.create(adapter.chatStream(request))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(IllegalStateException.class, error);
                    assertTrue(error.getMessage().contains("anthropic"));
                })
                .verify();
        verify(modelCapabilities).getProvider("claude-sonnet-4-5");
    }

    @Test
    void shouldFailChatWhenProviderNotConfigured() {
        LlmRequest request = LlmRequest.builder()
                .model("gpt-5.2")
                .provider("openai")
                .messages(List.of(Message.user("hi", NOW)))
                .build();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.chat(request).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void shouldRejectRequestWithoutModel() {
        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void shouldReportAvailabilityFromConfiguredProviders() {
        assertFalse(adapter.isAvailable());

        AgentProperties.ProviderProperties openai = new AgentProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        assertTrue(adapter.isAvailable());
    }
}

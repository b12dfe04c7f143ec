package me.golemcore.crm.domain.service;

import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.ModelTarget;
import me.golemcore.crm.domain.model.ModelTier;
import me.golemcore.crm.infrastructure.config.ModelCapabilityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ModelSelectionServiceTest {

    private static final String USER = "42";

    private NodeConfigCache configCache;
    private ModelCapabilityService modelCapabilities;
    private ModelSelectionService service;

    @BeforeEach
    void setUp() {
        configCache = mock(NodeConfigCache.class);
        modelCapabilities = mock(ModelCapabilityService.class);
        when(modelCapabilities.filterSettings(anyString(), any())).thenAnswer(invocation -> invocation.getArgument(1));
        service = new ModelSelectionService(configCache, modelCapabilities);
    }

    @Test
    void shouldResolveSelectionFromCache() {
        List<ModelTier> chain = List.of(new ModelTier("gpt-4o", Duration.ofSeconds(5)));
        LlmSettings settings = LlmSettings.builder().temperature(0.1).build();
        when(configCache.getModel(USER, AgentNode.CRM_WORKER)).thenReturn("gpt-4.1");
        when(configCache.getProvider(USER, AgentNode.CRM_WORKER)).thenReturn("openai");
        when(configCache.getSettings(USER, AgentNode.CRM_WORKER)).thenReturn(settings);
        when(configCache.getModelChain(USER, AgentNode.CRM_WORKER)).thenReturn(chain);

        ModelSelection selection = service.resolve(USER, AgentNode.CRM_WORKER);

        assertEquals(AgentNode.CRM_WORKER, selection.node());
        assertEquals("gpt-4.1", selection.model());
        assertEquals("openai", selection.provider());
        assertEquals(settings, selection.settings());
        assertEquals(chain, selection.fallbackChain());
    }

    @Test
    void shouldUseNodeProviderForPrimaryModel() {
        ModelSelection selection = new ModelSelection(AgentNode.WRITER_WORKER, "custom-model", "anthropic",
                LlmSettings.empty(), List.of());

        ModelTarget target = service.target(selection, "custom-model");

        assertEquals("anthropic", target.provider());
        verify(modelCapabilities, never()).getProvider(anyString());
    }

    @Test
    void shouldUseCatalogProviderForKnownTierModel() {
        when(modelCapabilities.isKnownModel("claude-haiku-4-5")).thenReturn(true);
        when(modelCapabilities.getProvider("claude-haiku-4-5")).thenReturn("anthropic");
        ModelSelection selection = new ModelSelection(AgentNode.CRM_WORKER, "gpt-5.2", "openai",
                LlmSettings.empty(), List.of(new ModelTier("claude-haiku-4-5", Duration.ofSeconds(3))));

        ModelTarget target = service.target(selection, "claude-haiku-4-5");

        assertEquals("claude-haiku-4-5", target.model());
        assertEquals("anthropic", target.provider());
    }

    @Test
    void shouldUseNodeProviderForUnknownTierModel() {
        when(modelCapabilities.isKnownModel("fine-tuned-x")).thenReturn(false);
        ModelSelection selection = new ModelSelection(AgentNode.CRM_WORKER, "gpt-5.2", "openai",
                LlmSettings.empty(), List.of());

        assertEquals("openai", service.target(selection, "fine-tuned-x").provider());
    }

    @Test
    void shouldFilterSettingsForTargetModel() {
        LlmSettings settings = LlmSettings.builder().temperature(0.4).topK(20).build();
        LlmSettings filtered = LlmSettings.builder().temperature(0.4).build();
        when(modelCapabilities.filterSettings("gpt-5.2", settings)).thenReturn(filtered);
        ModelSelection selection = new ModelSelection(AgentNode.CRM_WORKER, "gpt-5.2", "openai", settings,
                List.of());

        assertEquals(filtered, service.target(selection, "gpt-5.2").settings());
    }
}

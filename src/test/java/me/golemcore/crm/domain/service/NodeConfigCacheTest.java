package me.golemcore.crm.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.crm.domain.exception.ConfigLoadFailedException;
import me.golemcore.crm.domain.model.AgentConfigSnapshot;
import me.golemcore.crm.domain.model.AgentConfigSnapshot.NodeConfigRecord;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.ModelTier;
import me.golemcore.crm.port.outbound.AgentConfigPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class NodeConfigCacheTest {

    private static final String USER = "42";
    private static final String OTHER_USER = "7";

    private AgentConfigPort configPort;
    private ObjectMapper objectMapper;
    private NodeConfigCache cache;

    @BeforeEach
    void setUp() {
        configPort = mock(AgentConfigPort.class);
        objectMapper = new ObjectMapper();
        cache = new NodeConfigCache(configPort, objectMapper);
    }

    private AgentConfigSnapshot snapshot(String userId, NodeConfigRecord... records) {
        return AgentConfigSnapshot.builder()
                .userId(userId)
                .nodes(new ArrayList<>(List.of(records)))
                .build();
    }

    // ===== Defaults =====

    @Test
    void shouldReturnDefaultsForEveryNodeWhenUserHasNoOverrides() {
        when(configPort.getUserConfig(USER)).thenReturn(AgentConfigSnapshot.empty(USER));

        for (AgentNode node : AgentNode.values()) {
            assertEquals(node.getDefaultModel(), cache.getModel(USER, node));
            assertEquals(node.getDefaultProvider(), cache.getProvider(USER, node));
            assertTrue(cache.getSettings(USER, node).isEmpty());
        }
    }

    @Test
    void shouldReturnDefaultsWhenLoadFails() {
        when(configPort.getUserConfig(USER))
                .thenThrow(new ConfigLoadFailedException(USER, "connection refused", null));

        assertEquals("gpt-5.2", cache.getModel(USER, AgentNode.CRM_WORKER));
        assertEquals("anthropic", cache.getProvider(USER, AgentNode.EVALUATOR));
        assertEquals(LlmSettings.empty(), cache.getSettings(USER, AgentNode.CRM_WORKER));
        assertTrue(cache.getModelChain(USER, AgentNode.CRM_WORKER).isEmpty());
        assertFalse(cache.isLoaded(USER));
    }

    @Test
    void shouldRetryLoadOnNextMissAfterFailure() {
        when(configPort.getUserConfig(USER))
                .thenThrow(new IllegalStateException("store down"))
                .thenReturn(snapshot(USER, NodeConfigRecord.builder()
                        .nodeName("crm_worker").model("gpt-4.1").build()));

        assertEquals("gpt-5.2", cache.getModel(USER, AgentNode.CRM_WORKER));
        assertEquals("gpt-4.1", cache.getModel(USER, AgentNode.CRM_WORKER));

        verify(configPort, times(2)).getUserConfig(USER);
    }

    @Test
    void shouldNotReturnDefaultChainWhenNoneConfigured() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("job_search_worker").model("gpt-4.1").build()));

        for (AgentNode node : AgentNode.values()) {
            assertTrue(cache.getModelChain(USER, node).isEmpty());
        }
    }

    // ===== Overrides and batching =====

    @Test
    void shouldServeOverridesForAllNodesFromSingleLoad() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER,
                NodeConfigRecord.builder().nodeName("crm_worker").model("claude-sonnet-4-5")
                        .provider("anthropic").temperature(0.2).maxTokens(2048).build(),
                NodeConfigRecord.builder().nodeName("writer_worker").model("gpt-4o").build()));

        assertEquals("claude-sonnet-4-5", cache.getModel(USER, AgentNode.CRM_WORKER));
        assertEquals("anthropic", cache.getProvider(USER, AgentNode.CRM_WORKER));
        assertEquals(0.2, cache.getSettings(USER, AgentNode.CRM_WORKER).getTemperature());
        assertEquals(2048, cache.getSettings(USER, AgentNode.CRM_WORKER).getMaxTokens());
        assertEquals("gpt-4o", cache.getModel(USER, AgentNode.WRITER_WORKER));
        assertEquals("openai", cache.getProvider(USER, AgentNode.WRITER_WORKER));

        verify(configPort, times(1)).getUserConfig(USER);
    }

    @Test
    void shouldNotReloadForNodeMissingFromLoadedUser() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("crm_worker").model("gpt-4.1").build()));

        cache.getModel(USER, AgentNode.CRM_WORKER);
        assertEquals("gpt-5.2", cache.getModel(USER, AgentNode.GENERAL_WORKER));
        assertEquals("claude-sonnet-4-5-20250929", cache.getModel(USER, AgentNode.EVALUATOR));

        verify(configPort, times(1)).getUserConfig(USER);
    }

    @Test
    void shouldFallBackToDefaultModelWhenOverrideHasBlankModel() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("crm_worker").model("  ").temperature(0.5).build()));

        assertEquals("gpt-5.2", cache.getModel(USER, AgentNode.CRM_WORKER));
        assertEquals(0.5, cache.getSettings(USER, AgentNode.CRM_WORKER).getTemperature());
    }

    @Test
    void shouldIgnoreUnknownNodeNames() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("legacy_node").model("gpt-4o").build()));

        assertEquals("gpt-5.2", cache.getModel(USER, AgentNode.GENERAL_WORKER));
        assertTrue(cache.isLoaded(USER));
    }

    @Test
    void shouldKeepUsersIsolated() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("crm_worker").model("gpt-4.1").build()));
        when(configPort.getUserConfig(OTHER_USER)).thenReturn(AgentConfigSnapshot.empty(OTHER_USER));

        assertEquals("gpt-4.1", cache.getModel(USER, AgentNode.CRM_WORKER));
        assertEquals("gpt-5.2", cache.getModel(OTHER_USER, AgentNode.CRM_WORKER));
    }

    // ===== Invalidation =====

    @Test
    void shouldReloadExactlyOnceAfterInvalidate() {
        when(configPort.getUserConfig(USER))
                .thenReturn(snapshot(USER, NodeConfigRecord.builder()
                        .nodeName("crm_worker").model("gpt-4.1").build()))
                .thenReturn(snapshot(USER, NodeConfigRecord.builder()
                        .nodeName("crm_worker").model("gpt-4o").build()));

        assertEquals("gpt-4.1", cache.getModel(USER, AgentNode.CRM_WORKER));
        verify(configPort, times(1)).getUserConfig(USER);

        cache.invalidate(USER);
        assertFalse(cache.isLoaded(USER));

        assertEquals("gpt-4o", cache.getModel(USER, AgentNode.CRM_WORKER));
        assertEquals("gpt-4o", cache.getModel(USER, AgentNode.CRM_WORKER));
        verify(configPort, times(2)).getUserConfig(USER);
    }

    @Test
    void shouldOnlyInvalidateGivenUser() {
        when(configPort.getUserConfig(anyString())).thenReturn(AgentConfigSnapshot.empty(USER));

        cache.getModel(USER, AgentNode.CRM_WORKER);
        cache.getModel(OTHER_USER, AgentNode.CRM_WORKER);
        cache.invalidate(USER);

        assertFalse(cache.isLoaded(USER));
        assertTrue(cache.isLoaded(OTHER_USER));
    }

    @Test
    void shouldDiscardLoadThatRacedWithInvalidate() throws Exception {
        CountDownLatch loadStarted = new CountDownLatch(1);
        CountDownLatch invalidated = new CountDownLatch(1);
        when(configPort.getUserConfig(USER)).thenAnswer(invocation -> {
            loadStarted.countDown();
            assertTrue(invalidated.await(5, TimeUnit.SECONDS));
            return snapshot(USER, NodeConfigRecord.builder().nodeName("crm_worker").model("stale-model").build());
        }).thenReturn(snapshot(USER, NodeConfigRecord.builder().nodeName("crm_worker").model("fresh-model").build()));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> first = executor.submit(() -> cache.getModel(USER, AgentNode.CRM_WORKER));
            assertTrue(loadStarted.await(5, TimeUnit.SECONDS));
            cache.invalidate(USER);
            invalidated.countDown();

            assertEquals("gpt-5.2", first.get(5, TimeUnit.SECONDS));
            assertFalse(cache.isLoaded(USER));
            assertEquals("fresh-model", cache.getModel(USER, AgentNode.CRM_WORKER));
        } finally {
            executor.shutdownNow();
        }
    }

    // ===== Fallback chains =====

    @Test
    void shouldParseFallbackChainFromJsonArray() throws Exception {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("crm_worker")
                .model("gpt-5.2")
                .fallbackChain(objectMapper.readTree("""
                        [{"model": "gpt-5.2", "timeout_seconds": 10},
                         {"model": "claude-haiku-4-5", "timeout_seconds": 20}]
                        """))
                .build()));

        List<ModelTier> chain = cache.getModelChain(USER, AgentNode.CRM_WORKER);

        assertEquals(List.of(
                new ModelTier("gpt-5.2", Duration.ofSeconds(10)),
                new ModelTier("claude-haiku-4-5", Duration.ofSeconds(20))), chain);
    }

    @Test
    void shouldParseFallbackChainStoredAsJsonString() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("writer_worker")
                .fallbackChain(new TextNode("[{\"model\": \"gpt-4o\", \"timeout_seconds\": 5}]"))
                .build()));

        assertEquals(List.of(new ModelTier("gpt-4o", Duration.ofSeconds(5))),
                cache.getModelChain(USER, AgentNode.WRITER_WORKER));
    }

    @Test
    void shouldTreatMalformedChainAsEmpty() {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("crm_worker")
                .model("gpt-4.1")
                .fallbackChain(new TextNode("not json"))
                .build()));

        assertTrue(cache.getModelChain(USER, AgentNode.CRM_WORKER).isEmpty());
        assertEquals("gpt-4.1", cache.getModel(USER, AgentNode.CRM_WORKER));
    }

    @Test
    void shouldSkipTiersWithoutModelOrPositiveTimeout() throws Exception {
        when(configPort.getUserConfig(USER)).thenReturn(snapshot(USER, NodeConfigRecord.builder()
                .nodeName("crm_worker")
                .fallbackChain(objectMapper.readTree("""
                        [{"model": "", "timeout_seconds": 10},
                         {"model": "gpt-4o", "timeout_seconds": 0},
                         {"model": "gpt-4.1"},
                         {"model": "gpt-5.2", "timeout_seconds": 3}]
                        """))
                .build()));

        assertEquals(List.of(new ModelTier("gpt-5.2", Duration.ofSeconds(3))),
                cache.getModelChain(USER, AgentNode.CRM_WORKER));
    }
}

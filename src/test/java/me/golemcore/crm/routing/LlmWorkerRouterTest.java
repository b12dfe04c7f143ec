package me.golemcore.crm.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.crm.domain.exception.TurnCancelledException;
import me.golemcore.crm.domain.model.AgentNode;
import me.golemcore.crm.domain.model.CancellationToken;
import me.golemcore.crm.domain.model.LlmRequest;
import me.golemcore.crm.domain.model.LlmResponse;
import me.golemcore.crm.domain.model.LlmSettings;
import me.golemcore.crm.domain.model.Message;
import me.golemcore.crm.domain.model.ModelSelection;
import me.golemcore.crm.domain.model.ModelTarget;
import me.golemcore.crm.domain.model.RoutingContext;
import me.golemcore.crm.domain.service.ModelSelectionService;
import me.golemcore.crm.infrastructure.config.AgentProperties;
import me.golemcore.crm.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmWorkerRouterTest {

    private AgentProperties properties;
    private ModelSelectionService modelSelectionService;
    private LlmPort llmPort;
    private LlmWorkerRouter router;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getRouting().setLlmClassifierEnabled(true);
        properties.getRouting().setClassifierTimeoutMs(200);
        modelSelectionService = mock(ModelSelectionService.class);
        llmPort = mock(LlmPort.class);
        ModelSelection selection = new ModelSelection(AgentNode.TRIAGE_ORCHESTRATOR, "gpt-5.2", "openai",
                LlmSettings.empty(), List.of());
        when(modelSelectionService.resolve("42", AgentNode.TRIAGE_ORCHESTRATOR)).thenReturn(selection);
        when(modelSelectionService.target(selection, "gpt-5.2"))
                .thenReturn(new ModelTarget("gpt-5.2", "openai", LlmSettings.empty()));
        router = new LlmWorkerRouter(properties, modelSelectionService, llmPort, new KeywordWorkerRouter(),
                new ObjectMapper());
    }

    private static RoutingContext context(String message) {
        return new RoutingContext("42", message, List.of());
    }

    private AgentNode route(String message) {
        return router.route(context(message), CancellationToken.none());
    }

    private void classifierAnswers(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }

    @Test
    void shouldUseClassifierDecision() {
        classifierAnswers("{\"worker\": \"writer_worker\", \"reason\": \"wants a letter\"}");

        assertEquals(AgentNode.WRITER_WORKER, route("help me with Acme"));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertEquals("gpt-5.2", request.getValue().getModel());
        assertEquals("openai", request.getValue().getProvider());
    }

    @Test
    void shouldAcceptFencedJson() {
        classifierAnswers("Sure!\n```json\n{\"worker\": \"crm_worker\"}\n```");

        assertEquals(AgentNode.CRM_WORKER, route("anything"));
    }

    @Test
    void shouldFallBackToKeywordsForNonWorkerNode() {
        classifierAnswers("{\"worker\": \"evaluator\"}");

        assertEquals(AgentNode.JOB_SEARCH_WORKER, route("find jobs in Berlin"));
    }

    @Test
    void shouldFallBackToKeywordsOnUnparseableAnswer() {
        classifierAnswers("I think the CRM worker");

        assertEquals(AgentNode.CRM_WORKER, route("look up this contact"));
    }

    @Test
    void shouldFallBackToKeywordsOnTimeout() {
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        assertEquals(AgentNode.JOB_SEARCH_WORKER, route("find jobs"));
    }

    @Test
    void shouldFallBackToKeywordsOnProviderError() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("500")));

        assertEquals(AgentNode.WRITER_WORKER, route("draft a reply"));
    }

    @Test
    void shouldNotCallLlmWhenClassifierDisabled() {
        properties.getRouting().setLlmClassifierEnabled(false);

        assertEquals(AgentNode.CRM_WORKER, route("show my contacts"));
        verifyNoInteractions(llmPort);
    }

    @Test
    void shouldListWorkersAndRecentContextInPrompt() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        RoutingContext context = new RoutingContext("42", "and in Munich?", List.of(
                Message.user("find jobs in Berlin", now),
                Message.assistant("Here are three openings.", now)));

        String prompt = router.buildPrompt(context);

        assertTrue(prompt.contains("job_search_worker"));
        assertTrue(prompt.contains("general_worker"));
        assertFalse(prompt.contains("- evaluator"));
        assertTrue(prompt.contains("user: find jobs in Berlin"));
        assertTrue(prompt.endsWith("and in Munich?"));
    }

    @Test
    void shouldParseOnlyWorkerNodes() {
        assertEquals(Optional.of(AgentNode.GENERAL_WORKER), router.parseResponse("{\"worker\": \"general_worker\"}"));
        assertTrue(router.parseResponse("{\"worker\": \"title_generator\"}").isEmpty());
        assertTrue(router.parseResponse("{}").isEmpty());
        assertTrue(router.parseResponse(null).isEmpty());
    }

    // ===== Cancellation =====

    @Test
    void shouldAbortClassificationWhenTurnIsCancelled() {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            token.cancel("client disconnected");
            return pending;
        });

        assertThrows(TurnCancelledException.class, () -> router.route(context("find jobs"), token));

        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldNotClassifyWhenAlreadyCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(TurnCancelledException.class, () -> router.route(context("find jobs"), token));

        verifyNoInteractions(llmPort);
    }
}

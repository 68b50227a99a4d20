package com.openforge.devgauge.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.analysis.AnalysisInstructions;
import com.openforge.devgauge.llm.LlmClient;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.PlanCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MemoryExtractorTest {

    private static final String USER = "user-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final PlanCatalog catalog = new PlanCatalog();
    private final PlanCapability student = catalog.get(PlanCatalog.STUDENT);

    private ModelGateway gateway;
    private MemoryStore store;
    private ExecutorService executor;
    private AgentMemory memory;
    private MemoryExtractor extractor;

    @BeforeEach
    void setUp() {
        gateway = mock(ModelGateway.class);
        store = mock(MemoryStore.class);
        executor = Executors.newSingleThreadExecutor();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        memory = new AgentMemory(10, clock);
        memory.setMemoryEnabled(true);
        extractor = new MemoryExtractor(gateway, new ResponseExtractor(new ObjectMapper()), store,
                MemoryProperties.defaults(), executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldStoreGoalsInsightsAndSummaryInOrder() {
        memory.addMessage(ConversationMessage.Role.USER, "I want a backend job at a fintech");
        memory.addMessage(ConversationMessage.Role.ASSISTANT, "Focus on Go and PostgreSQL.");
        when(gateway.complete(eq(AnalysisInstructions.EXTRACTION), anyString(), eq("m"))).thenReturn(
                "{\"goals\":[\"Backend role at a fintech\"],\"insights\":[\"Knows Go\", 3],\"summary\":\"Career chat\"}");
        List<MemoryItem> persisted = List.of(MemoryItem.of(MemoryType.CONTEXT, "older", NOW));
        when(store.addMemoryItems(eq(USER), eq(student), anyList())).thenReturn(persisted);

        List<MemoryItem> added = extractor.extract(USER, student, memory, "m").join();

        assertEquals(List.of(MemoryType.GOAL, MemoryType.INSIGHT, MemoryType.SUMMARY),
                added.stream().map(MemoryItem::type).toList());
        assertEquals(persisted, memory.longTerm());
        verify(gateway).complete(eq(AnalysisInstructions.EXTRACTION), startsWith("# CONVERSATION\nUSER: I want"), eq("m"));
    }

    @Test
    void shouldSkipWhenPlanHasNoMemory() {
        memory.addMessage(ConversationMessage.Role.USER, "hi");

        List<MemoryItem> added = extractor.extract(USER, catalog.get(PlanCatalog.FREE), memory, "m").join();

        assertTrue(added.isEmpty());
        verifyNoInteractions(gateway, store);
    }

    @Test
    void shouldSkipWhenMemoryDisabledOrHistoryEmpty() {
        assertTrue(extractor.extract(USER, student, memory, "m").join().isEmpty());

        memory.addMessage(ConversationMessage.Role.USER, "hi");
        memory.setMemoryEnabled(false);
        assertTrue(extractor.extract(USER, student, memory, "m").join().isEmpty());

        verifyNoInteractions(gateway);
    }

    @Test
    void shouldCompleteEmptyOnTransportFailure() {
        memory.addMessage(ConversationMessage.Role.USER, "hi");
        when(gateway.complete(anyString(), anyString(), any())).thenThrow(new LlmClient.LlmException("timeout"));

        List<MemoryItem> added = extractor.extract(USER, student, memory, "m").join();

        assertTrue(added.isEmpty());
        verify(store, never()).addMemoryItems(anyString(), any(), anyList());
    }

    @Test
    void shouldStoreNothingForEmptyExtraction() {
        memory.addMessage(ConversationMessage.Role.USER, "hi");
        when(gateway.complete(anyString(), anyString(), any())).thenReturn("{\"goals\":[],\"insights\":[],\"summary\":\"\"}");

        assertTrue(extractor.extract(USER, student, memory, "m").join().isEmpty());
        verify(store, never()).addMemoryItems(anyString(), any(), anyList());
    }

    @Test
    void shouldCompleteEmptyWhenExecutorRejects() {
        memory.addMessage(ConversationMessage.Role.USER, "hi");
        executor.shutdownNow();

        assertTrue(extractor.extract(USER, student, memory, "m").join().isEmpty());
    }
}

package com.openforge.devgauge.agent;

import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.CategoryKey;
import com.openforge.devgauge.analysis.CategoryScore;
import com.openforge.devgauge.analysis.Insights;
import com.openforge.devgauge.analysis.LevelName;
import com.openforge.devgauge.analysis.NormalizationEngine;
import com.openforge.devgauge.chat.ChatContext;
import com.openforge.devgauge.chat.ChatDocument;
import com.openforge.devgauge.chat.ChatService;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.memory.AgentMemory;
import com.openforge.devgauge.memory.AgentState;
import com.openforge.devgauge.memory.ConversationMessage;
import com.openforge.devgauge.memory.MemoryExtractor;
import com.openforge.devgauge.memory.MemoryItem;
import com.openforge.devgauge.memory.MemoryStore;
import com.openforge.devgauge.memory.MemoryType;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.PlanCatalog;
import com.openforge.devgauge.plan.UsageDecision;
import com.openforge.devgauge.plan.UsageService;
import com.openforge.devgauge.plan.UsageType;
import com.openforge.devgauge.skill.AnalyzeProfileSkill;
import com.openforge.devgauge.skill.ProjectIdea;
import com.openforge.devgauge.skill.SkillRegistry;
import com.openforge.devgauge.skill.SkillResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AnalysisAgentTest {

    private static final String USER = "user-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final Map<String, Object> METRICS = Map.of("totalRepos", 14, "totalCommits", 420);

    private final PlanCatalog catalog = new PlanCatalog();

    private ModelGateway gateway;
    private SkillRegistry skills;
    private MemoryStore memoryStore;
    private MemoryExtractor extractor;
    private ChatService chats;
    private UsageService usage;

    @BeforeEach
    void setUp() {
        gateway = mock(ModelGateway.class);
        skills = mock(SkillRegistry.class);
        memoryStore = mock(MemoryStore.class);
        extractor = mock(MemoryExtractor.class);
        chats = mock(ChatService.class);
        usage = mock(UsageService.class);
    }

    private AnalysisAgent agent(PlanCapability plan) {
        return new AnalysisAgent("s-1", USER, plan, new AgentMemory(10, CLOCK),
                gateway, skills, memoryStore, extractor, chats, usage, new NormalizationEngine());
    }

    private void allow(PlanCapability plan) {
        when(usage.checkLimit(eq(USER), any()))
                .thenReturn(new UsageDecision(true, plan.primaryModel(), false, 0, 50, plan));
    }

    private static AnalysisResult result(int level) {
        return new AnalysisResult(Map.of(), level, LevelName.forLevel(level), "Steady contributor",
                List.of("Open more PRs"), Insights.empty());
    }

    @Test
    void shouldRefuseAnalysisBeforeInitialization() {
        AnalysisAgent agent = agent(catalog.get(PlanCatalog.PRO));

        assertThrows(AgentNotInitializedException.class, () -> agent.analyzeProfile(null));
        verifyNoInteractions(skills, usage);
    }

    @Test
    void shouldRefuseSkillsWithoutContext() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().build());

        assertThrows(AgentNotInitializedException.class, () -> agent.recommendProjects(null));
    }

    @Test
    void shouldBlockPaidPlanOverLimit() {
        PlanCapability plan = catalog.get(PlanCatalog.STUDENT);
        when(usage.checkLimit(USER, UsageType.MESSAGES))
                .thenReturn(new UsageDecision(false, null, false, 50, 50, plan));
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());

        UsageLimitExceededException ex = assertThrows(UsageLimitExceededException.class,
                () -> agent.processMessage("hello", null, null, null));

        assertEquals(UsageType.MESSAGES, ex.type());
        assertEquals(50, ex.limit());
        verifyNoInteractions(gateway);
        verify(usage, never()).increment(anyString(), any());
    }

    @Test
    void shouldCreateChatOnFirstTurnAndAppendAfterwards() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("First answer", "Second answer");
        when(chats.create(eq(USER), eq("How am I doing?"), any())).thenReturn("chat-9");
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());

        AgentReply first = agent.processMessage("How am I doing?", null, null, null);
        AgentReply second = agent.processMessage("And now?", null, null, null);

        assertEquals("First answer", first.response());
        assertEquals(2, first.memoryStatus().messageCount());
        assertEquals(4, second.memoryStatus().messageCount());
        assertEquals(Optional.of("chat-9"), agent.chatId());
        verify(chats).addMessages(eq(USER), eq("chat-9"), argThat(list -> list.size() == 1));
        verify(chats).addMessages(eq(USER), eq("chat-9"), argThat(list -> list.size() == 2
                && list.get(0).role() == ConversationMessage.Role.USER));
        verify(usage, times(2)).increment(USER, UsageType.MESSAGES);
    }

    @Test
    void shouldBuildPromptFromContextAndPreferExplicitModel() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(memoryStore.load(USER, plan)).thenReturn(Optional.of(new AgentState(
                List.of(MemoryItem.of(MemoryType.GOAL, "Land a backend internship", CLOCK.instant())), true, null)));
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("ok");
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).priorResult(result(6)).build());

        agent.processMessage("What next?", null, null, "custom/model");

        verify(gateway).stream(anyString(), argThat(prompt -> prompt.contains("## METRICS")
                        && prompt.contains("CURRENT ANALYSIS RESULTS")
                        && prompt.contains("Land a backend internship")
                        && prompt.contains("# USER MESSAGE\nWhat next?")
                        && prompt.endsWith(AnalysisAgent.CHAT_CLOSING)),
                eq("custom/model"), any());
    }

    @Test
    void shouldKeepAnsweringWhenChatPersistenceFails() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("still here");
        when(chats.create(anyString(), anyString(), any())).thenThrow(new IllegalStateException("db down"));
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());

        AgentReply reply = agent.processMessage("hi", null, null, null);

        assertEquals("still here", reply.response());
        assertTrue(agent.chatId().isEmpty());
    }

    @Test
    void shouldResumeStoredChatAndFillMissingContext() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        ChatDocument stored = new ChatDocument("chat-1", "Earlier",
                new ChatContext(METRICS, null, result(8)),
                List.of(ConversationMessage.user("hello", CLOCK.instant()),
                        ConversationMessage.assistant("hi there", CLOCK.instant())),
                null, null);
        when(chats.get(USER, "chat-1")).thenReturn(Optional.of(stored));
        AnalysisAgent agent = agent(plan);

        agent.initialize(SessionSetup.builder().conversationRef("chat-1").build());

        assertEquals(Optional.of("chat-1"), agent.chatId());
        assertEquals(2, agent.memoryStatus().messageCount());
        assertTrue(agent.memoryStatus().hasContext());
    }

    @Test
    void shouldRederiveLevelOfSuppliedPriorResult() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("ok");
        AnalysisResult inconsistent = new AnalysisResult(
                Map.of(CategoryKey.ACTIVITY, new CategoryScore(CategoryKey.ACTIVITY, 10, 40, "", List.of())),
                9, LevelName.BURNT, "", List.of(), null);
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).priorResult(inconsistent).build());

        agent.processMessage("How am I doing?", null, null, null);

        verify(gateway).stream(anyString(), argThat(prompt -> prompt.contains("Level: 1/10, Level Name: \"Burnt\"")
                        && prompt.contains("- collaboration: 10/100 (15% weight)")
                        && !prompt.contains("9/10")),
                anyString(), any());
    }

    @Test
    void shouldRederiveStoredAnalysisWithoutLevelName() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("ok");
        AnalysisResult stored = new AnalysisResult(
                Map.of(CategoryKey.GROWTH, new CategoryScore(CategoryKey.GROWTH, 90, 0, "", List.of())),
                3, null, "", List.of(), null);
        when(chats.get(USER, "chat-2")).thenReturn(Optional.of(new ChatDocument("chat-2", "Earlier",
                new ChatContext(METRICS, null, stored), List.of(), null, null)));
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().conversationRef("chat-2").build());

        agent.processMessage("Any news?", null, null, null);

        verify(gateway).stream(anyString(), contains("Level: 9/10, Level Name: \"Cooking\""), anyString(), any());
    }

    @Test
    void shouldReplaceBaselineAfterAnalysis() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        AnalysisResult fresh = result(7);
        when(skills.execute(eq(AnalyzeProfileSkill.NAME), any()))
                .thenReturn(SkillResult.ok(AnalyzeProfileSkill.NAME, fresh));
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());
        assertFalse(agent.memoryStatus().hasPreviousAnalysis());

        AnalysisResult returned = agent.analyzeProfile(null);

        assertSame(fresh, returned);
        assertTrue(agent.memoryStatus().hasPreviousAnalysis());
        verify(usage).increment(USER, UsageType.REANALYZES);
    }

    @Test
    void shouldNotStoreMemoryOnFreePlan() {
        PlanCapability plan = catalog.get(PlanCatalog.FREE);
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());

        List<MemoryItem> items = agent.addMemory(MemoryItem.of(MemoryType.PREFERENCE, "likes Rust", null));

        assertTrue(items.isEmpty());
        assertFalse(agent.memoryStatus().memoryEnabled());
        verifyNoInteractions(memoryStore);
    }

    @Test
    void shouldStartExtractionAndClearHistoryOnEnd() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("ok");
        when(extractor.extract(eq(USER), eq(plan), any(), eq(plan.primaryModel())))
                .thenReturn(CompletableFuture.completedFuture(List.of()));
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());
        agent.processMessage("hi", null, null, null);

        agent.endSession();

        verify(extractor).extract(eq(USER), eq(plan), any(), eq(plan.primaryModel()));
        assertEquals(0, agent.memoryStatus().messageCount());
        assertTrue(agent.chatId().isEmpty());
    }

    @Test
    void shouldUseProjectContextInSystemPrompt() {
        PlanCapability plan = catalog.get(PlanCatalog.PRO);
        allow(plan);
        when(gateway.stream(anyString(), anyString(), anyString(), any())).thenReturn("Start with the schema.");
        AnalysisAgent agent = agent(plan);
        agent.initialize(SessionSetup.builder().metrics(METRICS).build());
        ProjectIdea project = new ProjectIdea("Ledger API", List.of("Go"), "Ledger", "Fintech",
                List.of(new ProjectIdea.StackItem("Go", "")));

        AgentReply reply = agent.processProjectMessage("Where do I start?", project, null, null);

        assertEquals("Start with the schema.", reply.response());
        verify(gateway).stream(contains("# PROJECT CONTEXT"), contains(AnalysisAgent.PROJECT_CLOSING), anyString(), any());
        verify(usage).increment(USER, UsageType.PROJECT_CHATS);
        verify(chats, never()).addMessages(anyString(), anyString(), anyList());
    }
}

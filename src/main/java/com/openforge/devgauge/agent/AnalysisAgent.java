package com.openforge.devgauge.agent;

import com.openforge.devgauge.analysis.AnalysisInstructions;
import com.openforge.devgauge.analysis.AnalysisMode;
import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.analysis.DeveloperProfile;
import com.openforge.devgauge.analysis.MetricsFormatter;
import com.openforge.devgauge.analysis.NormalizationEngine;
import com.openforge.devgauge.analysis.PromptContext;
import com.openforge.devgauge.analysis.ToneDirective;
import com.openforge.devgauge.chat.ChatContext;
import com.openforge.devgauge.chat.ChatDocument;
import com.openforge.devgauge.chat.ChatService;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.memory.AgentIdentity;
import com.openforge.devgauge.memory.AgentMemory;
import com.openforge.devgauge.memory.AgentState;
import com.openforge.devgauge.memory.ConversationMessage;
import com.openforge.devgauge.memory.MemoryExtractor;
import com.openforge.devgauge.memory.MemoryItem;
import com.openforge.devgauge.memory.MemoryStatus;
import com.openforge.devgauge.memory.MemoryStore;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.UsageDecision;
import com.openforge.devgauge.plan.UsageService;
import com.openforge.devgauge.plan.UsageType;
import com.openforge.devgauge.skill.AnalyzeProfileSkill;
import com.openforge.devgauge.skill.ProjectIdea;
import com.openforge.devgauge.skill.ProjectRecommendations;
import com.openforge.devgauge.skill.RecommendProjectsSkill;
import com.openforge.devgauge.skill.SkillContext;
import com.openforge.devgauge.skill.SkillRegistry;
import com.openforge.devgauge.skill.SkillResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * One user's agent session.
 *
 * Lifecycle:
 *
 *   initialize(setup)          load context, stored chat and persisted memory
 *   processMessage(...)        chat turn over metrics, analysis, memory and history
 *   processProjectMessage(...) chat turn scoped to one recommended project
 *   analyzeProfile(...)        full two-phase analysis; becomes the new baseline
 *   recommendProjects(...)     project ideas
 *   endSession()               starts memory extraction in the background
 *
 * Created by {@link AgentFactory}; not a Spring bean. Calls block the calling
 * thread until the model answers. Transport and extraction failures propagate;
 * persistence failures are logged and the session carries on.
 */
@Slf4j
public class AnalysisAgent {

    static final String CHAT_CLOSING =
            "Respond based on the context above. Be specific to their actual metrics and give actionable advice.";
    static final String PROJECT_CLOSING =
            "Respond based on the project context above. Be specific and actionable.";

    private final String         sessionId;
    private final String         userId;
    private final PlanCapability plan;
    private final AgentMemory    memory;

    private final ModelGateway    gateway;
    private final SkillRegistry   skills;
    private final MemoryStore     memoryStore;
    private final MemoryExtractor extractor;
    private final ChatService     chats;
    private final UsageService    usage;
    private final NormalizationEngine engine;

    private Map<String, Object> metrics = Map.of();
    private DeveloperProfile    profile;
    private AnalysisResult      analysis;
    private AnalysisResult      previousAnalysis;
    private ToneDirective       tone = ToneDirective.BALANCED;
    private String              displayName;
    private AgentIdentity       identity;
    private String              chatId;
    private volatile boolean    initialized;

    AnalysisAgent(String sessionId,
                  String userId,
                  PlanCapability plan,
                  AgentMemory memory,
                  ModelGateway gateway,
                  SkillRegistry skills,
                  MemoryStore memoryStore,
                  MemoryExtractor extractor,
                  ChatService chats,
                  UsageService usage,
                  NormalizationEngine engine) {
        this.sessionId   = sessionId;
        this.userId      = userId;
        this.plan        = plan;
        this.memory      = memory;
        this.gateway     = gateway;
        this.skills      = skills;
        this.memoryStore = memoryStore;
        this.extractor   = extractor;
        this.chats       = chats;
        this.usage       = usage;
        this.engine      = engine;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Sets the session context. A stored conversation, when referenced, fills
     * the short-term window and supplies any context the caller left out.
     * Persisted memory is loaded for eligible plans.
     */
    public synchronized void initialize(SessionSetup setup) {
        this.metrics          = setup.metrics() == null ? Map.of() : setup.metrics();
        this.profile          = setup.profile();
        this.analysis         = setup.priorResult() == null ? null : engine.rescore(setup.priorResult());
        this.previousAnalysis = this.analysis;
        this.tone             = setup.tone() == null ? ToneDirective.BALANCED : setup.tone();
        this.displayName      = setup.displayName();

        if (setup.conversationRef() != null && !setup.conversationRef().isBlank()) {
            resumeChat(setup.conversationRef());
        }
        loadPersistedState();

        memory.markContext(hasContext(), previousAnalysis != null);
        this.initialized = true;
        log.info("[Agent:{}] initialized user={} plan={} history={} longTerm={}",
                sessionId, userId, plan.id(), memory.messageCount(), memory.longTerm().size());
    }

    /**
     * Starts memory extraction over the current history and clears it. The
     * returned future is for tests and diagnostics; callers must not block on it.
     */
    public synchronized CompletableFuture<List<MemoryItem>> endSession() {
        CompletableFuture<List<MemoryItem>> job = extractor.extract(userId, plan, memory, plan.primaryModel());
        memory.clearHistory();
        chatId = null;
        log.info("[Agent:{}] session ended", sessionId);
        return job;
    }

    // ── Chat ─────────────────────────────────────────────────────────────────

    public AgentReply processMessage(String text, AnalysisMode mode, Consumer<String> sink, String model) {
        AnalysisMode effective = mode == null ? AnalysisMode.QUICK_CHAT : mode;
        String callModel = meter(UsageType.MESSAGES, model);

        ConversationMessage userMessage = memory.addMessage(ConversationMessage.Role.USER, text);
        String system = AnalysisInstructions.chat(plan.metricsDetail(), tone, personaBlock(), effective);
        PromptContext.Builder prompt = PromptContext.builder();
        if (hasContext()) {
            prompt.profileAndMetrics(MetricsFormatter.format(metrics, profile, plan.metricsDetail()));
        }
        if (analysis != null) {
            prompt.precomputedLevel(MetricsFormatter.analysis(analysis));
        }
        if (effective == AnalysisMode.PROGRESS_COMPARISON && previousAnalysis != null) {
            prompt.previousAnalysis(MetricsFormatter.previousAnalysis(previousAnalysis));
        }
        if (memory.memoryEnabled()) {
            prompt.memory(memory.renderLongTerm());
        }
        if (memory.messageCount() > 1) {
            prompt.history(memory.getFormattedHistory());
        }
        prompt.userMessage(text).instruction(CHAT_CLOSING);

        String response = gateway.stream(system, prompt.build().render(), callModel, sink);
        ConversationMessage reply = memory.addMessage(ConversationMessage.Role.ASSISTANT, response);
        usage.increment(userId, UsageType.MESSAGES);
        persistTurn(userMessage, reply);
        return new AgentReply(response, memory.getSummary());
    }

    /**
     * A turn about one project. The project, metrics and analysis go into the
     * system prompt; the user prompt carries only history and the message.
     * Project turns are not written to the stored chat.
     */
    public AgentReply processProjectMessage(String text, ProjectIdea project, Consumer<String> sink, String model) {
        String callModel = meter(UsageType.PROJECT_CHATS, model);
        memory.addMessage(ConversationMessage.Role.USER, text);

        StringBuilder system = new StringBuilder(
                AnalysisInstructions.chat(plan.metricsDetail(), tone, personaBlock(), AnalysisMode.PROJECT_CHAT));
        system.append("\n\n").append(project.render());
        if (hasContext()) {
            system.append("\n\n").append(MetricsFormatter.format(metrics, profile, plan.metricsDetail()));
        }
        if (analysis != null) {
            system.append("\n\n").append(MetricsFormatter.analysis(analysis));
        }

        PromptContext.Builder prompt = PromptContext.builder();
        if (memory.messageCount() > 1) {
            prompt.history(memory.getFormattedHistory());
        }
        prompt.userMessage(text).instruction(PROJECT_CLOSING);

        String response = gateway.stream(system.toString(), prompt.build().render(), callModel, sink);
        memory.addMessage(ConversationMessage.Role.ASSISTANT, response);
        usage.increment(userId, UsageType.PROJECT_CHATS);
        return new AgentReply(response, memory.getSummary());
    }

    // ── Skills ───────────────────────────────────────────────────────────────

    /** Full analysis. On success it replaces both the current analysis and the comparison baseline. */
    public AnalysisResult analyzeProfile(Consumer<String> sink) {
        requireContext();
        String callModel = meter(UsageType.REANALYZES, null);
        AnalysisResult result = skills.execute(AnalyzeProfileSkill.NAME, skillContext(callModel, sink))
                .valueAs(AnalysisResult.class);
        synchronized (this) {
            this.analysis         = result;
            this.previousAnalysis = result;
        }
        memory.markPreviousAnalysis();
        usage.increment(userId, UsageType.REANALYZES);
        log.info("[Agent:{}] analysis complete, level={} ({})", sessionId, result.level(), result.levelName().label());
        return result;
    }

    public List<ProjectIdea> recommendProjects(Consumer<String> sink) {
        requireContext();
        return skills.execute(RecommendProjectsSkill.NAME, skillContext(plan.primaryModel(), sink))
                .valueAs(ProjectRecommendations.class)
                .projects();
    }

    /** Any registered skill by name; unknown names yield a NOT_FOUND result. */
    public SkillResult runSkill(String name, Consumer<String> sink) {
        requireContext();
        return skills.execute(name, skillContext(plan.primaryModel(), sink));
    }

    // ── Memory ───────────────────────────────────────────────────────────────

    /** Stores one item; for plans without memory nothing changes and the prior list comes back. */
    public List<MemoryItem> addMemory(MemoryItem item) {
        if (!plan.memoryEligible()) {
            return memory.longTerm();
        }
        List<MemoryItem> stored = memoryStore.addMemoryItem(userId, plan, item);
        memory.setLongTerm(stored);
        return stored;
    }

    public MemoryStatus memoryStatus() {
        return memory.getSummary();
    }

    public String sessionId() {
        return sessionId;
    }

    public String userId() {
        return userId;
    }

    public PlanCapability plan() {
        return plan;
    }

    public synchronized Optional<String> chatId() {
        return Optional.ofNullable(chatId);
    }

    public synchronized Optional<AgentIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private synchronized boolean hasContext() {
        return !metrics.isEmpty() || profile != null;
    }

    private void requireContext() {
        if (!initialized || !hasContext()) {
            throw new AgentNotInitializedException(sessionId);
        }
    }

    /**
     * Checks the limit for {@code type} and returns the model to call. An
     * explicit model wins over the plan's choice.
     */
    private String meter(UsageType type, String requestedModel) {
        UsageDecision decision = usage.checkLimit(userId, type);
        if (!decision.allowed()) {
            throw new UsageLimitExceededException(type, decision.limit() == null ? 0 : decision.limit());
        }
        if (decision.usingFallback()) {
            log.info("[Agent:{}] {} limit reached, using fallback model {}", sessionId, type, decision.model());
        }
        return requestedModel != null && !requestedModel.isBlank() ? requestedModel : decision.model();
    }

    private synchronized SkillContext skillContext(String model, Consumer<String> sink) {
        return SkillContext.builder()
                .metrics(metrics)
                .profile(profile)
                .previous(previousAnalysis)
                .metricsDetail(plan.metricsDetail())
                .tone(tone)
                .model(model)
                .customWeights(plan.customWeights())
                .sink(sink)
                .build();
    }

    private synchronized String personaBlock() {
        return AgentIdentity.promptBlock(identity, displayName);
    }

    private void resumeChat(String ref) {
        try {
            Optional<ChatDocument> chat = chats.get(userId, ref);
            if (chat.isEmpty()) {
                log.warn("[Agent:{}] chat {} not found, starting fresh", sessionId, ref);
                return;
            }
            ChatDocument doc = chat.get();
            memory.loadHistory(doc.messages());
            chatId = doc.chatId();
            ChatContext stored = doc.context();
            if (stored != null) {
                if (metrics.isEmpty() && stored.metrics() != null) metrics = stored.metrics();
                if (profile == null) profile = stored.profile();
                if (analysis == null && stored.analysis() != null) analysis = engine.rescore(stored.analysis());
            }
        } catch (Exception e) {
            log.warn("[Agent:{}] failed to load chat {}: {}", sessionId, ref, e.getMessage());
        }
    }

    private void loadPersistedState() {
        if (!plan.memoryEligible()) {
            memory.setMemoryEnabled(false);
            return;
        }
        Optional<AgentState> state = memoryStore.load(userId, plan);
        memory.setLongTerm(state.map(AgentState::memory).orElse(List.of()));
        memory.setMemoryEnabled(state.map(AgentState::memoryEnabled).orElse(true));
        identity = state.map(AgentState::identity).orElse(null);
    }

    /** Writes the turn to the stored chat, creating it on the first turn. */
    private void persistTurn(ConversationMessage userMessage, ConversationMessage reply) {
        try {
            synchronized (this) {
                if (chatId == null) {
                    chatId = chats.create(userId, userMessage.content(), new ChatContext(metrics, profile, analysis));
                    chats.addMessages(userId, chatId, List.of(reply));
                } else {
                    chats.addMessages(userId, chatId, List.of(userMessage, reply));
                }
            }
        } catch (Exception e) {
            log.warn("[Agent:{}] failed to persist chat turn: {}", sessionId, e.getMessage());
        }
    }
}

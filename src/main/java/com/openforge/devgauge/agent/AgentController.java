package com.openforge.devgauge.agent;

import com.openforge.devgauge.agent.dto.AddMemoryRequest;
import com.openforge.devgauge.agent.dto.ChatReplyResponse;
import com.openforge.devgauge.agent.dto.CreateSessionRequest;
import com.openforge.devgauge.agent.dto.MessageRequest;
import com.openforge.devgauge.agent.dto.ProjectMessageRequest;
import com.openforge.devgauge.agent.dto.SessionResponse;
import com.openforge.devgauge.agent.event.AgentEvent;
import com.openforge.devgauge.analysis.AnalysisResult;
import com.openforge.devgauge.auth.CurrentUser;
import com.openforge.devgauge.memory.MemoryItem;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.UsageService;
import com.openforge.devgauge.skill.ProjectIdea;
import com.openforge.devgauge.skill.SkillResult;
import com.openforge.devgauge.websocket.AgentEventPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * REST API for agent sessions.
 *
 * Endpoints:
 *   POST   /api/agent/sessions                          create and initialize a session
 *   POST   /api/agent/sessions/{id}/messages            chat turn
 *   POST   /api/agent/sessions/{id}/project-messages    chat turn about one project
 *   POST   /api/agent/sessions/{id}/analysis            full analysis
 *   POST   /api/agent/sessions/{id}/recommendations     project ideas
 *   POST   /api/agent/sessions/{id}/skills/{name}       any registered skill
 *   GET    /api/agent/sessions/skills                   registered skills
 *   GET    /api/agent/sessions/{id}/memory              memory status
 *   POST   /api/agent/sessions/{id}/memory              add one memory item
 *   DELETE /api/agent/sessions/{id}                     end session, start memory extraction
 *
 * Model calls run on the request thread. While one runs, its tokens are
 * published as TOKEN events on the session topic; the call then ends with
 * FINAL_ANSWER or ERROR there, and the HTTP response carries the full result.
 */
@Slf4j
@RestController
@RequestMapping("/api/agent/sessions")
@RequiredArgsConstructor
public class AgentController {

    private final AgentFactory         factory;
    private final AgentSessionRegistry sessions;
    private final UsageService         usage;
    private final AgentEventPublisher  publisher;
    private final CurrentUser          currentUser;

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<SessionResponse> createSession(@Valid @RequestBody(required = false) CreateSessionRequest request) {
        String userId = requireUser();
        CreateSessionRequest body = request == null
                ? new CreateSessionRequest(null, null, null, null, null, null)
                : request;

        PlanCapability plan = usage.planFor(userId);
        String sessionId = UUID.randomUUID().toString();
        AnalysisAgent agent = factory.create(sessionId, userId, plan);
        agent.initialize(body.toSetup());
        sessions.register(agent);

        log.info("[Controller] Created session {} for user {} (plan={})", sessionId, userId, plan.id());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SessionResponse.from(agent, AgentEventPublisher.topic(sessionId)));
    }

    /** Ends the session. Memory extraction continues in the background. */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        AnalysisAgent agent = sessions.remove(sessionId, requireUser())
                .orElseThrow(() -> notFound(sessionId));
        agent.endSession();
        return ResponseEntity.noContent().build();
    }

    // ── Chat ─────────────────────────────────────────────────────────────────

    @PostMapping("/{sessionId}/messages")
    public ResponseEntity<ChatReplyResponse> sendMessage(@PathVariable String sessionId,
                                                         @Valid @RequestBody MessageRequest request) {
        AnalysisAgent agent = findOrThrow(sessionId);
        AgentReply reply = streamed(agent, "message",
                sink -> agent.processMessage(request.message(), request.mode(), sink, request.model()),
                AgentReply::response);
        return ResponseEntity.ok(ChatReplyResponse.of(reply, agent.chatId().orElse(null)));
    }

    @PostMapping("/{sessionId}/project-messages")
    public ResponseEntity<ChatReplyResponse> sendProjectMessage(@PathVariable String sessionId,
                                                                @Valid @RequestBody ProjectMessageRequest request) {
        AnalysisAgent agent = findOrThrow(sessionId);
        AgentReply reply = streamed(agent, "project-message",
                sink -> agent.processProjectMessage(request.message(), request.project(), sink, request.model()),
                AgentReply::response);
        return ResponseEntity.ok(ChatReplyResponse.of(reply, null));
    }

    // ── Skills ───────────────────────────────────────────────────────────────

    @PostMapping("/{sessionId}/analysis")
    public ResponseEntity<AnalysisResult> analyze(@PathVariable String sessionId) {
        AnalysisAgent agent = findOrThrow(sessionId);
        return ResponseEntity.ok(streamed(agent, "analysis", agent::analyzeProfile, AnalysisResult::summary));
    }

    @PostMapping("/{sessionId}/recommendations")
    public ResponseEntity<List<ProjectIdea>> recommendProjects(@PathVariable String sessionId) {
        AnalysisAgent agent = findOrThrow(sessionId);
        return ResponseEntity.ok(streamed(agent, "recommendations", agent::recommendProjects, projects -> null));
    }

    /** A NOT_FOUND or NO_BASELINE result is a normal 200 response, not an error. */
    @PostMapping("/{sessionId}/skills/{name}")
    public ResponseEntity<SkillResult> runSkill(@PathVariable String sessionId, @PathVariable String name) {
        AnalysisAgent agent = findOrThrow(sessionId);
        return ResponseEntity.ok(streamed(agent, name, sink -> agent.runSkill(name, sink), SkillResult::message));
    }

    @GetMapping("/skills")
    public ResponseEntity<Map<String, String>> listSkills() {
        requireUser();
        return ResponseEntity.ok(factory.skillDescriptions());
    }

    // ── Memory ───────────────────────────────────────────────────────────────

    @GetMapping("/{sessionId}/memory")
    public ResponseEntity<SessionResponse> memoryStatus(@PathVariable String sessionId) {
        AnalysisAgent agent = findOrThrow(sessionId);
        return ResponseEntity.ok(SessionResponse.from(agent, AgentEventPublisher.topic(sessionId)));
    }

    @PostMapping("/{sessionId}/memory")
    public ResponseEntity<List<MemoryItem>> addMemory(@PathVariable String sessionId,
                                                      @Valid @RequestBody AddMemoryRequest request) {
        AnalysisAgent agent = findOrThrow(sessionId);
        return ResponseEntity.ok(agent.addMemory(request.toItem()));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Runs one model-backed call with a token sink on the session topic, then
     * publishes FINAL_ANSWER with the result, or ERROR before rethrowing.
     */
    private <T> T streamed(AnalysisAgent agent, String operation,
                           Function<Consumer<String>, T> call, Function<T, String> text) {
        String sessionId = agent.sessionId();
        try {
            T result = call.apply(publisher.tokenSink(sessionId, operation));
            publisher.publish(AgentEvent.finalAnswer(sessionId, operation, text.apply(result), result));
            return result;
        } catch (RuntimeException e) {
            publisher.publish(AgentEvent.error(sessionId, operation, e.getMessage()));
            throw e;
        }
    }

    private AnalysisAgent findOrThrow(String sessionId) {
        return sessions.find(sessionId, requireUser()).orElseThrow(() -> notFound(sessionId));
    }

    private String requireUser() {
        return currentUser.id().orElseThrow(
                () -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Not authenticated"));
    }

    private static ResponseStatusException notFound(String sessionId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + sessionId);
    }
}

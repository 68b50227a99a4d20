package com.openforge.devgauge.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live agent sessions of this node, keyed by session id. Sessions are
 * in-memory only; everything durable lives in the memory store and chats.
 *
 * A session not looked up for {@code agent.session.idle-timeout} is ended
 * by {@link #evictIdle()}, which runs its memory extraction like an explicit
 * DELETE would.
 */
@Slf4j
@Component
public class AgentSessionRegistry {

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Clock    clock;
    private final Duration idleTimeout;

    public AgentSessionRegistry(Clock clock,
                                @Value("${agent.session.idle-timeout:30m}") Duration idleTimeout) {
        this.clock       = clock;
        this.idleTimeout = idleTimeout;
    }

    public void register(AnalysisAgent agent) {
        if (sessions.putIfAbsent(agent.sessionId(), new Entry(agent, clock.instant())) != null) {
            throw new IllegalStateException("Session already exists: " + agent.sessionId());
        }
        log.debug("[Sessions] +{} ({} live)", agent.sessionId(), sessions.size());
    }

    /** The session if it exists and belongs to {@code userId}. Counts as activity. */
    public Optional<AnalysisAgent> find(String sessionId, String userId) {
        Entry entry = sessions.get(sessionId);
        if (entry == null || !entry.agent.userId().equals(userId)) return Optional.empty();
        entry.lastSeen = clock.instant();
        return Optional.of(entry.agent);
    }

    public Optional<AnalysisAgent> remove(String sessionId, String userId) {
        Entry entry = sessions.get(sessionId);
        if (entry == null || !entry.agent.userId().equals(userId)) return Optional.empty();
        if (!sessions.remove(sessionId, entry)) return Optional.empty();
        log.debug("[Sessions] -{} ({} live)", sessionId, sessions.size());
        return Optional.of(entry.agent);
    }

    /**
     * Ends and drops every session idle for longer than the timeout.
     *
     * @return number of sessions evicted
     */
    @Scheduled(fixedDelayString = "${agent.session.sweep-interval:PT1M}")
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (Map.Entry<String, Entry> e : sessions.entrySet()) {
            Entry entry = e.getValue();
            if (!entry.lastSeen.isBefore(cutoff) || !sessions.remove(e.getKey(), entry)) continue;
            evicted++;
            try {
                entry.agent.endSession();
            } catch (RuntimeException ex) {
                log.warn("[Sessions] ending idle session {} failed: {}", e.getKey(), ex.getMessage());
            }
        }
        if (evicted > 0) {
            log.info("[Sessions] evicted {} idle sessions ({} live)", evicted, sessions.size());
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    private static final class Entry {
        final AnalysisAgent agent;
        volatile Instant lastSeen;

        Entry(AnalysisAgent agent, Instant lastSeen) {
            this.agent    = agent;
            this.lastSeen = lastSeen;
        }
    }
}

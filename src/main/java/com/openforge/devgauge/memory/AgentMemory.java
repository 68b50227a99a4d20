package com.openforge.devgauge.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Memory of one agent session.
 *
 * Short-term: the last {@code window} conversation messages, oldest evicted first.
 * Append order is preserved exactly.
 *
 * Long-term: a view of the user's persisted memory items, owned by
 * {@link MemoryStore}. The session reads it into prompts and replaces it with
 * whatever the store returns after a write.
 */
public class AgentMemory {

    private final int   window;
    private final Clock clock;

    private final Deque<ConversationMessage> shortTerm = new ArrayDeque<>();
    private List<MemoryItem> longTerm = List.of();
    private boolean hasContext;
    private boolean hasPreviousAnalysis;
    private boolean memoryEnabled;

    public AgentMemory(int window, Clock clock) {
        if (window < 1) throw new IllegalArgumentException("window must be positive");
        this.window = window;
        this.clock  = clock;
    }

    // ── Short-term ───────────────────────────────────────────────────────────

    public synchronized ConversationMessage addMessage(ConversationMessage.Role role, String content) {
        ConversationMessage message = new ConversationMessage(role, content, clock.instant());
        shortTerm.addLast(message);
        while (shortTerm.size() > window) {
            shortTerm.removeFirst();
        }
        return message;
    }

    /** Replaces the buffer with the tail of a stored conversation. */
    public synchronized void loadHistory(List<ConversationMessage> messages) {
        shortTerm.clear();
        if (messages == null) return;
        int from = Math.max(0, messages.size() - window);
        shortTerm.addAll(messages.subList(from, messages.size()));
    }

    public synchronized List<ConversationMessage> history() {
        return List.copyOf(shortTerm);
    }

    public synchronized int messageCount() {
        return shortTerm.size();
    }

    public synchronized void clearHistory() {
        shortTerm.clear();
    }

    /** "ROLE: content" blocks separated by a blank line. */
    public synchronized String getFormattedHistory() {
        return shortTerm.stream()
                .map(m -> m.role().name().toUpperCase(Locale.ROOT) + ": " + m.content())
                .collect(Collectors.joining("\n\n"));
    }

    // ── Long-term ────────────────────────────────────────────────────────────

    public synchronized List<MemoryItem> longTerm() {
        return longTerm;
    }

    public synchronized void setLongTerm(List<MemoryItem> items) {
        this.longTerm = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Long-term memory as labelled bullet lists, non-empty buckets only, in
     * {@link MemoryType#RENDER_ORDER}. Empty string when there is nothing to show.
     */
    public synchronized String renderLongTerm() {
        if (longTerm.isEmpty()) return "";
        Map<MemoryType, List<MemoryItem>> buckets = new EnumMap<>(MemoryType.class);
        for (MemoryItem item : longTerm) {
            if (item.type() == null || item.content().isEmpty()) continue;
            buckets.computeIfAbsent(item.type(), t -> new ArrayList<>()).add(item);
        }
        if (buckets.isEmpty()) return "";

        StringBuilder sb = new StringBuilder("# WHAT YOU REMEMBER ABOUT THIS USER");
        for (MemoryType type : MemoryType.RENDER_ORDER) {
            List<MemoryItem> items = buckets.get(type);
            if (items == null) continue;
            sb.append("\n\n## ").append(type.bucketLabel());
            items.forEach(item -> sb.append("\n- ").append(item.content()));
        }
        return sb.toString();
    }

    // ── Status ───────────────────────────────────────────────────────────────

    public synchronized void markContext(boolean hasContext, boolean hasPreviousAnalysis) {
        this.hasContext          = hasContext;
        this.hasPreviousAnalysis = hasPreviousAnalysis;
    }

    public synchronized void markPreviousAnalysis() {
        this.hasPreviousAnalysis = true;
    }

    public synchronized boolean memoryEnabled() {
        return memoryEnabled;
    }

    public synchronized void setMemoryEnabled(boolean memoryEnabled) {
        this.memoryEnabled = memoryEnabled;
    }

    public synchronized MemoryStatus getSummary() {
        Instant last = shortTerm.isEmpty() ? null : shortTerm.peekLast().timestamp();
        return new MemoryStatus(shortTerm.size(), hasContext, hasPreviousAnalysis, last,
                longTerm.size(), memoryEnabled);
    }
}

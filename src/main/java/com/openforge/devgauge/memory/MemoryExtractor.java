package com.openforge.devgauge.memory;

import com.openforge.devgauge.analysis.AnalysisInstructions;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.llm.ResponseExtractor;
import com.openforge.devgauge.plan.PlanCapability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Distills a finished conversation into long-term memory items.
 *
 * Runs detached on {@code memoryExtractionExecutor}. The returned future always
 * completes normally: any failure is logged and yields an empty list. Callers on
 * the user path never join it.
 */
@Slf4j
@Service
public class MemoryExtractor {

    private final ModelGateway      gateway;
    private final ResponseExtractor extractor;
    private final MemoryStore       store;
    private final MemoryProperties  properties;
    private final ExecutorService   executor;
    private final Clock             clock;

    public MemoryExtractor(ModelGateway gateway,
                           ResponseExtractor extractor,
                           MemoryStore store,
                           MemoryProperties properties,
                           @Qualifier("memoryExtractionExecutor") ExecutorService executor,
                           Clock clock) {
        this.gateway    = gateway;
        this.extractor  = extractor;
        this.store      = store;
        this.properties = properties;
        this.executor   = executor;
        this.clock      = clock;
    }

    /**
     * Snapshots the session's history on the calling thread and extracts from it
     * in the background. Completes with the items that were added, empty when a
     * precondition fails or anything goes wrong. On success the session's
     * long-term view is replaced with the stored list.
     */
    public CompletableFuture<List<MemoryItem>> extract(String userId,
                                                       PlanCapability plan,
                                                       AgentMemory memory,
                                                       String model) {
        if (!properties.extractionEnabled() || plan == null || !plan.memoryEligible()
                || !memory.memoryEnabled() || memory.messageCount() < 1) {
            log.debug("[MemoryExtractor:{}] skipped, preconditions not met", userId);
            return CompletableFuture.completedFuture(List.of());
        }
        String history = memory.getFormattedHistory();
        int messages = memory.messageCount();

        try {
            return CompletableFuture.supplyAsync(() -> run(userId, plan, memory, history, messages, model), executor);
        } catch (Exception e) {
            // executor rejected the task, e.g. during shutdown
            log.warn("[MemoryExtractor:{}] could not schedule extraction: {}", userId, e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private List<MemoryItem> run(String userId, PlanCapability plan, AgentMemory memory,
                                 String history, int messages, String model) {
        try {
            log.debug("[MemoryExtractor:{}] extracting from {} messages", userId, messages);
            String text = gateway.complete(AnalysisInstructions.EXTRACTION,
                    "# CONVERSATION\n" + history, model);
            ExtractionPayload payload = ExtractionPayload.from(extractor.extract(text));
            if (payload.isEmpty()) {
                log.info("[MemoryExtractor:{}] nothing worth remembering", userId);
                return List.of();
            }
            List<MemoryItem> items = payload.toItems(clock.instant());
            List<MemoryItem> stored = store.addMemoryItems(userId, plan, items);
            memory.setLongTerm(stored);
            log.info("[MemoryExtractor:{}] stored {} new items, {} total", userId, items.size(), stored.size());
            return items;
        } catch (Exception e) {
            log.warn("[MemoryExtractor:{}] extraction failed: {}", userId, e.getMessage());
            return List.of();
        }
    }
}

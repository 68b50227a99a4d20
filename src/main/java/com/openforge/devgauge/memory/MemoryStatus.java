package com.openforge.devgauge.memory;

import java.time.Instant;

/**
 * Snapshot of what an agent session knows, returned with every chat turn.
 *
 * @param lastActivity timestamp of the newest short-term message; null when empty
 */
public record MemoryStatus(
        int messageCount,
        boolean hasContext,
        boolean hasPreviousAnalysis,
        Instant lastActivity,
        int longTermItems,
        boolean memoryEnabled
) {}

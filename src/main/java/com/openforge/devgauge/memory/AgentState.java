package com.openforge.devgauge.memory;

import java.util.List;

/**
 * A user's persisted agent: long-term memory, the memory switch and the
 * optional custom identity.
 */
public record AgentState(
        List<MemoryItem> memory,
        boolean memoryEnabled,
        AgentIdentity identity
) {

    public AgentState {
        memory = memory == null ? List.of() : List.copyOf(memory);
    }

    public static AgentState empty() {
        return new AgentState(List.of(), true, null);
    }
}

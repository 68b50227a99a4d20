package com.openforge.devgauge.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.devgauge.agent.AnalysisAgent;
import com.openforge.devgauge.memory.AgentIdentity;
import com.openforge.devgauge.memory.MemoryStatus;

/**
 * Response for session creation. Carries the STOMP topic so the client can
 * subscribe before its first streamed call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        String        sessionId,
        String        wsSubscribePath,
        String        planId,
        String        chatId,
        MemoryStatus  memoryStatus,
        AgentIdentity identity
) {

    public static SessionResponse from(AnalysisAgent agent, String wsSubscribePath) {
        return new SessionResponse(
                agent.sessionId(),
                wsSubscribePath,
                agent.plan().id(),
                agent.chatId().orElse(null),
                agent.memoryStatus(),
                agent.identity().orElse(null)
        );
    }
}

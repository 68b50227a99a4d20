package com.openforge.devgauge.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for everything broadcast on {@code /topic/agent/{sessionId}}.
 *
 * @param operation which endpoint produced the event, e.g. "message" or "analysis"
 * @param timestamp epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        String    sessionId,
        EventType type,
        String    operation,
        String    content,
        Object    payload,
        long      timestamp
) {

    public static AgentEvent token(String sessionId, String operation, String fragment) {
        return new AgentEvent(sessionId, EventType.TOKEN, operation, fragment, null, now());
    }

    public static AgentEvent finalAnswer(String sessionId, String operation, String text, Object payload) {
        return new AgentEvent(sessionId, EventType.FINAL_ANSWER, operation, text, payload, now());
    }

    public static AgentEvent error(String sessionId, String operation, String message) {
        return new AgentEvent(sessionId, EventType.ERROR, operation, message, null, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}

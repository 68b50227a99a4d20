package com.openforge.devgauge.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.devgauge.agent.AgentReply;
import com.openforge.devgauge.memory.MemoryStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatReplyResponse(
        String       response,
        String       chatId,
        MemoryStatus memoryStatus
) {

    public static ChatReplyResponse of(AgentReply reply, String chatId) {
        return new ChatReplyResponse(reply.response(), chatId, reply.memoryStatus());
    }
}

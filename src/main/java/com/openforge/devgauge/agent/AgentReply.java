package com.openforge.devgauge.agent;

import com.openforge.devgauge.memory.MemoryStatus;

/** One chat turn's answer plus the session's memory status after it. */
public record AgentReply(String response, MemoryStatus memoryStatus) {}

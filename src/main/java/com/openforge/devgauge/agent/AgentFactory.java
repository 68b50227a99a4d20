package com.openforge.devgauge.agent;

import com.openforge.devgauge.analysis.NormalizationEngine;
import com.openforge.devgauge.chat.ChatService;
import com.openforge.devgauge.llm.ModelGateway;
import com.openforge.devgauge.memory.AgentMemory;
import com.openforge.devgauge.memory.MemoryExtractor;
import com.openforge.devgauge.memory.MemoryProperties;
import com.openforge.devgauge.memory.MemoryStore;
import com.openforge.devgauge.plan.PlanCapability;
import com.openforge.devgauge.plan.UsageService;
import com.openforge.devgauge.skill.SkillRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Builds {@link AnalysisAgent} instances with their shared collaborators and
 * a fresh {@link AgentMemory} each.
 */
@Component
@RequiredArgsConstructor
public class AgentFactory {

    private final ModelGateway     gateway;
    private final SkillRegistry    skills;
    private final MemoryStore      memoryStore;
    private final MemoryExtractor  extractor;
    private final ChatService      chats;
    private final UsageService     usage;
    private final MemoryProperties memoryProperties;
    private final Clock            clock;
    private final NormalizationEngine engine;

    public AnalysisAgent create(String sessionId, String userId, PlanCapability plan) {
        AgentMemory memory = new AgentMemory(memoryProperties.shortTermWindow(), clock);
        return new AnalysisAgent(sessionId, userId, plan, memory,
                gateway, skills, memoryStore, extractor, chats, usage, engine);
    }

    /** Name to description of every skill a session can run. */
    public Map<String, String> skillDescriptions() {
        return skills.describe();
    }
}

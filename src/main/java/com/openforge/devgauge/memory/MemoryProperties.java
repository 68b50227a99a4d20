package com.openforge.devgauge.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Memory configuration under "agent.memory":
 *
 * agent:
 *   memory:
 *     short-term-window: 10
 *     extraction-enabled: true
 *     extraction-threads: 2
 */
@ConfigurationProperties(prefix = "agent.memory")
public record MemoryProperties(
        @DefaultValue("10") int shortTermWindow,
        @DefaultValue("true") boolean extractionEnabled,
        @DefaultValue("2") int extractionThreads
) {

    public static MemoryProperties defaults() {
        return new MemoryProperties(10, true, 2);
    }
}

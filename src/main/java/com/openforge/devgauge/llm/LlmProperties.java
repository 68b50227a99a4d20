package com.openforge.devgauge.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     name: openrouter
 *     base-url: https://openrouter.ai/api/v1
 *     api-key: sk-or-...
 *     model: meta-llama/llama-4-scout
 *     app-title: devgauge
 *     timeout-seconds: 120
 *
 * The model here is only the default; plan tiers pick their own model per call.
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        String name,
        String baseUrl,
        String apiKey,
        String model,
        String appTitle,
        @DefaultValue("120") int timeoutSeconds
) {}

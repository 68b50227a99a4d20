package com.openforge.devgauge.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.llm.model.ChatRequest;
import com.openforge.devgauge.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Single entry point for every model call made by the service.
 *
 * Call graph:
 *
 *   complete(system, user, model)  /  stream(system, user, model, sink)
 *     └─ llmCircuitBreaker
 *           └─ llmClient.{chat|streamChat}(request)
 *
 * There is no retry here. Transport failures (network, non-2xx, rate limit,
 * open circuit) surface to the caller as {@link LlmClient.LlmException}; the
 * only retry in the system is the scoring phase's missing-category request.
 *
 * A non-blank {@code model} argument overrides the configured default, which is
 * how plan tiers select their model.
 */
@Slf4j
@Component
public class ModelGateway {

    private final LlmClient      client;
    private final CircuitBreaker circuitBreaker;

    @Autowired
    public ModelGateway(HttpClient httpClient,
                        ObjectMapper objectMapper,
                        LlmProperties properties,
                        CircuitBreaker llmCircuitBreaker) {
        this(new LlmClient(httpClient, objectMapper, properties), llmCircuitBreaker);
    }

    public ModelGateway(LlmClient client, CircuitBreaker circuitBreaker) {
        this.client         = client;
        this.circuitBreaker = circuitBreaker;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Non-streaming call. Returns the raw text of the first choice.
     */
    public String complete(String systemPrompt, String userPrompt, String model) {
        ChatRequest request = ChatRequest.of(model, systemPrompt, userPrompt);
        return execute(() -> client.chat(request)).text();
    }

    /**
     * Streaming call. Each fragment is handed to {@code sink} in arrival order;
     * the return value is their concatenation. A null sink degrades to
     * {@link #complete}.
     */
    public String stream(String systemPrompt, String userPrompt, String model, Consumer<String> sink) {
        if (sink == null) {
            return complete(systemPrompt, userPrompt, model);
        }
        ChatRequest request = ChatRequest.of(model, systemPrompt, userPrompt);
        return execute(() -> client.streamChat(request, sink)).text();
    }

    public String defaultModel() {
        return client.modelName();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates the call with the circuit breaker and executes it.
     * Fully programmatic, no AOP proxies.
     */
    private ChatResponse execute(Supplier<ChatResponse> call) {
        Supplier<ChatResponse> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, call);
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("[ModelGateway] Circuit '{}' is open, rejecting call", circuitBreaker.getName());
            throw new LlmClient.LlmException("LLM circuit is open: " + e.getMessage(), e);
        }
    }
}

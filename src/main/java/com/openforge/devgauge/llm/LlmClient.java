package com.openforge.devgauge.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.llm.model.ChatRequest;
import com.openforge.devgauge.llm.model.ChatResponse;
import com.openforge.devgauge.llm.model.Message;
import com.openforge.devgauge.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless HTTP client for an OpenAI-compatible /chat/completions endpoint.
 *
 * Two modes of operation:
 *
 *  chat()       : synchronous, waits for the full response.
 *                  Used for scoring, extraction and every call without a sink.
 *
 *  streamChat() : streaming SSE, calls tokenCallback per content fragment.
 *                  Returns a ChatResponse whose single message holds the
 *                  concatenation of every fragment, so callers see the same
 *                  final text they would have received without streaming.
 *
 * Both methods block the calling thread; callers that need a deadline wrap
 * the call themselves.
 */
@Slf4j
public class LlmClient {

    private static final String SSE_DATA_PREFIX = "data: ";
    private static final String SSE_DONE        = "data: [DONE]";

    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;
    private final LlmProperties config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking (non-streaming) chat completion.
     */
    public ChatResponse chat(ChatRequest request) {
        ChatRequest effective = withDefaults(request, false);
        String requestBody = serialize(effective);
        log.debug("[LlmClient:{}] → chat POST model={} body-length={}",
                config.name(), effective.model(), requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody, false));
        return parseFullResponse(httpResponse);
    }

    /**
     * Streaming chat completion via SSE.
     *
     * @param request       ChatRequest (stream flag is forced to true)
     * @param tokenCallback invoked synchronously with each non-empty content fragment
     * @return assembled ChatResponse with the complete message
     */
    public ChatResponse streamChat(ChatRequest request, Consumer<String> tokenCallback) {
        ChatRequest effective = withDefaults(request, true);
        String requestBody = serialize(effective);
        log.debug("[LlmClient:{}] → streamChat POST model={} body-length={}",
                config.name(), effective.model(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(
                    buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while streaming from provider [%s]"
                    .formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = httpResponse.statusCode();
        if (status == 429) {
            closeQuietly(httpResponse.body());
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = snippet(httpResponse.body());
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet));
        }

        try (Stream<String> lines = httpResponse.body()) {
            return assembleStreamingResponse(lines, tokenCallback);
        }
    }

    /** The default model configured for this provider. */
    public String modelName() {
        return config.model();
    }

    // ── Streaming assembly ───────────────────────────────────────────────────

    /**
     * Reads the SSE line stream, forwards content deltas and assembles a
     * ChatResponse that mirrors the non-streaming format. Lines that are not
     * "data: " frames are ignored; malformed frames are skipped.
     */
    private ChatResponse assembleStreamingResponse(Stream<String> lines,
                                                   Consumer<String> tokenCallback) {
        StringBuilder contentBuilder = new StringBuilder();
        String responseId    = null;
        String responseModel = null;
        String finishReason  = null;

        for (String line : (Iterable<String>) lines::iterator) {
            if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) continue;
            if (SSE_DONE.equals(line.strip())) break;

            String json = line.substring(SSE_DATA_PREFIX.length());
            StreamingChunk chunk;
            try {
                chunk = objectMapper.readValue(json, StreamingChunk.class);
            } catch (JsonProcessingException e) {
                log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", config.name(), json);
                continue;
            }

            if (responseId == null)    responseId    = chunk.id();
            if (responseModel == null) responseModel = chunk.model();

            if (chunk.choices() == null || chunk.choices().isEmpty()) continue;

            StreamingChunk.ChunkChoice choice = chunk.choices().get(0);
            if (choice.finishReason() != null) finishReason = choice.finishReason();

            StreamingChunk.DeltaMessage delta = choice.delta();
            if (delta == null || delta.content() == null || delta.content().isEmpty()) continue;

            contentBuilder.append(delta.content());
            if (tokenCallback != null) {
                tokenCallback.accept(delta.content());
            }
        }

        ChatResponse.Choice choice = new ChatResponse.Choice(
                0, Message.assistant(contentBuilder.toString()), finishReason);
        return new ChatResponse(responseId, responseModel, List.of(choice), null);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ChatRequest withDefaults(ChatRequest request, boolean streaming) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }
        String model = request.model();
        if (model == null || model.isBlank()) {
            model = config.model();
        }
        return request.toBuilder()
                .model(model)
                .stream(streaming)
                .build();
    }

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                // Streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(streaming ? config.timeoutSeconds() * 2L : config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.appTitle() != null && !config.appTitle().isBlank()) {
            builder.header("X-Title", config.appTitle());
        }
        return builder.build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), body), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    /** First lines of an error body, for the exception message. */
    private static String snippet(Stream<String> lines) {
        if (lines == null) return "";
        try (lines) {
            StringBuilder sb = new StringBuilder();
            lines.limit(20).forEach(line -> {
                if (sb.length() >= 2048) return;
                if (sb.length() > 0) sb.append('\n');
                sb.append(line);
            });
            return sb.toString();
        }
    }

    private static void closeQuietly(Stream<String> lines) {
        if (lines != null) lines.close();
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}

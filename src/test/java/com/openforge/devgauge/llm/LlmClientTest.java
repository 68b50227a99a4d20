package com.openforge.devgauge.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.devgauge.config.AppConfig;
import com.openforge.devgauge.llm.model.ChatRequest;
import com.openforge.devgauge.llm.model.ChatResponse;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmClientTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private MockWebServer server;
    private LlmClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/v1").toString();
        LlmProperties properties = new LlmProperties("test", baseUrl, "sk-test", "default/model", "devgauge", 5);
        client = new LlmClient(new AppConfig().httpClient(), objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldSendRequestWithDefaultsAndParseResponse() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"id": "gen-1", "model": "default/model",
                         "choices": [{"index": 0, "message": {"role": "assistant", "content": "Hello"},
                                      "finish_reason": "stop"}],
                         "usage": {"prompt_tokens": 5, "completion_tokens": 1, "total_tokens": 6}}"""));

        ChatResponse response = client.chat(ChatRequest.of(null, "be brief", "hi"));

        assertEquals("Hello", response.text());
        assertEquals("stop", response.choices().get(0).finishReason());
        assertEquals(6, response.usage().totalTokens());

        RecordedRequest recorded = server.takeRequest();
        assertEquals("/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer sk-test", recorded.getHeader("Authorization"));
        assertEquals("devgauge", recorded.getHeader("X-Title"));
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("default/model", body.get("model").asText());
        assertFalse(body.get("stream").asBoolean());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("hi", body.get("messages").get(1).get("content").asText());
    }

    @Test
    void shouldAssembleStreamedFragmentsInOrder() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("""
                        : keep-alive

                        data: {"id":"gen-2","model":"m","choices":[{"index":0,"delta":{"role":"assistant"}}]}

                        data: {"id":"gen-2","choices":[{"index":0,"delta":{"content":"Hel"}}]}

                        data: not-json

                        data: {"id":"gen-2","choices":[{"index":0,"delta":{"content":"lo"},"finish_reason":"stop"}]}

                        data: [DONE]

                        """));
        List<String> fragments = new ArrayList<>();

        ChatResponse response = client.streamChat(ChatRequest.of("m", null, "hi"), fragments::add);

        assertEquals(List.of("Hel", "lo"), fragments);
        assertEquals("Hello", response.text());
        assertEquals("gen-2", response.id());
        assertEquals("stop", response.choices().get(0).finishReason());
        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertTrue(body.get("stream").asBoolean());
        assertEquals(1, body.get("messages").size());
    }

    @Test
    void shouldRaiseRateLimitOn429() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        assertThrows(LlmClient.LlmRateLimitException.class,
                () -> client.chat(ChatRequest.of("m", null, "hi")));
    }

    @Test
    void shouldRaiseRateLimitOn429WhileStreaming() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThrows(LlmClient.LlmRateLimitException.class,
                () -> client.streamChat(ChatRequest.of("m", null, "hi"), token -> { }));
    }

    @Test
    void shouldIncludeBodyInServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("upstream exploded"));

        LlmClient.LlmException ex = assertThrows(LlmClient.LlmException.class,
                () -> client.streamChat(ChatRequest.of("m", null, "hi"), token -> { }));

        assertTrue(ex.getMessage().contains("HTTP 500"));
        assertTrue(ex.getMessage().contains("upstream exploded"));
    }

    @Test
    void shouldWrapUnparseableBody() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        LlmClient.LlmException ex = assertThrows(LlmClient.LlmException.class,
                () -> client.chat(ChatRequest.of("m", null, "hi")));

        assertInstanceOf(JsonProcessingException.class, ex.getCause());
    }
}

package com.openforge.devgauge.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * Wire shape: {"model": "...", "stream": true|false, "messages": [{role, content}]}
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        Boolean stream,
        List<Message> messages
) {

    /**
     * Builds the (system, user) pair every call in this service uses.
     * A blank system prompt is omitted from the message list.
     */
    public static ChatRequest of(String model, String systemPrompt, String userPrompt) {
        List<Message> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Message.system(systemPrompt));
        }
        messages.add(Message.user(userPrompt));
        return ChatRequest.builder()
                .model(model)
                .stream(false)
                .messages(List.copyOf(messages))
                .build();
    }
}

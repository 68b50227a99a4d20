package com.openforge.devgauge.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Represents one SSE data frame from a streaming /chat/completions response.
 *
 * Wire format (one line from the stream):
 *   data: {"id":"gen-xxx","choices":[{"index":0,"delta":{"content":"Hello"},"finish_reason":null}]}
 *
 * Last frame:
 *   data: [DONE]
 *
 * Only {@code choices[0].delta.content} is consumed; fragments are concatenated
 * in arrival order to form the full reply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String model,
        List<ChunkChoice> choices
) {

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    /**
     * Sparse message delta. The first chunk usually carries {"role":"assistant"},
     * subsequent chunks carry {"content":"token"}.
     */
    public record DeltaMessage(
            String role,
            String content
    ) {}
}

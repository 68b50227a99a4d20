package com.openforge.devgauge.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single entry in the "messages" array sent to /chat/completions.
 *
 * role variants:
 *   "system"   : instructions for the call (scoring, synthesis, chat, extraction)
 *   "user"     : the rendered prompt
 *   "assistant": model reply
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    public static Message system(String content) {
        return new Message("system", content);
    }

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}
